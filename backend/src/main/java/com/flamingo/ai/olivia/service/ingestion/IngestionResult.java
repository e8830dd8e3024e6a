package com.flamingo.ai.olivia.service.ingestion;

/**
 * Outcome of ingesting one file.
 *
 * @param chunkCount chunks written to the index; zero means nothing could be extracted
 * @param chunkSize chunk size chosen for the file
 */
public record IngestionResult(String source, int chunkCount, int chunkSize, int totalPages) {

  public boolean hasContent() {
    return chunkCount > 0;
  }
}
