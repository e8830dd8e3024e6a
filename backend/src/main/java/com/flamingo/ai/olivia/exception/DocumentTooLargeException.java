package com.flamingo.ai.olivia.exception;

/** Thrown when an upload exceeds {@code rag.ingestion.max-file-size-bytes}. */
public class DocumentTooLargeException extends RuntimeException {

  private final long maxBytes;

  public DocumentTooLargeException(String filename, long sizeBytes, long maxBytes) {
    super(String.format("File '%s' is %d bytes, limit is %d", filename, sizeBytes, maxBytes));
    this.maxBytes = maxBytes;
  }

  public String getUserMessage() {
    return "File too large. Maximum size is " + maxBytes / (1024 * 1024) + "MB";
  }
}
