package com.flamingo.ai.olivia.service.rag;

import com.flamingo.ai.olivia.elasticsearch.DocumentChunk;

/** A stored chunk as shown when inspecting a document. */
public record ChunkPreview(String content, int page, int totalPages, int startIndex) {

  public static ChunkPreview from(DocumentChunk chunk) {
    return new ChunkPreview(
        chunk.getContent(), chunk.getPage(), chunk.getTotalPages(), chunk.getStartIndex());
  }
}
