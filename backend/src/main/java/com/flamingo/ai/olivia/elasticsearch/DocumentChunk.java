package com.flamingo.ai.olivia.elasticsearch;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A chunk of an ingested document as stored in the vector index.
 *
 * <p>Written once per ingestion and never updated; re-ingesting a file deletes its chunks by
 * {@code source} first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentChunk implements AbstractElasticsearchIndexService.ScoredDocument {

  private String id;
  private Long userId;
  private Long collectionId;

  /** File name the chunk was cut from; the deletion key for a document. */
  private String source;

  private String fileType;
  private String title;
  @Builder.Default private int page = 1;
  private int totalPages;

  /** Character offset of the chunk within its page. */
  private int startIndex;

  private String content;
  private List<Float> embedding;

  // Cosine similarity for vector hits, relative BM25 score for keyword hits
  @Builder.Default private Double relevanceScore = 0.0;
}
