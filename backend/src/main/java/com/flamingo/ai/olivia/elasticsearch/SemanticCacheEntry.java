package com.flamingo.ai.olivia.elasticsearch;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A previously generated answer, indexed by the embedding of the question that produced it. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SemanticCacheEntry implements AbstractElasticsearchIndexService.ScoredDocument {

  private String id;
  private Long userId;
  private String query;
  private String response;

  /** Citations serialized as a JSON array. */
  private String sourcesJson;

  private long timestamp;
  private List<Float> embedding;

  @Builder.Default private Double relevanceScore = 0.0;
}
