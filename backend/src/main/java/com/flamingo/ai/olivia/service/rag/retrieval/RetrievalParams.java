package com.flamingo.ai.olivia.service.rag.retrieval;

/**
 * Retrieval settings derived from one query.
 *
 * @param reasoning diagnostic explanation, logged but never acted on
 */
public record RetrievalParams(
    int topK, double minScore, boolean expandQuery, QueryComplexity complexity, String reasoning) {

  /** Applies the system-wide ceiling on result count and floor on similarity. */
  public RetrievalParams clamp(int maxTopK, double minScoreFloor) {
    return new RetrievalParams(
        Math.min(topK, maxTopK),
        Math.max(minScore, minScoreFloor),
        expandQuery,
        complexity,
        reasoning);
  }
}
