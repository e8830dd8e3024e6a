package com.flamingo.ai.olivia.service.rag.retrieval;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Running statistics about retrieval quality, mirrored into Micrometer. */
@Component
@Slf4j
public class RetrievalQualityMetrics {

  static final double LOW_TOP_SCORE = 0.2;

  private final MeterRegistry meterRegistry;

  private long totalQueries;
  private double avgRetrievedDocs;
  private double avgSimilarityScore;
  private long lowQualityRetrievals;
  private final Map<QueryComplexity, Long> complexityDistribution =
      new EnumMap<>(QueryComplexity.class);

  public RetrievalQualityMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    for (QueryComplexity complexity : QueryComplexity.values()) {
      complexityDistribution.put(complexity, 0L);
    }
  }

  /**
   * Records one retrieval.
   *
   * @param docsReturned documents left after filtering
   * @param scores raw scores of every hit before filtering
   */
  public synchronized void record(RetrievalParams params, int docsReturned, List<Double> scores) {
    totalQueries++;
    if (docsReturned > 0) {
      avgRetrievedDocs += (docsReturned - avgRetrievedDocs) / totalQueries;
    }
    double topScore = 0.0;
    if (!scores.isEmpty()) {
      double sum = 0.0;
      topScore = Double.NEGATIVE_INFINITY;
      for (double score : scores) {
        sum += score;
        topScore = Math.max(topScore, score);
      }
      avgSimilarityScore += (sum / scores.size() - avgSimilarityScore) / totalQueries;
    }
    complexityDistribution.merge(params.complexity(), 1L, Long::sum);

    boolean lowQuality =
        docsReturned < params.topK() * 0.5 || (!scores.isEmpty() && topScore < LOW_TOP_SCORE);
    if (lowQuality) {
      lowQualityRetrievals++;
      meterRegistry.counter("rag.retrieval.low_quality").increment();
    }
    meterRegistry
        .counter("rag.retrieval.queries", "complexity", params.complexity().getValue())
        .increment();
    meterRegistry.summary("rag.retrieval.docs").record(docsReturned);
    log.debug(
        "Retrieval recorded: complexity={}, docs={}, topScore={}, lowQuality={}",
        params.complexity().getValue(),
        docsReturned,
        topScore,
        lowQuality);
  }

  public synchronized Map<String, Object> getSummary() {
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("total_queries", totalQueries);
    summary.put("avg_retrieved_docs", avgRetrievedDocs);
    summary.put("avg_similarity_score", avgSimilarityScore);
    Map<String, Long> distribution = new LinkedHashMap<>();
    complexityDistribution.forEach(
        (complexity, count) -> distribution.put(complexity.getValue(), count));
    summary.put("complexity_distribution", distribution);
    summary.put("low_quality_retrievals", lowQualityRetrievals);
    summary.put("low_quality_rate", (double) lowQualityRetrievals / Math.max(totalQueries, 1));
    return summary;
  }
}
