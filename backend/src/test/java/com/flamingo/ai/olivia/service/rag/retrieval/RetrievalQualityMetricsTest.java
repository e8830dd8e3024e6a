package com.flamingo.ai.olivia.service.rag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RetrievalQualityMetrics Tests")
class RetrievalQualityMetricsTest {

  private SimpleMeterRegistry meterRegistry;
  private RetrievalQualityMetrics metrics;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    metrics = new RetrievalQualityMetrics(meterRegistry);
  }

  private static RetrievalParams params(int topK, QueryComplexity complexity) {
    return new RetrievalParams(topK, 0.0, false, complexity, "test");
  }

  @Test
  @DisplayName("Should keep running averages across queries")
  void shouldAverageAcrossQueries() {
    metrics.record(params(4, QueryComplexity.SIMPLE), 4, List.of(0.8, 0.6));
    metrics.record(params(4, QueryComplexity.COMPLEX), 2, List.of(0.4));

    Map<String, Object> summary = metrics.getSummary();

    assertThat(summary).containsEntry("total_queries", 2L);
    assertThat((double) summary.get("avg_retrieved_docs")).isEqualTo(3.0);
    assertThat((double) summary.get("avg_similarity_score")).isCloseTo(0.55, within(1e-9));
    @SuppressWarnings("unchecked")
    Map<String, Long> distribution = (Map<String, Long>) summary.get("complexity_distribution");
    assertThat(distribution)
        .containsEntry("simple", 1L)
        .containsEntry("moderate", 0L)
        .containsEntry("complex", 1L);
  }

  @Test
  @DisplayName("Should flag retrievals that return under half of top_k")
  void shouldFlagTooFewDocuments() {
    metrics.record(params(10, QueryComplexity.MODERATE), 3, List.of(0.9, 0.8, 0.7));

    assertThat(metrics.getSummary()).containsEntry("low_quality_retrievals", 1L);
    assertThat(meterRegistry.counter("rag.retrieval.low_quality").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should flag retrievals whose best score is weak")
  void shouldFlagWeakTopScore() {
    metrics.record(params(2, QueryComplexity.MODERATE), 2, List.of(0.15, 0.1));

    assertThat(metrics.getSummary()).containsEntry("low_quality_rate", 1.0);
  }

  @Test
  @DisplayName("Should report zero rates before any query")
  void shouldReportZeroBeforeQueries() {
    assertThat(metrics.getSummary())
        .containsEntry("total_queries", 0L)
        .containsEntry("low_quality_rate", 0.0);
  }
}
