package com.flamingo.ai.olivia.service.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.olivia.api.dto.response.CacheReport;
import com.flamingo.ai.olivia.cache.CacheHealth;
import com.flamingo.ai.olivia.cache.CacheMonitor;
import com.flamingo.ai.olivia.cache.CacheStats;
import com.flamingo.ai.olivia.cache.PerformanceReport;
import com.flamingo.ai.olivia.cache.TieredCacheService;
import com.flamingo.ai.olivia.service.rag.retrieval.RetrievalQualityMetrics;
import com.flamingo.ai.olivia.service.rag.semantic.SemanticAnswerCache;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("HealthServiceImpl Tests")
class HealthServiceImplTest {

  private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

  @Mock private TieredCacheService cacheService;
  @Mock private CacheMonitor cacheMonitor;
  @Mock private SemanticAnswerCache semanticCache;

  private HealthServiceImpl healthService;

  private final CacheStats stats = new CacheStats(12, 10000, 30, 10, 25, 2, 1, 0.75, NOW);
  private final CacheHealth health = new CacheHealth(CacheHealth.HEALTHY, true, true, true);

  @BeforeEach
  void setUp() {
    healthService =
        new HealthServiceImpl(
            cacheService,
            cacheMonitor,
            new RetrievalQualityMetrics(new SimpleMeterRegistry()),
            semanticCache,
            Clock.fixed(NOW, ZoneOffset.UTC));
    lenient().when(cacheService.getStats()).thenReturn(stats);
    lenient().when(cacheService.healthCheck()).thenReturn(health);
  }

  @Test
  @DisplayName("Should combine cache stats, health, alerts and retrieval quality")
  void shouldBuildCacheReport() {
    CacheMonitor.Alert alert =
        new CacheMonitor.Alert("hit_rate_low", "Cache hit rate dropped", 0.05, 0.1, NOW);
    when(cacheMonitor.getRecentAlerts()).thenReturn(List.of(alert));
    when(semanticCache.isEnabled()).thenReturn(true);

    CacheReport report = healthService.getCacheReport();

    assertThat(report.getStats()).isEqualTo(stats);
    assertThat(report.getHealth()).isEqualTo(health);
    assertThat(report.getRecentAlerts()).containsExactly(alert);
    assertThat(report.getRetrievalQuality()).containsEntry("total_queries", 0L);
    assertThat(report.isSemanticCacheEnabled()).isTrue();
    assertThat(report.getTimestamp()).isEqualTo(NOW);
  }

  @Test
  @DisplayName("Should reset metrics after capturing the report")
  void shouldResetAfterCapturing() {
    CacheReport before = healthService.resetCacheMetrics();

    assertThat(before.getStats().hits()).isEqualTo(30);
    InOrder order = inOrder(cacheService);
    order.verify(cacheService).getStats();
    order.verify(cacheService).resetMetrics();
  }

  @Test
  @DisplayName("Should return monitor history for the requested window")
  void shouldReturnCacheHistory() {
    CacheMonitor.MetricsSnapshot snapshot = new CacheMonitor.MetricsSnapshot(NOW, stats, 0.0);
    when(cacheMonitor.getMetricsHistory(Duration.ofHours(2))).thenReturn(List.of(snapshot));

    assertThat(healthService.getCacheHistory(Duration.ofHours(2))).containsExactly(snapshot);
  }

  @Test
  @DisplayName("Should reject a non-positive history window")
  void shouldRejectEmptyHistoryWindow() {
    assertThatThrownBy(() -> healthService.getCacheHistory(Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(cacheMonitor);
  }

  @Test
  @DisplayName("Should pass the monitor performance report through")
  void shouldReturnPerformanceReport() {
    PerformanceReport report =
        new PerformanceReport(
            new PerformanceReport.Summary(0.5, 2, 0.75, 0.0, 40, 1),
            null,
            List.of(),
            new PerformanceReport.AlertSummary(0, Map.of(), null),
            NOW);
    when(cacheMonitor.getPerformanceReport()).thenReturn(Optional.of(report));

    assertThat(healthService.getCachePerformanceReport()).contains(report);
  }
}
