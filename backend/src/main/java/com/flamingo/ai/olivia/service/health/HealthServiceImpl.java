package com.flamingo.ai.olivia.service.health;

import com.flamingo.ai.olivia.api.dto.response.CacheReport;
import com.flamingo.ai.olivia.cache.CacheMonitor;
import com.flamingo.ai.olivia.cache.PerformanceReport;
import com.flamingo.ai.olivia.cache.TieredCacheService;
import com.flamingo.ai.olivia.service.rag.retrieval.RetrievalQualityMetrics;
import com.flamingo.ai.olivia.service.rag.semantic.SemanticAnswerCache;
import io.micrometer.core.annotation.Timed;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of HealthService backed by the cache and retrieval metrics. */
@Service
@RequiredArgsConstructor
@Slf4j
public class HealthServiceImpl implements HealthService {

  private final TieredCacheService cacheService;
  private final CacheMonitor cacheMonitor;
  private final RetrievalQualityMetrics qualityMetrics;
  private final SemanticAnswerCache semanticCache;
  private final Clock cacheClock;

  @Override
  @Timed(value = "health.cache", description = "Time to build the cache report")
  public CacheReport getCacheReport() {
    return CacheReport.builder()
        .stats(cacheService.getStats())
        .health(cacheService.healthCheck())
        .recentAlerts(cacheMonitor.getRecentAlerts())
        .retrievalQuality(qualityMetrics.getSummary())
        .semanticCacheEnabled(semanticCache.isEnabled())
        .timestamp(cacheClock.instant())
        .build();
  }

  @Override
  public CacheReport resetCacheMetrics() {
    CacheReport before = getCacheReport();
    cacheService.resetMetrics();
    log.info(
        "Cache metrics reset after {} hits and {} misses",
        before.getStats().hits(),
        before.getStats().misses());
    return before;
  }

  @Override
  public List<CacheMonitor.MetricsSnapshot> getCacheHistory(Duration window) {
    if (window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("History window must be positive");
    }
    return cacheMonitor.getMetricsHistory(window);
  }

  @Override
  @Timed(value = "health.cache.report", description = "Time to build the performance report")
  public Optional<PerformanceReport> getCachePerformanceReport() {
    return cacheMonitor.getPerformanceReport();
  }
}
