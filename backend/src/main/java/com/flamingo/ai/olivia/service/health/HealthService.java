package com.flamingo.ai.olivia.service.health;

import com.flamingo.ai.olivia.api.dto.response.CacheReport;
import com.flamingo.ai.olivia.cache.CacheMonitor;
import com.flamingo.ai.olivia.cache.PerformanceReport;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/** Service for cache health and statistics. */
public interface HealthService {

  CacheReport getCacheReport();

  /** Zeroes the cache hit/miss counters; returns the report taken just before. */
  CacheReport resetCacheMetrics();

  /** Monitor snapshots recorded within {@code window}, oldest first. */
  List<CacheMonitor.MetricsSnapshot> getCacheHistory(Duration window);

  Optional<PerformanceReport> getCachePerformanceReport();
}
