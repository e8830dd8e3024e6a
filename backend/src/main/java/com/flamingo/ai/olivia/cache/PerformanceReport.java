package com.flamingo.ai.olivia.cache;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Analysis of the most recent monitor snapshots.
 *
 * @param trends {@code null} with fewer than two snapshots
 */
public record PerformanceReport(
    Summary summary,
    Trends trends,
    List<String> recommendations,
    AlertSummary alerts,
    Instant generatedAt) {

  /**
   * @param lookups hits plus misses between the first and last snapshot, or since the last reset
   *     when the counters were reset in between
   */
  public record Summary(
      double monitoringHours,
      int snapshots,
      double averageHitRate,
      double averageErrorRate,
      long lookups,
      long errors) {}

  /** @param hitRateChange relative change, {@code null} when the first hit rate was zero */
  public record Trends(Double hitRateChange, double errorRateChange, int memorySizeChange) {}

  public record AlertSummary(
      int total, Map<String, Long> byType, CacheMonitor.Alert mostRecent) {}
}
