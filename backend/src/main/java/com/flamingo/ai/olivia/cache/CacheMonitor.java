package com.flamingo.ai.olivia.cache;

import com.flamingo.ai.olivia.config.CacheConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically checks cache health, raises alerts and purges expired durable rows.
 *
 * <p>Each pass also records a statistics snapshot; the bounded history feeds {@link
 * #getMetricsHistory(Duration)} and {@link #getPerformanceReport()}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CacheMonitor {

  private static final int MAX_RECENT_ALERTS = 50;
  private static final Duration ALERT_SUMMARY_WINDOW = Duration.ofHours(24);

  private final TieredCacheService cacheService;
  private final CacheConfig cacheConfig;
  private final Clock cacheClock;
  private final MeterRegistry meterRegistry;

  private final Deque<Alert> recentAlerts = new ArrayDeque<>();
  private final Deque<MetricsSnapshot> history = new ArrayDeque<>();

  /** A threshold breach observed by the monitor. */
  public record Alert(String type, String message, double value, double threshold, Instant at) {}

  /** Cache statistics as seen by one monitor pass. */
  public record MetricsSnapshot(Instant at, CacheStats stats, double errorRate) {}

  @Scheduled(
      fixedDelayString = "${cache.monitor.interval-ms:60000}",
      initialDelayString = "${cache.monitor.interval-ms:60000}")
  public void runChecks() {
    recordSnapshot();
    checkAlerts();
    int purged = cacheService.cleanupExpired();
    log.debug("Cache monitor pass complete, purged {} expired durable entries", purged);
  }

  /** Appends the current statistics to the history, dropping the oldest beyond its bound. */
  public MetricsSnapshot recordSnapshot() {
    MetricsSnapshot snapshot =
        new MetricsSnapshot(
            cacheClock.instant(), cacheService.getStats(), cacheService.errorRate());
    int limit = Math.max(1, cacheConfig.getMonitor().getHistorySize());
    synchronized (history) {
      history.addLast(snapshot);
      while (history.size() > limit) {
        history.removeFirst();
      }
    }
    return snapshot;
  }

  /**
   * Evaluates alert thresholds against the current statistics.
   *
   * @return alerts raised by this evaluation
   */
  public List<Alert> checkAlerts() {
    CacheConfig.Monitor monitor = cacheConfig.getMonitor();
    CacheStats stats = cacheService.getStats();
    long lookups = stats.hits() + stats.misses();

    List<Alert> raised = new ArrayList<>();
    if (lookups >= monitor.getMinOperations()
        && stats.hitRate() < monitor.getHitRateAlertThreshold()) {
      raised.add(
          new Alert(
              "hit_rate_low",
              String.format(
                  "Cache hit rate dropped to %.2f%% (after %d lookups)",
                  stats.hitRate() * 100, lookups),
              stats.hitRate(),
              monitor.getHitRateAlertThreshold(),
              cacheClock.instant()));
    }

    double errorRate = cacheService.errorRate();
    if (errorRate > monitor.getErrorRateAlertThreshold()) {
      raised.add(
          new Alert(
              "error_rate_high",
              String.format("Cache error rate is %.2f%%", errorRate * 100),
              errorRate,
              monitor.getErrorRateAlertThreshold(),
              cacheClock.instant()));
    }

    for (Alert alert : raised) {
      log.warn("Cache alert [{}]: {}", alert.type(), alert.message());
      meterRegistry.counter("cache.alerts", "type", alert.type()).increment();
      record(alert);
    }
    return raised;
  }

  public List<Alert> getRecentAlerts() {
    synchronized (recentAlerts) {
      return List.copyOf(recentAlerts);
    }
  }

  /** Snapshots taken within {@code window} of now, oldest first. */
  public List<MetricsSnapshot> getMetricsHistory(Duration window) {
    Instant cutoff = cacheClock.instant().minus(window);
    return snapshots().stream()
        .filter(snapshot -> snapshot.at().isAfter(cutoff))
        .collect(Collectors.toList());
  }

  /**
   * Averages, trends and recommendations over the most recent snapshots.
   *
   * @return empty until the first snapshot has been recorded
   */
  public Optional<PerformanceReport> getPerformanceReport() {
    List<MetricsSnapshot> all = snapshots();
    if (all.isEmpty()) {
      return Optional.empty();
    }
    CacheConfig.Monitor monitor = cacheConfig.getMonitor();
    int window = Math.max(1, monitor.getReportSnapshots());
    List<MetricsSnapshot> recent = all.subList(Math.max(0, all.size() - window), all.size());
    MetricsSnapshot first = recent.get(0);
    MetricsSnapshot last = recent.get(recent.size() - 1);

    double averageHitRate = average(recent, snapshot -> snapshot.stats().hitRate());
    double averageErrorRate = average(recent, MetricsSnapshot::errorRate);
    PerformanceReport.Summary summary =
        new PerformanceReport.Summary(
            Duration.between(first.at(), last.at()).toMillis() / 3_600_000.0,
            recent.size(),
            averageHitRate,
            averageErrorRate,
            sinceFirst(lookups(first.stats()), lookups(last.stats())),
            sinceFirst(first.stats().errors(), last.stats().errors()));

    PerformanceReport.Trends trends = null;
    if (recent.size() >= 2) {
      double firstHitRate = first.stats().hitRate();
      trends =
          new PerformanceReport.Trends(
              firstHitRate > 0 ? (last.stats().hitRate() - firstHitRate) / firstHitRate : null,
              last.errorRate() - first.errorRate(),
              last.stats().memorySize() - first.stats().memorySize());
    }

    List<String> recommendations = new ArrayList<>();
    if (averageHitRate < monitor.getTargetHitRate()) {
      recommendations.add(
          "Consider increasing cache TTL values or warming frequently requested entries");
    }
    if (averageErrorRate > monitor.getErrorRateAlertThreshold()) {
      recommendations.add(
          "Cache operations are failing; check that the durable cache database is reachable");
    }
    double averageFill =
        average(
            recent,
            snapshot ->
                snapshot.stats().memoryMaxSize() > 0
                    ? (double) snapshot.stats().memorySize() / snapshot.stats().memoryMaxSize()
                    : 0.0);
    if (averageFill > monitor.getMemoryPressureThreshold()) {
      recommendations.add(
          "Memory tier is nearly full; consider raising cache.max-size to reduce evictions");
    }

    return Optional.of(
        new PerformanceReport(
            summary, trends, recommendations, summarizeAlerts(), cacheClock.instant()));
  }

  private PerformanceReport.AlertSummary summarizeAlerts() {
    Instant cutoff = cacheClock.instant().minus(ALERT_SUMMARY_WINDOW);
    List<Alert> alerts =
        getRecentAlerts().stream()
            .filter(alert -> alert.at().isAfter(cutoff))
            .collect(Collectors.toList());
    Map<String, Long> byType =
        alerts.stream()
            .collect(Collectors.groupingBy(Alert::type, TreeMap::new, Collectors.counting()));
    Alert mostRecent = alerts.isEmpty() ? null : alerts.get(alerts.size() - 1);
    return new PerformanceReport.AlertSummary(alerts.size(), byType, mostRecent);
  }

  private List<MetricsSnapshot> snapshots() {
    synchronized (history) {
      return List.copyOf(history);
    }
  }

  private void record(Alert alert) {
    synchronized (recentAlerts) {
      recentAlerts.addLast(alert);
      while (recentAlerts.size() > MAX_RECENT_ALERTS) {
        recentAlerts.removeFirst();
      }
    }
  }

  private static long lookups(CacheStats stats) {
    return stats.hits() + stats.misses();
  }

  // counters restart on reset, so a drop means everything since the reset
  private static long sinceFirst(long first, long last) {
    return last >= first ? last - first : last;
  }

  private static double average(
      List<MetricsSnapshot> snapshots, ToDoubleFunction<MetricsSnapshot> metric) {
    return snapshots.stream().mapToDouble(metric).average().orElse(0.0);
  }
}
