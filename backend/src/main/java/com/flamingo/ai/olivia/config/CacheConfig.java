package com.flamingo.ai.olivia.config;

import java.time.Clock;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the two-tier cache. */
@Configuration
@ConfigurationProperties(prefix = "cache")
@Getter
@Setter
public class CacheConfig {

  /** Maximum number of entries held by the in-memory tier. */
  private int maxSize = 10000;

  private Duration defaultTtl = Duration.ofHours(1);

  /** Table backing the durable tier. */
  private String tableName = "app_cache";

  private Ttl ttl = new Ttl();
  private Monitor monitor = new Monitor();

  @Bean
  public Clock cacheClock() {
    return Clock.systemUTC();
  }

  /** Per-namespace time-to-live values. */
  @Getter
  @Setter
  public static class Ttl {
    private Duration llmResponse = Duration.ofHours(24);
    private Duration embeddings = Duration.ofHours(24);
    private Duration vectorResults = Duration.ofHours(1);
    private Duration sessions = Duration.ofHours(24);
    private Duration documentChunks = Duration.ofHours(24);
    private Duration translation = Duration.ofDays(7);
    private Duration userCollections = Duration.ofHours(1);
    private Duration userSettings = Duration.ofHours(24);
    private Duration progress = Duration.ofMinutes(5);
  }

  @Getter
  @Setter
  public static class Monitor {
    /** Read by the monitor's schedule through {@code cache.monitor.interval-ms}. */
    private long intervalMs = 60000;

    private double hitRateAlertThreshold = 0.1;
    private double errorRateAlertThreshold = 0.05;

    /** Operations required before the hit-rate alert is evaluated. */
    private long minOperations = 10;

    /** Statistics snapshots kept for history and reports, one per monitor pass. */
    private int historySize = 1000;

    /** Most recent snapshots a performance report analyses. */
    private int reportSnapshots = 10;

    /** Average hit rate below which a report recommends longer TTLs or warming. */
    private double targetHitRate = 0.7;

    /** Average memory tier fill ratio above which a report recommends a larger tier. */
    private double memoryPressureThreshold = 0.9;
  }
}
