package com.flamingo.ai.olivia.cache;

/** Result of {@link TieredCacheService#healthCheck()}. */
public record CacheHealth(
    String status, boolean memoryAvailable, boolean durableAvailable, boolean metricsHealthy) {

  public static final String HEALTHY = "healthy";
  public static final String DEGRADED = "degraded";
}
