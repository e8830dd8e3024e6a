package com.flamingo.ai.olivia.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.olivia.config.CacheConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Two-level cache: a bounded in-memory tier in front of a durable JDBC tier.
 *
 * <p>Reads check memory first and promote durable hits into memory for the rest of their
 * lifetime. Writes go to both tiers and succeed when either does. Failures of the durable tier
 * and unreadable payloads are logged, counted and reported as misses; they never reach the
 * caller.
 *
 * <p>{@link #getOrSet} is not atomic: concurrent misses on the same key may each compute and
 * write. Compute functions must therefore be idempotent.
 */
@Service
@Slf4j
public class TieredCacheService {

  private static final String MEMORY = "memory";
  private static final String DURABLE = "durable";

  private final MemoryCacheTier memoryTier;
  private final JdbcCacheTier durableTier;
  private final ObjectMapper objectMapper;
  private final CacheConfig cacheConfig;
  private final Clock clock;
  private final CacheMetrics metrics;

  public TieredCacheService(
      MemoryCacheTier memoryTier,
      JdbcCacheTier durableTier,
      ObjectMapper objectMapper,
      CacheConfig cacheConfig,
      Clock cacheClock,
      MeterRegistry meterRegistry) {
    this.memoryTier = memoryTier;
    this.durableTier = durableTier;
    this.objectMapper = objectMapper;
    this.cacheConfig = cacheConfig;
    this.clock = cacheClock;
    this.metrics = new CacheMetrics(meterRegistry);
  }

  public <T> Optional<T> get(String key, Class<T> type) {
    return get(key, objectMapper.constructType(type));
  }

  public <T> Optional<T> get(String key, TypeReference<T> type) {
    return get(key, objectMapper.getTypeFactory().constructType(type));
  }

  public boolean set(String key, Object value) {
    return set(key, value, null);
  }

  /**
   * Writes {@code value} to both tiers.
   *
   * @param ttl time to live, or {@code null} for the configured default
   * @return {@code true} if at least one tier accepted the write
   */
  public boolean set(String key, Object value, Duration ttl) {
    if (value == null) {
      log.debug("Refusing to cache null value for key {}", key);
      return false;
    }
    JsonNode node;
    try {
      node = objectMapper.valueToTree(value);
    } catch (IllegalArgumentException e) {
      log.warn("Cannot serialize value for cache key {}: {}", key, e.getMessage());
      metrics.recordError("serialize");
      return false;
    }

    boolean memoryOk = memoryTier.set(key, node, ttl);
    boolean durableOk;
    try {
      durableOk = durableTier.set(key, node, ttl);
    } catch (RuntimeException e) {
      log.warn("Durable cache write failed for key {}: {}", key, e.getMessage());
      metrics.recordError("set");
      durableOk = false;
    }

    if (memoryOk || durableOk) {
      metrics.recordSet();
      return true;
    }
    return false;
  }

  public boolean delete(String key) {
    boolean memoryDeleted = memoryTier.delete(key);
    boolean durableDeleted = false;
    try {
      durableDeleted = durableTier.delete(key);
    } catch (RuntimeException e) {
      log.warn("Durable cache delete failed for key {}: {}", key, e.getMessage());
      metrics.recordError("delete");
    }
    if (memoryDeleted || durableDeleted) {
      metrics.recordDelete();
      return true;
    }
    return false;
  }

  /** Whether a live entry exists in either tier. Does not touch hit/miss counters. */
  public boolean exists(String key) {
    return memoryTier.get(key).isPresent() || readDurable(key).isPresent();
  }

  /**
   * Removes every key starting with {@code prefix} from both tiers.
   *
   * @return total entries removed across tiers
   */
  public int clearPattern(String prefix) {
    int removed = memoryTier.clearPattern(prefix);
    try {
      removed += durableTier.clearPattern(prefix);
    } catch (RuntimeException e) {
      log.warn("Durable cache pattern clear failed for prefix {}: {}", prefix, e.getMessage());
      metrics.recordError("clear_pattern");
    }
    log.debug("Cleared {} cache entries with prefix {}", removed, prefix);
    return removed;
  }

  public <T> T getOrSet(String key, Class<T> type, Duration ttl, Supplier<T> compute) {
    return getOrSet(key, objectMapper.constructType(type), ttl, compute);
  }

  public <T> T getOrSet(String key, TypeReference<T> type, Duration ttl, Supplier<T> compute) {
    return getOrSet(key, objectMapper.getTypeFactory().constructType(type), ttl, compute);
  }

  public CacheStats getStats() {
    return new CacheStats(
        memoryTier.size(),
        memoryTier.getMaxSize(),
        metrics.getHits(),
        metrics.getMisses(),
        metrics.getSets(),
        metrics.getDeletes(),
        metrics.getErrors(),
        metrics.hitRate(),
        metrics.getLastReset());
  }

  public void resetMetrics() {
    metrics.reset();
  }

  public double errorRate() {
    return metrics.errorRate();
  }

  public CacheHealth healthCheck() {
    boolean durableAvailable;
    try {
      durableAvailable = durableTier.ping();
    } catch (RuntimeException e) {
      log.warn("Durable cache tier unreachable: {}", e.getMessage());
      durableAvailable = false;
    }
    boolean metricsHealthy =
        metrics.errorRate() <= cacheConfig.getMonitor().getErrorRateAlertThreshold();
    String status = durableAvailable ? CacheHealth.HEALTHY : CacheHealth.DEGRADED;
    return new CacheHealth(status, true, durableAvailable, metricsHealthy);
  }

  /** Purges expired rows from the durable tier; returns the number removed. */
  public int cleanupExpired() {
    try {
      return durableTier.cleanupExpired();
    } catch (RuntimeException e) {
      log.warn("Durable cache cleanup failed: {}", e.getMessage());
      metrics.recordError("cleanup");
      return 0;
    }
  }

  // --- Namespace helpers ---

  public Optional<Map<String, Object>> getSessionData(String sessionId) {
    return get(CacheKeys.session(sessionId), new TypeReference<Map<String, Object>>() {});
  }

  public boolean setSessionData(String sessionId, Map<String, Object> data) {
    return set(CacheKeys.session(sessionId), data, cacheConfig.getTtl().getSessions());
  }

  public Optional<String> getTranslation(String langPair, String text) {
    return get(CacheKeys.translation(langPair, text), String.class);
  }

  public boolean setTranslation(String langPair, String text, String translated) {
    return set(
        CacheKeys.translation(langPair, text), translated, cacheConfig.getTtl().getTranslation());
  }

  public Optional<List<Map<String, Object>>> getUserCollections(long userId) {
    return get(
        CacheKeys.userCollections(userId), new TypeReference<List<Map<String, Object>>>() {});
  }

  public boolean setUserCollections(long userId, List<Map<String, Object>> collections) {
    return set(
        CacheKeys.userCollections(userId),
        collections,
        cacheConfig.getTtl().getUserCollections());
  }

  public boolean invalidateUserCollections(long userId) {
    return delete(CacheKeys.userCollections(userId));
  }

  public Optional<Map<String, Object>> getUserSettings(long userId) {
    return get(CacheKeys.userSettings(userId), new TypeReference<Map<String, Object>>() {});
  }

  public boolean setUserSettings(long userId, Map<String, Object> settings) {
    return set(CacheKeys.userSettings(userId), settings, cacheConfig.getTtl().getUserSettings());
  }

  public boolean invalidateUserSettings(long userId) {
    return delete(CacheKeys.userSettings(userId));
  }

  public CacheConfig.Ttl ttl() {
    return cacheConfig.getTtl();
  }

  private <T> Optional<T> get(String key, JavaType type) {
    Optional<CachedValue> memoryHit = memoryTier.get(key);
    String tier = MEMORY;
    Optional<CachedValue> hit = memoryHit;
    if (memoryHit.isEmpty()) {
      hit = readDurable(key);
      tier = DURABLE;
      hit.ifPresent(value -> promote(key, value));
    }
    if (hit.isEmpty()) {
      metrics.recordMiss();
      return Optional.empty();
    }

    try {
      T value = objectMapper.convertValue(hit.get().value(), type);
      metrics.recordHit(tier);
      return Optional.ofNullable(value);
    } catch (IllegalArgumentException e) {
      log.warn("Cached payload for key {} does not match {}: {}", key, type, e.getMessage());
      metrics.recordError("deserialize");
      metrics.recordMiss();
      return Optional.empty();
    }
  }

  private <T> T getOrSet(String key, JavaType type, Duration ttl, Supplier<T> compute) {
    Optional<T> cached = get(key, type);
    if (cached.isPresent()) {
      return cached.get();
    }
    T value = compute.get();
    if (value != null) {
      set(key, value, ttl);
    }
    return value;
  }

  private Optional<CachedValue> readDurable(String key) {
    try {
      return durableTier.get(key);
    } catch (RuntimeException e) {
      log.warn("Durable cache read failed for key {}: {}", key, e.getMessage());
      metrics.recordError("get");
      return Optional.empty();
    }
  }

  private void promote(String key, CachedValue value) {
    Duration remaining = null;
    if (value.expiresAtMillis() != null) {
      remaining = Duration.ofMillis(Math.max(1, value.expiresAtMillis() - clock.millis()));
    }
    memoryTier.set(key, value.value(), remaining);
  }
}
