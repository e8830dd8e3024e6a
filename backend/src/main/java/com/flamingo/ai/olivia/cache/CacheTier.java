package com.flamingo.ai.olivia.cache;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.Optional;

/**
 * One storage level of the tiered cache.
 *
 * <p>Implementations may throw on I/O failure; {@link TieredCacheService} absorbs and counts those
 * errors so callers only ever see a miss.
 */
public interface CacheTier {

  /** Returns the live entry for {@code key}; expired entries are reported as absent. */
  Optional<CachedValue> get(String key);

  /**
   * Stores {@code value} under {@code key}.
   *
   * @param ttl time to live, or {@code null} for the tier default
   * @return whether the write was applied
   */
  boolean set(String key, JsonNode value, Duration ttl);

  boolean delete(String key);

  /**
   * Removes every key starting with {@code prefix}.
   *
   * @return number of removed entries
   */
  int clearPattern(String prefix);
}
