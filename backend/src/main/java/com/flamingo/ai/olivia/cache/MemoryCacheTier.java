package com.flamingo.ai.olivia.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.olivia.config.CacheConfig;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Bounded in-process tier with exact LRU eviction and per-entry expiry.
 *
 * <p>All operations are serialized through one lock. Every read and write first drops expired
 * entries, then applies the capacity bound by evicting the least recently accessed key.
 */
@Component
@Slf4j
public class MemoryCacheTier implements CacheTier {

  private final int maxSize;
  private final Duration defaultTtl;
  private final Clock clock;

  private final ReentrantLock lock = new ReentrantLock();

  // access-order: get() moves an entry to the most-recent end
  private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>(16, 0.75f, true);

  @Autowired
  public MemoryCacheTier(CacheConfig cacheConfig, Clock cacheClock) {
    this(cacheConfig.getMaxSize(), cacheConfig.getDefaultTtl(), cacheClock);
  }

  @VisibleForTesting
  public MemoryCacheTier(int maxSize, Duration defaultTtl, Clock clock) {
    if (maxSize <= 0) {
      throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
    }
    this.maxSize = maxSize;
    this.defaultTtl = defaultTtl;
    this.clock = clock;
  }

  @Override
  public Optional<CachedValue> get(String key) {
    lock.lock();
    try {
      removeExpired(clock.millis());
      Entry entry = entries.get(key);
      return entry == null
          ? Optional.empty()
          : Optional.of(new CachedValue(entry.value(), entry.expiresAtMillis()));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean set(String key, JsonNode value, Duration ttl) {
    Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
    lock.lock();
    try {
      long now = clock.millis();
      removeExpired(now);
      entries.put(key, new Entry(value, now + effectiveTtl.toMillis()));
      evictOverflow();
      return true;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean delete(String key) {
    lock.lock();
    try {
      return entries.remove(key) != null;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int clearPattern(String prefix) {
    lock.lock();
    try {
      int removed = 0;
      Iterator<String> keys = entries.keySet().iterator();
      while (keys.hasNext()) {
        if (keys.next().startsWith(prefix)) {
          keys.remove();
          removed++;
        }
      }
      return removed;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  public int getMaxSize() {
    return maxSize;
  }

  private void removeExpired(long now) {
    entries.values().removeIf(entry -> entry.expiresAtMillis() <= now);
  }

  private void evictOverflow() {
    Iterator<Map.Entry<String, Entry>> eldest = entries.entrySet().iterator();
    while (entries.size() > maxSize && eldest.hasNext()) {
      String evicted = eldest.next().getKey();
      eldest.remove();
      log.debug("Evicted least recently used cache key {}", evicted);
    }
  }

  private record Entry(JsonNode value, long expiresAtMillis) {}
}
