package com.flamingo.ai.olivia.cache;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Operation counters for the tiered cache.
 *
 * <p>Micrometer counters are monotonic, so a parallel set of resettable counters backs the
 * in-process statistics and hit rate.
 */
public class CacheMetrics {

  private final MeterRegistry meterRegistry;

  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  private final AtomicLong sets = new AtomicLong();
  private final AtomicLong deletes = new AtomicLong();
  private final AtomicLong errors = new AtomicLong();
  private volatile Instant lastReset = Instant.now();

  public CacheMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordHit(String tier) {
    hits.incrementAndGet();
    meterRegistry.counter("cache.hits", "tier", tier).increment();
  }

  public void recordMiss() {
    misses.incrementAndGet();
    meterRegistry.counter("cache.misses").increment();
  }

  public void recordSet() {
    sets.incrementAndGet();
    meterRegistry.counter("cache.sets").increment();
  }

  public void recordDelete() {
    deletes.incrementAndGet();
    meterRegistry.counter("cache.deletes").increment();
  }

  public void recordError(String operation) {
    errors.incrementAndGet();
    meterRegistry.counter("cache.errors", "operation", operation).increment();
  }

  public long getHits() {
    return hits.get();
  }

  public long getMisses() {
    return misses.get();
  }

  public long getSets() {
    return sets.get();
  }

  public long getDeletes() {
    return deletes.get();
  }

  public long getErrors() {
    return errors.get();
  }

  public Instant getLastReset() {
    return lastReset;
  }

  public double hitRate() {
    long total = hits.get() + misses.get();
    return total > 0 ? (double) hits.get() / total : 0.0;
  }

  /** Error share over all recorded operations. */
  public double errorRate() {
    long total = hits.get() + misses.get() + sets.get() + deletes.get();
    return total > 0 ? (double) errors.get() / total : 0.0;
  }

  public void reset() {
    hits.set(0);
    misses.set(0);
    sets.set(0);
    deletes.set(0);
    errors.set(0);
    lastReset = Instant.now();
  }
}
