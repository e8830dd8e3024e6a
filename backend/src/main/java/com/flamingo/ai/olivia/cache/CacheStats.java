package com.flamingo.ai.olivia.cache;

import java.time.Instant;

/** Point-in-time view of the tiered cache. */
public record CacheStats(
    int memorySize,
    int memoryMaxSize,
    long hits,
    long misses,
    long sets,
    long deletes,
    long errors,
    double hitRate,
    Instant lastReset) {}
