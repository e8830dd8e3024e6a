package com.flamingo.ai.olivia.cache;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Invalidation cascades triggered by document and collection deletion.
 *
 * <p>Vector-result and LLM-response keys only retain a digest of the query, so entries for an
 * owner are swept by their {@code <namespace>:<userId>:<collectionId>:} prefix rather than looked
 * up one by one. Failures never abort the deletion that triggered them; stale entries age out by
 * TTL.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CacheInvalidationService {

  private final TieredCacheService cacheService;
  private final MeterRegistry meterRegistry;

  /**
   * Clears caches affected by removing one document's vectors.
   *
   * @return number of cache entries removed
   */
  public int invalidateDocument(long userId, long collectionId, String source) {
    int removed = 0;
    try {
      if (cacheService.delete(CacheKeys.documentChunks(userId, collectionId, source))) {
        removed++;
      }
      removed += sweepOwnerResults(userId, collectionId);
      log.info(
          "Invalidated {} cache entries for document '{}' (user={}, collection={})",
          removed,
          source,
          userId,
          collectionId);
      meterRegistry.counter("cache.invalidations", "scope", "document").increment();
    } catch (RuntimeException e) {
      log.warn(
          "Cache invalidation failed for document '{}' (user={}, collection={}): {}",
          source,
          userId,
          collectionId,
          e.getMessage());
    }
    return removed;
  }

  /**
   * Clears caches affected by removing a whole collection, including the user's collection list.
   *
   * @return number of cache entries removed
   */
  public int invalidateCollection(long userId, long collectionId) {
    int removed = 0;
    try {
      removed += cacheService.clearPattern(CacheKeys.chunksPrefix(userId, collectionId));
      removed += sweepOwnerResults(userId, collectionId);
      if (cacheService.invalidateUserCollections(userId)) {
        removed++;
      }
      log.info(
          "Invalidated {} cache entries for collection {} (user={})",
          removed,
          collectionId,
          userId);
      meterRegistry.counter("cache.invalidations", "scope", "collection").increment();
    } catch (RuntimeException e) {
      log.warn(
          "Cache invalidation failed for collection {} (user={}): {}",
          collectionId,
          userId,
          e.getMessage());
    }
    return removed;
  }

  private int sweepOwnerResults(long userId, long collectionId) {
    return cacheService.clearPattern(CacheKeys.vectorPrefix(userId, collectionId))
        + cacheService.clearPattern(CacheKeys.llmPrefix(userId, collectionId));
  }
}
