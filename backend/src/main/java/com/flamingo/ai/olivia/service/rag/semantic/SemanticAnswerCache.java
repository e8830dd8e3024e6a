package com.flamingo.ai.olivia.service.rag.semantic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.olivia.config.RagConfig;
import com.flamingo.ai.olivia.elasticsearch.SemanticCacheEntry;
import com.flamingo.ai.olivia.elasticsearch.SemanticCacheIndexService;
import com.flamingo.ai.olivia.service.rag.embedding.Embedder;
import com.flamingo.ai.olivia.service.rag.retrieval.SourceCitation;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Whole-answer cache keyed by question meaning rather than question text.
 *
 * <p>Each user's questions are embedded and indexed together with the answer and its citations. A
 * later question from the same user reuses that answer when its nearest neighbour is at least
 * {@code rag.semantic-cache.threshold} similar. Disabled by default; when disabled both operations
 * do nothing. Failures never reach the caller: a failed lookup is a miss, a failed store is
 * skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SemanticAnswerCache {

  private static final TypeReference<List<SourceCitation>> CITATIONS = new TypeReference<>() {};

  private final Embedder embedder;
  private final SemanticCacheIndexService indexService;
  private final ObjectMapper objectMapper;
  private final RagConfig ragConfig;
  private final Clock cacheClock;
  private final MeterRegistry meterRegistry;

  public boolean isEnabled() {
    return ragConfig.getSemanticCache().isEnabled();
  }

  public Optional<CachedAnswer> lookup(String query, long userId) {
    if (!isEnabled()) {
      return Optional.empty();
    }
    try {
      List<Float> embedding = embedder.embedQuery(query);
      Optional<SemanticCacheEntry> nearest = indexService.nearest(userId, embedding);
      if (nearest.isEmpty()) {
        meterRegistry.counter("rag.semantic_cache.misses").increment();
        return Optional.empty();
      }
      SemanticCacheEntry entry = nearest.get();
      double similarity = entry.getRelevanceScore() != null ? entry.getRelevanceScore() : 0.0;
      double threshold = ragConfig.getSemanticCache().getThreshold();
      if (similarity < threshold) {
        log.debug("Semantic cache near miss for user={}: {} < {}", userId, similarity, threshold);
        meterRegistry.counter("rag.semantic_cache.misses").increment();
        return Optional.empty();
      }
      List<SourceCitation> citations = readCitations(entry.getSourcesJson());
      meterRegistry.counter("rag.semantic_cache.hits").increment();
      log.debug("Semantic cache hit for user={} with similarity {}", userId, similarity);
      return Optional.of(new CachedAnswer(entry.getResponse(), citations, similarity));
    } catch (RuntimeException | JsonProcessingException e) {
      log.warn("Semantic cache lookup failed for user={}: {}", userId, e.getMessage());
      meterRegistry.counter("rag.semantic_cache.errors", "operation", "lookup").increment();
      return Optional.empty();
    }
  }

  public void store(String query, String answer, List<SourceCitation> citations, long userId) {
    if (!isEnabled() || answer == null || answer.isBlank()) {
      return;
    }
    try {
      List<Float> embedding = embedder.embedQuery(query);
      SemanticCacheEntry entry =
          SemanticCacheEntry.builder()
              .id(UUID.randomUUID().toString())
              .userId(userId)
              .query(query)
              .response(answer)
              .sourcesJson(objectMapper.writeValueAsString(citations))
              .timestamp(cacheClock.millis())
              .embedding(embedding)
              .build();
      indexService.indexDocuments(List.of(entry));
      log.debug("Stored semantic cache entry for user={}", userId);
    } catch (RuntimeException | JsonProcessingException e) {
      log.warn("Semantic cache store failed for user={}: {}", userId, e.getMessage());
      meterRegistry.counter("rag.semantic_cache.errors", "operation", "store").increment();
    }
  }

  /** Removes every cached answer of the user; their documents changed. */
  public void purgeUser(long userId) {
    if (!isEnabled()) {
      return;
    }
    try {
      long deleted = indexService.deleteByUser(userId);
      log.debug("Purged {} semantic cache entries for user={}", deleted, userId);
    } catch (RuntimeException e) {
      log.warn("Semantic cache purge failed for user={}: {}", userId, e.getMessage());
      meterRegistry.counter("rag.semantic_cache.errors", "operation", "purge").increment();
    }
  }

  private List<SourceCitation> readCitations(String json) throws JsonProcessingException {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    return objectMapper.readValue(json, CITATIONS);
  }
}
