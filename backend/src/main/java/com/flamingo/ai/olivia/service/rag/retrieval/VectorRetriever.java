package com.flamingo.ai.olivia.service.rag.retrieval;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flamingo.ai.olivia.cache.CacheKeys;
import com.flamingo.ai.olivia.cache.TieredCacheService;
import com.flamingo.ai.olivia.elasticsearch.DocumentChunk;
import com.flamingo.ai.olivia.elasticsearch.DocumentChunkIndexService;
import com.flamingo.ai.olivia.exception.SearchException;
import com.flamingo.ai.olivia.service.rag.embedding.Embedder;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Owner-scoped retrieval against the chunk index.
 *
 * <p>The primary path embeds the query and runs a kNN search, caching the hits under {@code
 * vector:}. Its failures are reported as {@link RetrievalOutcome#fallbackNeeded}, never thrown.
 * The keyword path is the fallback and does throw.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VectorRetriever {

  private static final TypeReference<List<RetrievedDocument>> DOCUMENTS =
      new TypeReference<>() {};

  private final Embedder embedder;
  private final DocumentChunkIndexService chunkIndexService;
  private final TieredCacheService cacheService;
  private final MeterRegistry meterRegistry;

  public RetrievalOutcome retrieve(String query, long userId, long collectionId, int topK) {
    String cacheKey = CacheKeys.vectorResults(userId, collectionId, query, topK);
    Optional<List<RetrievedDocument>> cached = cacheService.get(cacheKey, DOCUMENTS);
    if (cached.isPresent()) {
      log.debug("Vector result cache hit for user={} collection={}", userId, collectionId);
      return RetrievalOutcome.success(cached.get());
    }

    List<DocumentChunk> chunks;
    try {
      List<Float> embedding = embedder.embedQuery(query);
      chunks = chunkIndexService.vectorSearch(userId, collectionId, embedding, topK);
    } catch (RuntimeException e) {
      log.warn(
          "Vector retrieval failed for user={} collection={}: {}",
          userId,
          collectionId,
          e.getMessage());
      meterRegistry.counter("rag.retrieval.fallback").increment();
      return RetrievalOutcome.fallbackNeeded(e.getMessage());
    }

    List<RetrievedDocument> documents = toDocuments(chunks, userId, collectionId);
    log.debug(
        "Retrieved {} chunks for user={} collection={}", documents.size(), userId, collectionId);
    cacheService.set(cacheKey, documents, cacheService.ttl().getVectorResults());
    return RetrievalOutcome.success(documents);
  }

  /**
   * BM25 search within the same owner scope, scores scaled into {@code (0, 1]}.
   *
   * @throws SearchException if the index cannot answer
   */
  public List<RetrievedDocument> keywordSearch(
      String query, long userId, long collectionId, int topK) {
    try {
      List<DocumentChunk> chunks =
          chunkIndexService.keywordSearch(userId, collectionId, query, topK);
      return toDocuments(chunks, userId, collectionId);
    } catch (SearchException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new SearchException("Keyword retrieval failed: " + e.getMessage(), e);
    }
  }

  private static List<RetrievedDocument> toDocuments(
      List<DocumentChunk> chunks, long userId, long collectionId) {
    return chunks.stream()
        .map(
            chunk ->
                new RetrievedDocument(
                    chunk.getContent(),
                    chunk.getSource(),
                    chunk.getRelevanceScore() != null ? chunk.getRelevanceScore() : 0.0,
                    userId,
                    collectionId,
                    chunk.getPage()))
        .collect(Collectors.toList());
  }
}
