package com.flamingo.ai.olivia.service.rag.embedding;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flamingo.ai.olivia.cache.CacheKeys;
import com.flamingo.ai.olivia.cache.TieredCacheService;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

/**
 * Embedding model wrapper that caches vectors per text under {@code embed:} and whole batches
 * under {@code batch_embed:}.
 */
@Service
@Slf4j
public class CachedEmbeddingService implements Embedder {

  // text-embedding-3-small accepts 8192 tokens; stay well below for dense scripts
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private static final TypeReference<List<Float>> VECTOR = new TypeReference<>() {};
  private static final TypeReference<List<List<Float>>> VECTORS = new TypeReference<>() {};

  private final EmbeddingModel embeddingModel;
  private final TieredCacheService cacheService;
  private final MeterRegistry meterRegistry;
  private final Executor ragExecutor;
  // proxied view of this bean, so async calls keep retry, circuit breaker and timing
  private final Embedder self;

  public CachedEmbeddingService(
      EmbeddingModel embeddingModel,
      TieredCacheService cacheService,
      MeterRegistry meterRegistry,
      @Qualifier("ragExecutor") Executor ragExecutor,
      @Lazy Embedder self) {
    this.embeddingModel = embeddingModel;
    this.cacheService = cacheService;
    this.meterRegistry = meterRegistry;
    this.ragExecutor = ragExecutor;
    this.self = self;
  }

  @Override
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "openai")
  @Retry(name = "openai")
  public List<Float> embedQuery(String text) {
    return cacheService.getOrSet(
        CacheKeys.embedding(text),
        VECTOR,
        cacheService.ttl().getEmbeddings(),
        () -> {
          log.debug("Computing query embedding, input length: {} chars", text.length());
          Response<Embedding> response = embeddingModel.embed(truncate(text));
          meterRegistry.counter("embedding.requests.success", "type", "query").increment();
          return toFloatList(response.content().vector());
        });
  }

  @Override
  @Timed(value = "embedding.embedBatch", description = "Time to embed batch")
  @CircuitBreaker(name = "openai")
  @Retry(name = "openai")
  public List<List<Float>> embedDocuments(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    String batchKey = CacheKeys.batchEmbedding(texts);
    Optional<List<List<Float>>> cachedBatch = cacheService.get(batchKey, VECTORS);
    if (cachedBatch.isPresent() && cachedBatch.get().size() == texts.size()) {
      log.debug("Batch embedding cache hit for {} texts", texts.size());
      return cachedBatch.get();
    }

    List<List<Float>> vectors = new ArrayList<>(texts.size());
    List<Integer> missingIndices = new ArrayList<>();
    List<TextSegment> missingSegments = new ArrayList<>();
    for (int i = 0; i < texts.size(); i++) {
      Optional<List<Float>> cached = cacheService.get(CacheKeys.embedding(texts.get(i)), VECTOR);
      vectors.add(cached.orElse(null));
      if (cached.isEmpty()) {
        missingIndices.add(i);
        missingSegments.add(TextSegment.from(truncate(texts.get(i))));
      }
    }

    if (!missingSegments.isEmpty()) {
      log.debug("Computing {} of {} embeddings", missingSegments.size(), texts.size());
      Response<List<Embedding>> response = embeddingModel.embedAll(missingSegments);
      List<Embedding> computed = response.content();
      if (computed.size() != missingSegments.size()) {
        throw new IllegalStateException(
            "Embedding model returned "
                + computed.size()
                + " vectors for "
                + missingSegments.size()
                + " texts");
      }
      for (int j = 0; j < computed.size(); j++) {
        int index = missingIndices.get(j);
        List<Float> vector = toFloatList(computed.get(j).vector());
        vectors.set(index, vector);
        cacheService.set(
            CacheKeys.embedding(texts.get(index)), vector, cacheService.ttl().getEmbeddings());
      }
      meterRegistry
          .counter("embedding.requests.success", "type", "passage")
          .increment(missingSegments.size());
    }

    cacheService.set(batchKey, vectors, cacheService.ttl().getEmbeddings());
    return vectors;
  }

  @Override
  public CompletableFuture<List<Float>> embedQueryAsync(String text) {
    return CompletableFuture.supplyAsync(() -> self.embedQuery(text), ragExecutor);
  }

  @Override
  public CompletableFuture<List<List<Float>>> embedDocumentsAsync(List<String> texts) {
    return CompletableFuture.supplyAsync(() -> self.embedDocuments(texts), ragExecutor);
  }

  private static String truncate(String text) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text too long for embedding, truncating from {} chars to {} chars",
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  private static List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
