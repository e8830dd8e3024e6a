package com.flamingo.ai.olivia.service.rag;

import com.fasterxml.jackson.core.type.TypeReference;
import com.flamingo.ai.olivia.api.dto.response.StreamEvent;
import com.flamingo.ai.olivia.cache.CacheInvalidationService;
import com.flamingo.ai.olivia.cache.CacheKeys;
import com.flamingo.ai.olivia.cache.TieredCacheService;
import com.flamingo.ai.olivia.config.RagConfig;
import com.flamingo.ai.olivia.elasticsearch.DocumentChunk;
import com.flamingo.ai.olivia.elasticsearch.DocumentChunkIndexService;
import com.flamingo.ai.olivia.service.rag.generation.AnswerGenerator;
import com.flamingo.ai.olivia.service.rag.generation.PromptFactory;
import com.flamingo.ai.olivia.service.rag.retrieval.QueryComplexity;
import com.flamingo.ai.olivia.service.rag.retrieval.QueryComplexityAnalyzer;
import com.flamingo.ai.olivia.service.rag.retrieval.QueryExpander;
import com.flamingo.ai.olivia.service.rag.retrieval.RetrievalFilter;
import com.flamingo.ai.olivia.service.rag.retrieval.RetrievalOutcome;
import com.flamingo.ai.olivia.service.rag.retrieval.RetrievalParams;
import com.flamingo.ai.olivia.service.rag.retrieval.RetrievalQualityMetrics;
import com.flamingo.ai.olivia.service.rag.retrieval.RetrievedDocument;
import com.flamingo.ai.olivia.service.rag.retrieval.SourceCitation;
import com.flamingo.ai.olivia.service.rag.retrieval.VectorRetriever;
import com.flamingo.ai.olivia.service.rag.semantic.CachedAnswer;
import com.flamingo.ai.olivia.service.rag.semantic.SemanticAnswerCache;
import com.flamingo.ai.olivia.service.rag.visualization.DocumentVectors;
import com.flamingo.ai.olivia.service.rag.visualization.EmbeddingProjector;
import dev.langchain4j.data.message.ChatMessage;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Retrieval-augmented answering over a user's collection.
 *
 * <p>Every request first consults the semantic answer cache. On a miss the query is classified,
 * optionally expanded, and each variant is retrieved from the chunk index (keyword search stands
 * in when vector search is unavailable). The merged hits are deduplicated and ranked into a
 * context and a citation list, and the answer for that exact context is looked up in the response
 * cache before the model is called. Blocking work runs on the {@code ragExecutor} pool.
 */
@Service
@Slf4j
public class RagServiceImpl implements RagService {

  private static final TypeReference<List<ChunkPreview>> PREVIEWS = new TypeReference<>() {};

  private final SemanticAnswerCache semanticCache;
  private final QueryComplexityAnalyzer complexityAnalyzer;
  private final QueryExpander queryExpander;
  private final VectorRetriever retriever;
  private final RetrievalFilter retrievalFilter;
  private final RetrievalQualityMetrics qualityMetrics;
  private final PromptFactory promptFactory;
  private final AnswerGenerator answerGenerator;
  private final TieredCacheService cacheService;
  private final CacheInvalidationService cacheInvalidation;
  private final DocumentChunkIndexService chunkIndexService;
  private final EmbeddingProjector embeddingProjector;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final Executor ragExecutor;
  private final Scheduler scheduler;

  public RagServiceImpl(
      SemanticAnswerCache semanticCache,
      QueryComplexityAnalyzer complexityAnalyzer,
      QueryExpander queryExpander,
      VectorRetriever retriever,
      RetrievalFilter retrievalFilter,
      RetrievalQualityMetrics qualityMetrics,
      PromptFactory promptFactory,
      AnswerGenerator answerGenerator,
      TieredCacheService cacheService,
      CacheInvalidationService cacheInvalidation,
      DocumentChunkIndexService chunkIndexService,
      EmbeddingProjector embeddingProjector,
      RagConfig ragConfig,
      MeterRegistry meterRegistry,
      @Qualifier("ragExecutor") Executor ragExecutor) {
    this.semanticCache = semanticCache;
    this.complexityAnalyzer = complexityAnalyzer;
    this.queryExpander = queryExpander;
    this.retriever = retriever;
    this.retrievalFilter = retrievalFilter;
    this.qualityMetrics = qualityMetrics;
    this.promptFactory = promptFactory;
    this.answerGenerator = answerGenerator;
    this.cacheService = cacheService;
    this.cacheInvalidation = cacheInvalidation;
    this.chunkIndexService = chunkIndexService;
    this.embeddingProjector = embeddingProjector;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.ragExecutor = ragExecutor;
    this.scheduler = Schedulers.fromExecutor(ragExecutor);
  }

  @Override
  public Mono<RagAnswer> chat(ChatQuery query) {
    return Mono.fromCallable(() -> answer(query)).subscribeOn(scheduler);
  }

  @Override
  public Flux<StreamEvent> streamChat(ChatQuery query) {
    return Flux.defer(() -> streamEvents(query))
        .subscribeOn(scheduler)
        .onErrorResume(
            e -> {
              log.error("Error during answer streaming: {}", e.getMessage(), e);
              meterRegistry.counter("rag.chat.errors", "mode", "stream").increment();
              return Flux.just(StreamEvent.error("Error during streaming: " + e.getMessage()));
            });
  }

  @Override
  public Mono<RetrievedSources> getSources(ChatQuery query) {
    return Mono.fromCallable(
            () -> {
              meterRegistry.counter("rag.sources.requests").increment();
              Retrieval retrieval = retrieve(query);
              return new RetrievedSources(
                  query.query(), query.collectionId(), retrieval.citations(), retrieval.info());
            })
        .subscribeOn(scheduler);
  }

  @Override
  @Timed(value = "rag.delete.document", description = "Time to delete document vectors")
  public void deleteDocumentVectors(long userId, long collectionId, String source) {
    long deleted = chunkIndexService.deleteBySource(userId, collectionId, source);
    if (deleted == 0) {
      log.info(
          "No vectors found for {} (user={}, collection={})", source, userId, collectionId);
    } else {
      log.info("Deleted {} vectors for {} (user={})", deleted, source, userId);
    }
    cacheInvalidation.invalidateDocument(userId, collectionId, source);
    semanticCache.purgeUser(userId);
  }

  @Override
  @Timed(value = "rag.delete.collection", description = "Time to delete collection vectors")
  public void deleteCollectionVectors(long userId, long collectionId) {
    long deleted = chunkIndexService.deleteByCollection(userId, collectionId);
    log.info("Deleted {} vectors of collection {} (user={})", deleted, collectionId, userId);
    cacheInvalidation.invalidateCollection(userId, collectionId);
    semanticCache.purgeUser(userId);
  }

  @Override
  public List<ChunkPreview> getDocumentChunks(long userId, long collectionId, String source) {
    String key = CacheKeys.documentChunks(userId, collectionId, source);
    Optional<List<ChunkPreview>> cached = cacheService.get(key, PREVIEWS);
    if (cached.isPresent()) {
      return cached.get();
    }
    List<DocumentChunk> chunks = chunkIndexService.findBySource(userId, collectionId, source);
    List<ChunkPreview> previews =
        chunks.stream().map(ChunkPreview::from).collect(Collectors.toList());
    if (!previews.isEmpty()) {
      cacheService.set(key, previews, cacheService.ttl().getDocumentChunks());
    }
    return previews;
  }

  @Override
  @Timed(value = "rag.document.vectors", description = "Time to project document vectors")
  public Optional<DocumentVectors> getDocumentVectors(
      long userId, long collectionId, String source) {
    List<DocumentChunk> chunks = chunkIndexService.findBySource(userId, collectionId, source);
    if (chunks.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(embeddingProjector.project(chunks));
  }

  private RagAnswer answer(ChatQuery query) {
    meterRegistry.counter("rag.chat.requests", "mode", "batch").increment();

    Optional<CachedAnswer> semanticHit = semanticCache.lookup(query.query(), query.userId());
    if (semanticHit.isPresent()) {
      CachedAnswer hit = semanticHit.get();
      return new RagAnswer(hit.answer(), hit.citations(), true, null);
    }

    Retrieval retrieval = retrieve(query);
    double temperature = temperature(query);
    String llmKey =
        CacheKeys.llmResponse(
            query.userId(),
            query.collectionId(),
            query.query(),
            retrieval.context(),
            temperature,
            query.customPrompt());

    Optional<String> cachedResponse = cacheService.get(llmKey, String.class);
    if (cachedResponse.isPresent()) {
      log.debug("Response cache hit for user={}", query.userId());
      meterRegistry.counter("rag.llm_cache.hits").increment();
      return new RagAnswer(cachedResponse.get(), retrieval.citations(), true, retrieval.info());
    }

    List<ChatMessage> messages =
        promptFactory.contextPrompt(query.query(), retrieval.context(), query.customPrompt());
    String response = answerGenerator.generate(messages, temperature);
    cacheService.set(llmKey, response, cacheService.ttl().getLlmResponse());
    storeSemanticAsync(query, response, retrieval.citations());
    return new RagAnswer(response, retrieval.citations(), false, retrieval.info());
  }

  private Flux<StreamEvent> streamEvents(ChatQuery query) {
    meterRegistry.counter("rag.chat.requests", "mode", "stream").increment();

    Optional<CachedAnswer> semanticHit = semanticCache.lookup(query.query(), query.userId());
    if (semanticHit.isPresent()) {
      CachedAnswer hit = semanticHit.get();
      Flux<StreamEvent> sources =
          query.fetchSources() && !hit.citations().isEmpty()
              ? Flux.just(StreamEvent.sources(hit.citations()))
              : Flux.empty();
      return sources.concatWith(replay(hit.answer()));
    }

    double temperature = temperature(query);
    if (!query.fetchSources()) {
      List<ChatMessage> messages =
          promptFactory.lightweightPrompt(query.query(), query.customPrompt());
      return answerGenerator.stream(messages, temperature).map(StreamEvent::chunk);
    }

    Retrieval retrieval = retrieve(query);
    Flux<StreamEvent> sources =
        retrieval.citations().isEmpty()
            ? Flux.empty()
            : Flux.just(StreamEvent.sources(retrieval.citations()));

    String llmKey =
        CacheKeys.llmResponse(
            query.userId(),
            query.collectionId(),
            query.query(),
            retrieval.context(),
            temperature,
            query.customPrompt());
    Optional<String> cachedResponse = cacheService.get(llmKey, String.class);
    if (cachedResponse.isPresent()) {
      meterRegistry.counter("rag.llm_cache.hits").increment();
      return sources.concatWith(replay(cachedResponse.get()));
    }

    List<ChatMessage> messages =
        promptFactory.contextPrompt(query.query(), retrieval.context(), query.customPrompt());
    StringBuilder fullResponse = new StringBuilder();
    Flux<StreamEvent> chunks =
        answerGenerator.stream(messages, temperature)
            .doOnNext(fullResponse::append)
            .map(StreamEvent::chunk);
    Mono<StreamEvent> afterComplete =
        Mono.fromRunnable(
            () -> {
              if (fullResponse.length() > 0) {
                String response = fullResponse.toString();
                cacheService.set(llmKey, response, cacheService.ttl().getLlmResponse());
                storeSemanticAsync(query, response, retrieval.citations());
              }
            });
    return sources.concatWith(chunks).concatWith(afterComplete);
  }

  /** Steps shared by both entry points: parameters, per-variant retrieval, filtering, context. */
  private Retrieval retrieve(ChatQuery query) {
    RetrievalParams params = retrievalParams(query);
    List<String> variants = queryVariants(query.query(), params);

    List<RetrievedDocument> hits = new ArrayList<>();
    boolean fallbackUsed = false;
    for (String variant : variants) {
      RetrievalOutcome outcome =
          retriever.retrieve(variant, query.userId(), query.collectionId(), params.topK());
      if (outcome.fallbackNeeded()) {
        log.warn(
            "Vector retrieval unavailable ({}), falling back to keyword search",
            outcome.failureReason());
        fallbackUsed = true;
        hits.addAll(
            retriever.keywordSearch(
                variant, query.userId(), query.collectionId(), params.topK()));
      } else {
        hits.addAll(outcome.documents());
      }
    }

    List<RetrievedDocument> documents = retrievalFilter.dedupAndFilter(hits, params.minScore());
    List<SourceCitation> citations =
        retrievalFilter.rankAndCap(
            retrievalFilter.toCitations(documents), params.minScore(), params.topK());
    int citationLimit = ragConfig.getRetrieval().getCitationLimit();
    if (citations.size() > citationLimit) {
      citations = citations.subList(0, citationLimit);
    }
    String context = retrievalFilter.toContext(documents);

    List<Double> scores = hits.stream().map(RetrievedDocument::score).collect(Collectors.toList());
    qualityMetrics.record(params, documents.size(), scores);
    log.debug(
        "Retrieved {} hits over {} variants, {} kept, {} citations",
        hits.size(),
        variants.size(),
        documents.size(),
        citations.size());

    RetrievalInfo info =
        new RetrievalInfo(
            params.complexity(),
            params.topK(),
            params.minScore(),
            variants.size() > 1,
            documents.size(),
            fallbackUsed);
    return new Retrieval(List.copyOf(citations), context, info);
  }

  RetrievalParams retrievalParams(ChatQuery query) {
    RagConfig.Retrieval config = ragConfig.getRetrieval();
    int baseTopK = query.topK() != null ? query.topK() : config.getDefaultTopK();
    double floor = config.getMinSimilarityThreshold();
    if (!config.isDynamicEnabled()) {
      return new RetrievalParams(
          Math.min(baseTopK, config.getMaxTopK()),
          floor,
          false,
          QueryComplexity.MODERATE,
          "Dynamic retrieval disabled, using defaults");
    }
    return complexityAnalyzer
        .getOptimalParams(query.query(), baseTopK, floor)
        .clamp(config.getMaxTopK(), floor);
  }

  private List<String> queryVariants(String query, RetrievalParams params) {
    RagConfig.Retrieval config = ragConfig.getRetrieval();
    if (!params.expandQuery() || !config.isQueryExpansionEnabled()) {
      return List.of(query);
    }
    List<String> expanded = queryExpander.expand(query);
    return expanded.subList(0, Math.min(expanded.size(), config.getMaxQueryVariants()));
  }

  private double temperature(ChatQuery query) {
    return query.temperature() != null
        ? query.temperature()
        : ragConfig.getGeneration().getDefaultTemperature();
  }

  private void storeSemanticAsync(ChatQuery query, String response, List<SourceCitation> sources) {
    if (!semanticCache.isEnabled()) {
      return;
    }
    CompletableFuture.runAsync(
        () -> semanticCache.store(query.query(), response, sources, query.userId()), ragExecutor);
  }

  /** Replays a finished answer word by word, as a live stream would deliver it. */
  private static Flux<StreamEvent> replay(String answer) {
    String[] words = answer.split(" ", -1);
    List<StreamEvent> events = new ArrayList<>(words.length);
    for (int i = 0; i < words.length; i++) {
      String word = i < words.length - 1 ? words[i] + " " : words[i];
      if (!word.isEmpty()) {
        events.add(StreamEvent.chunk(word));
      }
    }
    return Flux.fromIterable(events);
  }

  private record Retrieval(List<SourceCitation> citations, String context, RetrievalInfo info) {}
}
