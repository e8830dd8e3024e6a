package com.flamingo.ai.olivia.service.ingestion;

import com.flamingo.ai.olivia.cache.CacheInvalidationService;
import com.flamingo.ai.olivia.cache.CacheKeys;
import com.flamingo.ai.olivia.cache.TieredCacheService;
import com.flamingo.ai.olivia.config.RagConfig;
import com.flamingo.ai.olivia.elasticsearch.DocumentChunk;
import com.flamingo.ai.olivia.elasticsearch.DocumentChunkIndexService;
import com.flamingo.ai.olivia.exception.DocumentProcessingException;
import com.flamingo.ai.olivia.service.progress.ProgressService;
import com.flamingo.ai.olivia.service.rag.ChunkPreview;
import com.flamingo.ai.olivia.service.rag.embedding.Embedder;
import com.flamingo.ai.olivia.service.rag.semantic.SemanticAnswerCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.google.common.collect.Lists;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns a stored file into indexed, embedded chunks while reporting progress.
 *
 * <p>Progress runs 20 (extraction) → 40 (chunking) → 50 (chunked) → 60 (embedding) → 80..100
 * (storing, one step per batch). Failures escape as exceptions; a file with no extractable text
 * is reported through {@link IngestionResult#hasContent()} instead.
 */
@Service
@Slf4j
public class IngestionPipeline {

  static final long LARGE_FILE_BYTES = 10L * 1024 * 1024;
  static final long MEDIUM_FILE_BYTES = 5L * 1024 * 1024;
  static final long HUGE_FILE_BYTES = 20L * 1024 * 1024;
  static final int LARGE_CHUNK_CAP = 1536;
  static final int MEDIUM_CHUNK_CAP = 1152;

  private final DocumentLoaderRouter loaderRouter;
  private final Embedder embedder;
  private final DocumentChunkIndexService chunkIndexService;
  private final ProgressService progressService;
  private final TieredCacheService cacheService;
  private final CacheInvalidationService cacheInvalidation;
  private final SemanticAnswerCache semanticCache;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final LoadingCache<SplitterKey, RecursiveTextSplitter> splitters;

  public IngestionPipeline(
      DocumentLoaderRouter loaderRouter,
      Embedder embedder,
      DocumentChunkIndexService chunkIndexService,
      ProgressService progressService,
      TieredCacheService cacheService,
      CacheInvalidationService cacheInvalidation,
      SemanticAnswerCache semanticCache,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.loaderRouter = loaderRouter;
    this.embedder = embedder;
    this.chunkIndexService = chunkIndexService;
    this.progressService = progressService;
    this.cacheService = cacheService;
    this.cacheInvalidation = cacheInvalidation;
    this.semanticCache = semanticCache;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.splitters =
        Caffeine.newBuilder()
            .maximumSize(ragConfig.getChunking().getSplitterCacheSize())
            .build(key -> new RecursiveTextSplitter(key.chunkSize(), key.overlap()));
  }

  /**
   * Ingests {@code file} for the owner, replacing any chunks previously indexed under the same
   * file name.
   *
   * @throws DocumentProcessingException if the file cannot be read
   */
  @Timed(value = "document.ingest", description = "Time to ingest a document")
  public IngestionResult ingest(Path file, long userId, long collectionId, String taskId) {
    String source = file.getFileName().toString();
    long fileSize = fileSize(file);
    String fileType = DocumentLoaderRouter.extension(source);
    log.info(
        "Ingesting {} ({} bytes) for user={} collection={}",
        source,
        fileSize,
        userId,
        collectionId);

    progressService.emit(userId, 20, "Extraction started", taskId);
    List<LoadedPage> pages = loaderRouter.load(file);
    log.debug("Loaded {} page(s) from {}", pages.size(), source);

    progressService.emit(userId, 40, "Chunking started", taskId);
    int chunkSize = optimalChunkSize(fileSize, ragConfig.getChunking().getSize());
    RecursiveTextSplitter splitter = splitter(chunkSize);
    List<TextChunk> textChunks = splitter.split(pages);
    log.info(
        "Created {} chunks from {} (chunk size {}, overlap {})",
        textChunks.size(),
        source,
        chunkSize,
        splitter.getOverlap());
    progressService.emit(userId, 50, "Chunking completed", taskId);

    if (textChunks.isEmpty()) {
      log.warn(
          "No content extracted from {} ({} chars loaded)",
          source,
          DocumentLoader.totalChars(pages));
      meterRegistry.counter("document.ingestion.empty").increment();
      return new IngestionResult(source, 0, chunkSize, pages.size());
    }

    progressService.emit(userId, 60, "Embedding started", taskId);
    List<DocumentChunk> chunks =
        embed(textChunks, userId, collectionId, source, fileType, pages.size());

    progressService.emit(userId, 80, "Storing vectors", taskId);
    chunkIndexService.deleteBySource(userId, collectionId, source);
    List<List<DocumentChunk>> batches = Lists.partition(chunks, storeBatchSize(fileSize));
    for (int i = 0; i < batches.size(); i++) {
      chunkIndexService.indexDocuments(batches.get(i));
      int progress = 80 + (int) (((i + 1) / (double) batches.size()) * 20);
      progressService.emit(
          userId, progress, "Storing batch " + (i + 1) + "/" + batches.size(), taskId);
    }
    progressService.emit(userId, 100, "Vector storage completed", taskId);

    cacheInvalidation.invalidateDocument(userId, collectionId, source);
    semanticCache.purgeUser(userId);
    cacheService.set(
        CacheKeys.documentChunks(userId, collectionId, source),
        chunks.stream().map(ChunkPreview::from).collect(Collectors.toList()),
        cacheService.ttl().getDocumentChunks());

    meterRegistry.counter("document.chunks.indexed").increment(chunks.size());
    return new IngestionResult(source, chunks.size(), chunkSize, pages.size());
  }

  /** Larger files get larger chunks, bounded so a chunk still fits an embedding request. */
  static int optimalChunkSize(long fileSize, int baseChunkSize) {
    if (fileSize > LARGE_FILE_BYTES) {
      return Math.min(baseChunkSize * 2, LARGE_CHUNK_CAP);
    }
    if (fileSize > MEDIUM_FILE_BYTES) {
      return Math.min((int) (baseChunkSize * 1.5), MEDIUM_CHUNK_CAP);
    }
    return baseChunkSize;
  }

  int storeBatchSize(long fileSize) {
    if (fileSize > HUGE_FILE_BYTES) {
      return 25;
    }
    if (fileSize > LARGE_FILE_BYTES) {
      return 50;
    }
    return ragConfig.getIngestion().getBatchSize();
  }

  RecursiveTextSplitter splitter(int chunkSize) {
    return splitters.get(new SplitterKey(chunkSize, ragConfig.getChunking().getOverlap()));
  }

  private List<DocumentChunk> embed(
      List<TextChunk> textChunks,
      long userId,
      long collectionId,
      String source,
      String fileType,
      int totalPages) {
    List<DocumentChunk> chunks = new ArrayList<>(textChunks.size());
    int embeddingBatchSize = ragConfig.getIngestion().getEmbeddingBatchSize();
    for (List<TextChunk> batch : Lists.partition(textChunks, embeddingBatchSize)) {
      List<List<Float>> vectors =
          embedder.embedDocuments(batch.stream().map(TextChunk::content).toList());
      for (int i = 0; i < batch.size(); i++) {
        TextChunk textChunk = batch.get(i);
        chunks.add(
            DocumentChunk.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .collectionId(collectionId)
                .source(source)
                .fileType(fileType)
                .title(source)
                .page(textChunk.page())
                .totalPages(totalPages)
                .startIndex(textChunk.startIndex())
                .content(textChunk.content())
                .embedding(vectors.get(i))
                .build());
      }
    }
    return chunks;
  }

  private static long fileSize(Path file) {
    try {
      return Files.size(file);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          file.getFileName().toString(), "File not found: " + file, e);
    }
  }

  /** Splitters are shared per distinct chunk geometry. */
  record SplitterKey(int chunkSize, int overlap) {}
}
