package com.flamingo.ai.olivia.service.document;

import com.flamingo.ai.olivia.cache.TieredCacheService;
import com.flamingo.ai.olivia.config.RagConfig;
import com.flamingo.ai.olivia.exception.DocumentNotFoundException;
import com.flamingo.ai.olivia.exception.DocumentProcessingException;
import com.flamingo.ai.olivia.exception.DocumentTooLargeException;
import com.flamingo.ai.olivia.service.ingestion.IngestionPipeline;
import com.flamingo.ai.olivia.service.ingestion.IngestionResult;
import com.flamingo.ai.olivia.service.progress.ProgressEvent;
import com.flamingo.ai.olivia.service.progress.ProgressService;
import com.flamingo.ai.olivia.service.rag.ChunkPreview;
import com.flamingo.ai.olivia.service.rag.RagService;
import com.flamingo.ai.olivia.service.rag.visualization.DocumentVectors;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/**
 * Files live under {@code <upload-dir>/<userId>/<collectionId>/<filename>}; the file name doubles
 * as the source name of its chunks.
 */
@Service
@Slf4j
public class DocumentServiceImpl implements DocumentService {

  private final IngestionPipeline ingestionPipeline;
  private final RagService ragService;
  private final ProgressService progressService;
  private final TieredCacheService cacheService;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final Executor documentProcessingExecutor;

  public DocumentServiceImpl(
      IngestionPipeline ingestionPipeline,
      RagService ragService,
      ProgressService progressService,
      TieredCacheService cacheService,
      RagConfig ragConfig,
      MeterRegistry meterRegistry,
      @Qualifier("documentProcessingExecutor") Executor documentProcessingExecutor) {
    this.ingestionPipeline = ingestionPipeline;
    this.ragService = ragService;
    this.progressService = progressService;
    this.cacheService = cacheService;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.documentProcessingExecutor = documentProcessingExecutor;
  }

  @Override
  @Timed(value = "document.upload", description = "Time to upload a document")
  public UploadTicket uploadDocument(long userId, long collectionId, MultipartFile file) {
    String filename = sanitize(file.getOriginalFilename());
    long maxBytes = ragConfig.getIngestion().getMaxFileSizeBytes();
    if (file.getSize() > maxBytes) {
      throw new DocumentTooLargeException(filename, file.getSize(), maxBytes);
    }

    Path target = collectionDir(userId, collectionId).resolve(filename);
    try (InputStream in = file.getInputStream()) {
      Files.createDirectories(target.getParent());
      Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          filename, "Failed to store upload: " + e.getMessage(), e);
    }
    meterRegistry.counter("document.uploaded", "type", fileType(filename)).increment();

    String taskId = UUID.randomUUID().toString();
    progressService.emit(userId, 5, "File uploaded, starting processing", taskId);
    documentProcessingExecutor.execute(
        () -> processDocument(target, userId, collectionId, taskId));
    cacheService.invalidateUserCollections(userId);

    log.info(
        "Document {} uploaded for user={} collection={}, task {}",
        filename,
        userId,
        collectionId,
        taskId);
    return new UploadTicket(taskId, filename);
  }

  @Override
  public void processDocument(Path file, long userId, long collectionId, String taskId) {
    try {
      progressService.emit(userId, 15, "Starting document analysis", taskId);
      IngestionResult result = ingestionPipeline.ingest(file, userId, collectionId, taskId);
      if (result.hasContent()) {
        meterRegistry.counter("document.ingestion.success").increment();
        log.info("Ingestion of {} completed: {} chunks", result.source(), result.chunkCount());
        progressService.emit(userId, 100, "Document processing completed", taskId);
      } else {
        meterRegistry.counter("document.ingestion.failed", "reason", "no_content").increment();
        progressService.emit(
            userId,
            ProgressEvent.FAILED,
            "Document processing failed: no content extracted",
            taskId);
      }
    } catch (RuntimeException e) {
      log.error("Ingestion of {} failed: {}", file.getFileName(), e.getMessage(), e);
      meterRegistry.counter("document.ingestion.failed", "reason", "error").increment();
      progressService.emit(
          userId, ProgressEvent.FAILED, "Document processing failed: " + e.getMessage(), taskId);
    }
  }

  @Override
  @Timed(value = "document.delete", description = "Time to delete a document")
  public void deleteDocument(long userId, long collectionId, String filename) {
    String name = sanitize(filename);
    ragService.deleteDocumentVectors(userId, collectionId, name);
    Path stored = collectionDir(userId, collectionId).resolve(name);
    try {
      if (!Files.deleteIfExists(stored)) {
        log.debug("No stored file at {}", stored);
      }
    } catch (IOException e) {
      log.warn("Could not remove stored file {}: {}", stored, e.getMessage());
    }
    cacheService.invalidateUserCollections(userId);
    meterRegistry.counter("document.deleted").increment();
    log.info("Deleted document {} (user={}, collection={})", name, userId, collectionId);
  }

  @Override
  @Timed(value = "document.deleteCollection", description = "Time to delete a collection")
  public void deleteCollection(long userId, long collectionId) {
    ragService.deleteCollectionVectors(userId, collectionId);
    Path dir = collectionDir(userId, collectionId);
    if (Files.isDirectory(dir)) {
      try (Stream<Path> paths = Files.walk(dir)) {
        paths.sorted(Comparator.reverseOrder()).forEach(DocumentServiceImpl::deleteQuietly);
      } catch (IOException e) {
        log.warn("Could not remove collection directory {}: {}", dir, e.getMessage());
      }
    }
    log.info("Deleted collection {} of user {}", collectionId, userId);
  }

  @Override
  public List<ChunkPreview> getDocumentChunks(long userId, long collectionId, String filename) {
    String name = sanitize(filename);
    List<ChunkPreview> chunks = ragService.getDocumentChunks(userId, collectionId, name);
    if (chunks.isEmpty()) {
      throw new DocumentNotFoundException(userId, collectionId, name);
    }
    return chunks;
  }

  @Override
  public DocumentVectors getDocumentVectors(long userId, long collectionId, String filename) {
    String name = sanitize(filename);
    return ragService
        .getDocumentVectors(userId, collectionId, name)
        .orElseThrow(() -> new DocumentNotFoundException(userId, collectionId, name));
  }

  private Path collectionDir(long userId, long collectionId) {
    return Paths.get(ragConfig.getIngestion().getUploadDir())
        .resolve(Long.toString(userId))
        .resolve(Long.toString(collectionId));
  }

  /** Reduces a client-supplied name to its last path element. */
  static String sanitize(String filename) {
    if (filename == null || filename.isBlank()) {
      throw new IllegalArgumentException("File name is required");
    }
    Path name = Paths.get(filename.replace('\\', '/')).getFileName();
    String result = name != null ? name.toString() : "";
    if (result.isBlank() || ".".equals(result) || "..".equals(result)) {
      throw new IllegalArgumentException("Invalid file name: " + filename);
    }
    return result;
  }

  private static String fileType(String filename) {
    int dot = filename.lastIndexOf('.');
    return dot < 0 ? "unknown" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Could not remove {}: {}", path, e.getMessage());
    }
  }
}
