package com.flamingo.ai.olivia.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.olivia.cache.CacheInvalidationService;
import com.flamingo.ai.olivia.cache.CacheKeys;
import com.flamingo.ai.olivia.cache.TieredCacheService;
import com.flamingo.ai.olivia.config.CacheConfig;
import com.flamingo.ai.olivia.config.RagConfig;
import com.flamingo.ai.olivia.elasticsearch.DocumentChunk;
import com.flamingo.ai.olivia.elasticsearch.DocumentChunkIndexService;
import com.flamingo.ai.olivia.exception.DocumentProcessingException;
import com.flamingo.ai.olivia.service.progress.ProgressService;
import com.flamingo.ai.olivia.service.rag.ChunkPreview;
import com.flamingo.ai.olivia.service.rag.embedding.Embedder;
import com.flamingo.ai.olivia.service.rag.semantic.SemanticAnswerCache;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionPipeline Tests")
class IngestionPipelineTest {

  private static final long USER = 1L;
  private static final long COLLECTION = 2L;
  private static final String TASK = "task-1";

  @Mock private Embedder embedder;
  @Mock private DocumentChunkIndexService chunkIndexService;
  @Mock private ProgressService progressService;
  @Mock private TieredCacheService cacheService;
  @Mock private CacheInvalidationService cacheInvalidation;
  @Mock private SemanticAnswerCache semanticCache;

  @TempDir Path tempDir;

  private RagConfig ragConfig;
  private SimpleMeterRegistry meterRegistry;
  private IngestionPipeline pipeline;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    meterRegistry = new SimpleMeterRegistry();
    lenient().when(cacheService.ttl()).thenReturn(new CacheConfig.Ttl());
    lenient()
        .when(embedder.embedDocuments(anyList()))
        .thenAnswer(
            inv -> {
              List<String> texts = inv.getArgument(0);
              List<List<Float>> vectors = new ArrayList<>();
              for (int i = 0; i < texts.size(); i++) {
                vectors.add(List.of(0.1f * i, 0.2f));
              }
              return vectors;
            });
    DocumentLoaderRouter router =
        new DocumentLoaderRouter(
            new PdfBoxDocumentLoader(), new PlainTextDocumentLoader(), new TikaDocumentLoader());
    pipeline =
        new IngestionPipeline(
            router,
            embedder,
            chunkIndexService,
            progressService,
            cacheService,
            cacheInvalidation,
            semanticCache,
            ragConfig,
            meterRegistry);
  }

  private Path write(String name, String content) throws IOException {
    return Files.writeString(tempDir.resolve(name), content);
  }

  @Nested
  @DisplayName("Small text file")
  class SmallTextFile {

    @Test
    @DisplayName("Should index one chunk at the base size and report progress up to 100")
    @SuppressWarnings("unchecked")
    void shouldIngestSingleChunk() throws IOException {
      Path file = write("faq.txt", "Refunds are accepted within 30 days of purchase.");

      IngestionResult result = pipeline.ingest(file, USER, COLLECTION, TASK);

      assertThat(result.hasContent()).isTrue();
      assertThat(result.chunkCount()).isEqualTo(1);
      assertThat(result.chunkSize()).isEqualTo(768);
      assertThat(result.source()).isEqualTo("faq.txt");

      ArgumentCaptor<List<DocumentChunk>> captor = ArgumentCaptor.forClass(List.class);
      verify(chunkIndexService).indexDocuments(captor.capture());
      DocumentChunk chunk = captor.getValue().get(0);
      assertThat(chunk.getUserId()).isEqualTo(USER);
      assertThat(chunk.getCollectionId()).isEqualTo(COLLECTION);
      assertThat(chunk.getSource()).isEqualTo("faq.txt");
      assertThat(chunk.getFileType()).isEqualTo(".txt");
      assertThat(chunk.getPage()).isEqualTo(1);
      assertThat(chunk.getStartIndex()).isZero();
      assertThat(chunk.getEmbedding()).hasSize(2);

      InOrder order = inOrder(progressService, chunkIndexService, cacheInvalidation, semanticCache);
      order.verify(progressService).emit(USER, 20, "Extraction started", TASK);
      order.verify(progressService).emit(USER, 40, "Chunking started", TASK);
      order.verify(progressService).emit(USER, 50, "Chunking completed", TASK);
      order.verify(progressService).emit(USER, 60, "Embedding started", TASK);
      order.verify(progressService).emit(USER, 80, "Storing vectors", TASK);
      order.verify(chunkIndexService).deleteBySource(USER, COLLECTION, "faq.txt");
      order.verify(chunkIndexService).indexDocuments(anyList());
      order.verify(progressService).emit(USER, 100, "Storing batch 1/1", TASK);
      order.verify(progressService).emit(USER, 100, "Vector storage completed", TASK);
      order.verify(cacheInvalidation).invalidateDocument(USER, COLLECTION, "faq.txt");
      order.verify(semanticCache).purgeUser(USER);
    }

    @Test
    @DisplayName("Should seed the chunk preview cache")
    @SuppressWarnings("unchecked")
    void shouldCacheChunkPreviews() throws IOException {
      Path file = write("faq.txt", "Refunds are accepted within 30 days of purchase.");

      pipeline.ingest(file, USER, COLLECTION, TASK);

      ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
      verify(cacheService)
          .set(
              eq(CacheKeys.documentChunks(USER, COLLECTION, "faq.txt")),
              captor.capture(),
              eq(new CacheConfig.Ttl().getDocumentChunks()));
      List<ChunkPreview> previews = (List<ChunkPreview>) captor.getValue();
      assertThat(previews)
          .singleElement()
          .satisfies(
              preview -> {
                assertThat(preview.content()).startsWith("Refunds are accepted");
                assertThat(preview.page()).isEqualTo(1);
              });
    }
  }

  @Test
  @DisplayName("Should report an empty file as no content without touching the index")
  void shouldHandleEmptyFile() throws IOException {
    Path file = write("empty.txt", "");

    IngestionResult result = pipeline.ingest(file, USER, COLLECTION, TASK);

    assertThat(result.hasContent()).isFalse();
    assertThat(result.chunkCount()).isZero();
    verify(progressService).emit(USER, 50, "Chunking completed", TASK);
    verify(progressService, never()).emit(anyLong(), eq(60), anyString(), anyString());
    verifyNoInteractions(embedder, chunkIndexService, cacheInvalidation);
    assertThat(meterRegistry.counter("document.ingestion.empty").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should store in batches and advance progress per batch")
  void shouldStoreInBatches() throws IOException {
    ragConfig.getChunking().setSize(15);
    ragConfig.getChunking().setOverlap(0);
    ragConfig.getIngestion().setBatchSize(2);
    ragConfig.getIngestion().setEmbeddingBatchSize(2);
    Path file =
        write("list.txt", "alpha one\n\nbravo two\n\ncharlie 3\n\ndelta four\n\necho five");

    IngestionResult result = pipeline.ingest(file, USER, COLLECTION, TASK);

    assertThat(result.chunkCount()).isEqualTo(5);
    verify(embedder, times(3)).embedDocuments(anyList());
    verify(chunkIndexService, times(3)).indexDocuments(anyList());
    verify(progressService).emit(USER, 86, "Storing batch 1/3", TASK);
    verify(progressService).emit(USER, 93, "Storing batch 2/3", TASK);
    verify(progressService).emit(USER, 100, "Storing batch 3/3", TASK);
  }

  @Test
  @DisplayName("Should fail with DocumentProcessingException when the file is missing")
  void shouldFailForMissingFile() {
    Path missing = tempDir.resolve("gone.txt");

    assertThatThrownBy(() -> pipeline.ingest(missing, USER, COLLECTION, TASK))
        .isInstanceOf(DocumentProcessingException.class);
    verify(progressService, never()).emit(anyLong(), anyInt(), anyString(), any());
  }

  @Test
  @DisplayName("Should grow chunks for larger files within caps")
  void shouldChooseChunkSizeByFileSize() {
    assertThat(IngestionPipeline.optimalChunkSize(1024, 768)).isEqualTo(768);
    assertThat(IngestionPipeline.optimalChunkSize(6L * 1024 * 1024, 768)).isEqualTo(1152);
    assertThat(IngestionPipeline.optimalChunkSize(6L * 1024 * 1024, 500)).isEqualTo(750);
    assertThat(IngestionPipeline.optimalChunkSize(11L * 1024 * 1024, 768)).isEqualTo(1536);
    assertThat(IngestionPipeline.optimalChunkSize(11L * 1024 * 1024, 500)).isEqualTo(1000);
  }

  @Test
  @DisplayName("Should shrink store batches for very large files")
  void shouldChooseStoreBatchSize() {
    assertThat(pipeline.storeBatchSize(1024)).isEqualTo(100);
    assertThat(pipeline.storeBatchSize(11L * 1024 * 1024)).isEqualTo(50);
    assertThat(pipeline.storeBatchSize(21L * 1024 * 1024)).isEqualTo(25);
  }

  @Test
  @DisplayName("Should share one splitter per chunk geometry")
  void shouldReuseSplitters() {
    assertThat(pipeline.splitter(768)).isSameAs(pipeline.splitter(768));
    assertThat(pipeline.splitter(768)).isNotSameAs(pipeline.splitter(1152));
  }
}
