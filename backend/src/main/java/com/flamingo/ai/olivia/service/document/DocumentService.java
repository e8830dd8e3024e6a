package com.flamingo.ai.olivia.service.document;

import com.flamingo.ai.olivia.service.rag.ChunkPreview;
import com.flamingo.ai.olivia.service.rag.visualization.DocumentVectors;
import java.nio.file.Path;
import java.util.List;
import org.springframework.web.multipart.MultipartFile;

/** Stores uploaded files and keeps their indexed chunks in step with them. */
public interface DocumentService {

  /**
   * Stores the file and starts ingesting it in the background.
   *
   * @throws com.flamingo.ai.olivia.exception.DocumentTooLargeException above the size limit
   */
  UploadTicket uploadDocument(long userId, long collectionId, MultipartFile file);

  /** Ingests a stored file, publishing progress under {@code taskId}. Never throws. */
  void processDocument(Path file, long userId, long collectionId, String taskId);

  void deleteDocument(long userId, long collectionId, String filename);

  void deleteCollection(long userId, long collectionId);

  /**
   * Chunk previews ordered by page and position.
   *
   * @throws com.flamingo.ai.olivia.exception.DocumentNotFoundException if nothing is indexed
   */
  List<ChunkPreview> getDocumentChunks(long userId, long collectionId, String filename);

  /**
   * Chunk vectors projected to 3-D. Fewer than three stored vectors give an empty projection.
   *
   * @throws com.flamingo.ai.olivia.exception.DocumentNotFoundException if nothing is indexed
   */
  DocumentVectors getDocumentVectors(long userId, long collectionId, String filename);
}
