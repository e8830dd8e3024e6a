package com.flamingo.ai.olivia.api.rest;

import com.flamingo.ai.olivia.api.dto.response.UploadResponse;
import com.flamingo.ai.olivia.service.document.DocumentService;
import com.flamingo.ai.olivia.service.rag.ChunkPreview;
import com.flamingo.ai.olivia.service.rag.visualization.DocumentVectors;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for the documents of a collection. */
@RestController
@RequestMapping("/api/users/{userId}/collections/{collectionId}")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentService documentService;

  /** Stores a document and starts ingesting it; follow progress with the returned task id. */
  @PostMapping(value = "/documents", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<UploadResponse> uploadDocument(
      @PathVariable long userId,
      @PathVariable long collectionId,
      @RequestParam("file") MultipartFile file) {
    UploadResponse response =
        UploadResponse.fromTicket(documentService.uploadDocument(userId, collectionId, file));
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
  }

  @DeleteMapping("/documents/{filename}")
  public ResponseEntity<Void> deleteDocument(
      @PathVariable long userId, @PathVariable long collectionId, @PathVariable String filename) {
    documentService.deleteDocument(userId, collectionId, filename);
    return ResponseEntity.noContent().build();
  }

  /** Deletes every document and vector of the collection. */
  @DeleteMapping
  public ResponseEntity<Void> deleteCollection(
      @PathVariable long userId, @PathVariable long collectionId) {
    documentService.deleteCollection(userId, collectionId);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/documents/{filename}/chunks")
  public ResponseEntity<List<ChunkPreview>> getDocumentChunks(
      @PathVariable long userId, @PathVariable long collectionId, @PathVariable String filename) {
    return ResponseEntity.ok(documentService.getDocumentChunks(userId, collectionId, filename));
  }

  /** Chunk embeddings reduced to three dimensions, with cluster and colour per point. */
  @GetMapping("/documents/{filename}/vectors")
  public ResponseEntity<DocumentVectors> getDocumentVectors(
      @PathVariable long userId, @PathVariable long collectionId, @PathVariable String filename) {
    return ResponseEntity.ok(documentService.getDocumentVectors(userId, collectionId, filename));
  }
}
