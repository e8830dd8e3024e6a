package com.flamingo.ai.olivia.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.olivia.exception.ApiError;
import com.flamingo.ai.olivia.exception.DocumentNotFoundException;
import com.flamingo.ai.olivia.exception.DocumentTooLargeException;
import com.flamingo.ai.olivia.exception.GlobalExceptionHandler;
import com.flamingo.ai.olivia.service.document.DocumentService;
import com.flamingo.ai.olivia.service.document.UploadTicket;
import com.flamingo.ai.olivia.service.rag.ChunkPreview;
import com.flamingo.ai.olivia.service.rag.visualization.DocumentVectors;
import com.flamingo.ai.olivia.service.rag.visualization.DocumentVectors.Color;
import com.flamingo.ai.olivia.service.rag.visualization.DocumentVectors.Metadata;
import com.flamingo.ai.olivia.service.rag.visualization.DocumentVectors.Position;
import com.flamingo.ai.olivia.service.rag.visualization.DocumentVectors.VectorPoint;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.multipart.MultipartFile;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentController Tests")
class DocumentControllerTest {

  private static final String BASE = "/api/users/{userId}/collections/{collectionId}";

  @Mock private DocumentService documentService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new DocumentController(documentService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should accept an upload and return its task id")
  void shouldAcceptUpload() throws Exception {
    MockMultipartFile file =
        new MockMultipartFile("file", "notes.txt", "text/plain", "Refund policy".getBytes());
    when(documentService.uploadDocument(eq(1L), eq(2L), any(MultipartFile.class)))
        .thenReturn(new UploadTicket("task-1", "notes.txt"));

    mockMvc
        .perform(multipart(BASE + "/documents", 1, 2).file(file))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.taskId").value("task-1"))
        .andExpect(jsonPath("$.filename").value("notes.txt"));
  }

  @Test
  @DisplayName("Should map oversized uploads to 413")
  void shouldRejectOversizedUpload() throws Exception {
    MockMultipartFile file =
        new MockMultipartFile("file", "big.pdf", "application/pdf", new byte[] {1, 2, 3});
    when(documentService.uploadDocument(eq(1L), eq(2L), any(MultipartFile.class)))
        .thenThrow(
            new DocumentTooLargeException("big.pdf", 60L * 1024 * 1024, 50L * 1024 * 1024));

    mockMvc
        .perform(multipart(BASE + "/documents", 1, 2).file(file))
        .andExpect(status().isPayloadTooLarge())
        .andExpect(jsonPath("$.code").value(ApiError.DOCUMENT_TOO_LARGE))
        .andExpect(jsonPath("$.message").value("File too large. Maximum size is 50MB"));
  }

  @Test
  @DisplayName("Should map an invalid file name to 400")
  void shouldRejectInvalidFileName() throws Exception {
    MockMultipartFile file = new MockMultipartFile("file", "..", "text/plain", "x".getBytes());
    when(documentService.uploadDocument(eq(1L), eq(2L), any(MultipartFile.class)))
        .thenThrow(new IllegalArgumentException("Invalid file name: .."));

    mockMvc
        .perform(multipart(BASE + "/documents", 1, 2).file(file))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));
  }

  @Test
  @DisplayName("Should delete a document")
  void shouldDeleteDocument() throws Exception {
    mockMvc
        .perform(delete(BASE + "/documents/{filename}", 1, 2, "notes.txt"))
        .andExpect(status().isNoContent());

    verify(documentService).deleteDocument(1L, 2L, "notes.txt");
  }

  @Test
  @DisplayName("Should delete a collection")
  void shouldDeleteCollection() throws Exception {
    mockMvc.perform(delete(BASE, 1, 2)).andExpect(status().isNoContent());

    verify(documentService).deleteCollection(1L, 2L);
  }

  @Test
  @DisplayName("Should list chunk previews of a document")
  void shouldListChunks() throws Exception {
    when(documentService.getDocumentChunks(1L, 2L, "notes.txt"))
        .thenReturn(List.of(new ChunkPreview("Refund policy", 1, 1, 0)));

    mockMvc
        .perform(get(BASE + "/documents/{filename}/chunks", 1, 2, "notes.txt"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(1))
        .andExpect(jsonPath("$[0].content").value("Refund policy"))
        .andExpect(jsonPath("$[0].page").value(1));
  }

  @Test
  @DisplayName("Should return 404 for a document without chunks")
  void shouldReturnNotFound() throws Exception {
    when(documentService.getDocumentChunks(1L, 2L, "missing.txt"))
        .thenThrow(new DocumentNotFoundException(1L, 2L, "missing.txt"));

    mockMvc
        .perform(get(BASE + "/documents/{filename}/chunks", 1, 2, "missing.txt"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value(ApiError.DOCUMENT_NOT_FOUND));
  }

  @Test
  @DisplayName("Should return projected vectors of a document")
  void shouldReturnVectors() throws Exception {
    VectorPoint point =
        new VectorPoint(
            new Position(3.0, 0.0, 0.0),
            new Color(0.8, 0.2, 0.2),
            new Metadata(0, 0.5, 1, "Refund policy", 2, 40));
    when(documentService.getDocumentVectors(1L, 2L, "notes.txt"))
        .thenReturn(
            new DocumentVectors(
                List.of(3.0, 0.0, 0.0), List.of(0.8, 0.2, 0.2), 1, List.of(point), 3, 1536));

    mockMvc
        .perform(get(BASE + "/documents/{filename}/vectors", 1, 2, "notes.txt"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(1))
        .andExpect(jsonPath("$.dimensions").value(3))
        .andExpect(jsonPath("$.original_dimensions").value(1536))
        .andExpect(jsonPath("$.points.length()").value(3))
        .andExpect(jsonPath("$.vectorPoints[0].position.x").value(3.0))
        .andExpect(jsonPath("$.vectorPoints[0].metadata.cluster").value(1))
        .andExpect(jsonPath("$.vectorPoints[0].metadata.text").value("Refund policy"));
  }

  @Test
  @DisplayName("Should return 404 for vectors of an unknown document")
  void shouldReturnNotFoundForVectors() throws Exception {
    when(documentService.getDocumentVectors(1L, 2L, "missing.txt"))
        .thenThrow(new DocumentNotFoundException(1L, 2L, "missing.txt"));

    mockMvc
        .perform(get(BASE + "/documents/{filename}/vectors", 1, 2, "missing.txt"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value(ApiError.DOCUMENT_NOT_FOUND));
  }
}
