package com.flamingo.ai.olivia.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/** Maps exceptions escaping REST controllers to {@link ApiError} bodies. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ApiError> handleDocumentNotFound(
      DocumentNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("document_not_found");
    String errorId = generateErrorId();
    log.warn("Document not found [{}]: {}", errorId, ex.getFilename());

    return build(
        HttpStatus.NOT_FOUND, errorId, ApiError.DOCUMENT_NOT_FOUND, "Document not found", request);
  }

  @ExceptionHandler(DocumentProcessingException.class)
  public ResponseEntity<ApiError> handleDocumentProcessing(
      DocumentProcessingException ex, HttpServletRequest request) {

    incrementErrorCounter("document_processing");
    String errorId = generateErrorId();
    log.error("Document processing error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.DOCUMENT_PROCESSING_ERROR,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleUploadTooLarge(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("document_too_large");
    String errorId = generateErrorId();
    log.warn("Upload rejected [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.PAYLOAD_TOO_LARGE,
        errorId,
        ApiError.DOCUMENT_TOO_LARGE,
        "File exceeds the maximum upload size",
        request);
  }

  @ExceptionHandler(DocumentTooLargeException.class)
  public ResponseEntity<ApiError> handleDocumentTooLarge(
      DocumentTooLargeException ex, HttpServletRequest request) {

    incrementErrorCounter("document_too_large");
    String errorId = generateErrorId();
    log.warn("Upload rejected [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.PAYLOAD_TOO_LARGE,
        errorId,
        ApiError.DOCUMENT_TOO_LARGE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(LlmServiceException.class)
  public ResponseEntity<ApiError> handleLlmService(
      LlmServiceException ex, HttpServletRequest request) {

    String errorType = ex.isRateLimited() ? "llm_rate_limited" : "llm_error";
    incrementErrorCounter(errorType);
    String errorId = generateErrorId();
    log.error("LLM service error [{}]: {}", errorId, ex.getMessage(), ex);

    String code = ex.isRateLimited() ? ApiError.LLM_RATE_LIMITED : ApiError.LLM_UNAVAILABLE;
    return build(HttpStatus.SERVICE_UNAVAILABLE, errorId, code, ex.getUserMessage(), request);
  }

  @ExceptionHandler(SearchException.class)
  public ResponseEntity<ApiError> handleSearch(SearchException ex, HttpServletRequest request) {

    incrementErrorCounter("search_error");
    String errorId = generateErrorId();
    log.error("Search error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.SEARCH_FAILED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);
    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler({ConstraintViolationException.class, IllegalArgumentException.class})
  public ResponseEntity<ApiError> handleBadArgument(
      RuntimeException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Rejected request [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
