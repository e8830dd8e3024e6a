package com.flamingo.ai.olivia.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Error body returned by every REST endpoint. */
@Getter
@Builder
public class ApiError {

  public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_001";
  public static final String DOCUMENT_PROCESSING_ERROR = "DOCUMENT_002";
  public static final String DOCUMENT_TOO_LARGE = "DOCUMENT_003";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String LLM_RATE_LIMITED = "LLM_002";
  public static final String SEARCH_FAILED = "SEARCH_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Short id repeated in the server log for correlation. */
  private final String errorId;

  private final String code;

  /** Message safe to show to end users. */
  private final String message;

  private final Instant timestamp;

  private final String path;
}
