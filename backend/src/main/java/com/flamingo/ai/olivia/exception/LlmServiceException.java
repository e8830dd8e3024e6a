package com.flamingo.ai.olivia.exception;

/** Thrown when the generation or embedding model cannot be reached. */
public class LlmServiceException extends RuntimeException {

  private final boolean rateLimited;
  private final String userMessage;

  public LlmServiceException(String message) {
    this(message, null, false);
  }

  public LlmServiceException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public LlmServiceException(String message, Throwable cause, boolean rateLimited) {
    super(message, cause);
    this.rateLimited = rateLimited;
    this.userMessage =
        rateLimited
            ? "Service is temporarily busy. Please try again in a moment."
            : "AI service is temporarily unavailable. Please try again later.";
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
