package com.flamingo.ai.olivia.exception;

/** Thrown when the vector index fails and no fallback could answer instead. */
public class SearchException extends RuntimeException {

  private final String userMessage;

  public SearchException(String message) {
    super(message);
    this.userMessage = "Search is temporarily unavailable. Please try again.";
  }

  public SearchException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Search is temporarily unavailable. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
