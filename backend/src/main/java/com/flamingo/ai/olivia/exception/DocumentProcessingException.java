package com.flamingo.ai.olivia.exception;

/** Thrown when an uploaded document cannot be accepted or ingested. */
public class DocumentProcessingException extends RuntimeException {

  private final String filename;
  private final String userMessage;

  public DocumentProcessingException(String filename, String message) {
    super(message);
    this.filename = filename;
    this.userMessage = "Failed to process document";
  }

  public DocumentProcessingException(String filename, String message, Throwable cause) {
    super(message, cause);
    this.filename = filename;
    this.userMessage = "Failed to process document";
  }

  public DocumentProcessingException(String filename, String message, String userMessage) {
    super(message);
    this.filename = filename;
    this.userMessage = userMessage;
  }

  public String getFilename() {
    return filename;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
