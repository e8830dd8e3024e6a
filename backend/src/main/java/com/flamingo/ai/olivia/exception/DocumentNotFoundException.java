package com.flamingo.ai.olivia.exception;

/** Thrown when a stored file or its chunks cannot be found for the given owner. */
public class DocumentNotFoundException extends RuntimeException {

  private final String filename;

  public DocumentNotFoundException(long userId, long collectionId, String filename) {
    super(
        String.format(
            "Document '%s' not found (user=%d, collection=%d)", filename, userId, collectionId));
    this.filename = filename;
  }

  public String getFilename() {
    return filename;
  }
}
