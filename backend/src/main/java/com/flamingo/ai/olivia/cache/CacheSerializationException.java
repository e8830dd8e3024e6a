package com.flamingo.ai.olivia.cache;

/** Thrown by a cache tier when a stored payload cannot be read or written as JSON. */
public class CacheSerializationException extends RuntimeException {

  public CacheSerializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
