package com.flamingo.ai.docqa.exception;

/** Exception thrown when the embedding service cannot be reached. Retryable. */
public class ModelUnavailableException extends RuntimeException {

  public ModelUnavailableException(String message) {
    super(message);
  }

  public ModelUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
