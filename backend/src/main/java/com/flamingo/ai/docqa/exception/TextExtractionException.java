package com.flamingo.ai.docqa.exception;

/** Exception thrown when plain text cannot be extracted from uploaded bytes. */
public class TextExtractionException extends RuntimeException {

  public TextExtractionException(String message) {
    super(message);
  }

  public TextExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
