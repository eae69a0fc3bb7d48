package com.flamingo.ai.docqa.exception;

/** Exception thrown when the vector store rejects or fails an operation. */
public class VectorIndexException extends RuntimeException {

  public VectorIndexException(String message) {
    super(message);
  }

  public VectorIndexException(String message, Throwable cause) {
    super(message, cause);
  }
}
