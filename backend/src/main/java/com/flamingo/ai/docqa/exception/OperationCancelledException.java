package com.flamingo.ai.docqa.exception;

/** Exception thrown when an ingestion job or query is cancelled or passes its deadline. */
public class OperationCancelledException extends RuntimeException {

  private final boolean deadlineExceeded;

  public OperationCancelledException(String message, boolean deadlineExceeded) {
    super(message);
    this.deadlineExceeded = deadlineExceeded;
  }

  public boolean isDeadlineExceeded() {
    return deadlineExceeded;
  }
}
