package com.flamingo.ai.docqa.exception;

/**
 * Exception thrown when a vector does not have the dimensionality configured for the index.
 *
 * <p>This means the embedding model and the index are incompatible; it is never retried and needs
 * operator intervention.
 */
public class DimensionMismatchException extends RuntimeException {

  private final int expected;
  private final int actual;

  public DimensionMismatchException(int expected, int actual) {
    super("Expected vector dimension " + expected + " but got " + actual);
    this.expected = expected;
    this.actual = actual;
  }

  public int getExpected() {
    return expected;
  }

  public int getActual() {
    return actual;
  }
}
