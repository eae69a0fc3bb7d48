package com.flamingo.ai.docqa.exception;

/** Exception thrown when the pipeline configuration is invalid. Fatal at startup. */
public class InvalidConfigException extends RuntimeException {

  private final String property;

  public InvalidConfigException(String property, String message) {
    super(property + ": " + message);
    this.property = property;
  }

  public String getProperty() {
    return property;
  }
}
