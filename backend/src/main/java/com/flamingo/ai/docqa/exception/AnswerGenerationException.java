package com.flamingo.ai.docqa.exception;

/** Exception thrown when the answer-generation service fails. Never retried automatically. */
public class AnswerGenerationException extends RuntimeException {

  /** Failure category, recorded as the failed turn's reason. */
  public enum Kind {
    UNAVAILABLE("Unavailable"),
    TIMEOUT("Timeout");

    private final String reason;

    Kind(String reason) {
      this.reason = reason;
    }

    public String getReason() {
      return reason;
    }
  }

  private final Kind kind;

  public AnswerGenerationException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }
}
