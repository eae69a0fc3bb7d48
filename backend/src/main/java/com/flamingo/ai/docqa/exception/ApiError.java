package com.flamingo.ai.docqa.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_001";
  public static final String DOCUMENT_REJECTED = "DOCUMENT_002";
  public static final String CONVERSATION_NOT_FOUND = "CONVERSATION_001";
  public static final String QUERY_CANCELLED = "QUERY_001";
  public static final String MODEL_UNAVAILABLE = "MODEL_001";
  public static final String INDEX_ERROR = "INDEX_001";
  public static final String CONFLICT = "STATE_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
