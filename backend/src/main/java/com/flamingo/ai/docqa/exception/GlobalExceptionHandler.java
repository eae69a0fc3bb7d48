package com.flamingo.ai.docqa.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ApiError> handleDocumentNotFound(
      DocumentNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("document_not_found");
    String errorId = generateErrorId();
    log.warn("Document not found [{}]: {}", errorId, ex.getDocumentId());

    return respond(HttpStatus.NOT_FOUND, errorId, ApiError.DOCUMENT_NOT_FOUND, "Document not found", request);
  }

  @ExceptionHandler(ConversationNotFoundException.class)
  public ResponseEntity<ApiError> handleConversationNotFound(
      ConversationNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("conversation_not_found");
    String errorId = generateErrorId();
    log.warn("Conversation not found [{}]: {}", errorId, ex.getConversationId());

    return respond(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.CONVERSATION_NOT_FOUND,
        "Conversation not found",
        request);
  }

  @ExceptionHandler(DocumentProcessingException.class)
  public ResponseEntity<ApiError> handleDocumentProcessing(
      DocumentProcessingException ex, HttpServletRequest request) {

    incrementErrorCounter("document_rejected");
    String errorId = generateErrorId();
    log.warn("Document rejected [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.DOCUMENT_REJECTED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(OperationCancelledException.class)
  public ResponseEntity<ApiError> handleCancelled(
      OperationCancelledException ex, HttpServletRequest request) {

    incrementErrorCounter("cancelled");
    String errorId = generateErrorId();
    log.info("Operation cancelled [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.CONFLICT, errorId, ApiError.QUERY_CANCELLED, "The request was cancelled", request);
  }

  @ExceptionHandler(ModelUnavailableException.class)
  public ResponseEntity<ApiError> handleModelUnavailable(
      ModelUnavailableException ex, HttpServletRequest request) {

    incrementErrorCounter("model_unavailable");
    String errorId = generateErrorId();
    log.error("Model unavailable [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.MODEL_UNAVAILABLE,
        "AI service is temporarily unavailable. Please try again later.",
        request);
  }

  @ExceptionHandler(VectorIndexException.class)
  public ResponseEntity<ApiError> handleVectorIndex(
      VectorIndexException ex, HttpServletRequest request) {

    incrementErrorCounter("index_error");
    String errorId = generateErrorId();
    log.error("Vector index error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.INDEX_ERROR,
        "Search is temporarily unavailable. Please try again later.",
        request);
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<ApiError> handleConflict(
      IllegalStateException ex, HttpServletRequest request) {

    incrementErrorCounter("conflict");
    String errorId = generateErrorId();
    log.warn("Conflict [{}]: {}", errorId, ex.getMessage());

    return respond(HttpStatus.CONFLICT, errorId, ApiError.CONFLICT, ex.getMessage(), request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleIllegalArgument(
      IllegalArgumentException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Invalid request [{}]: {}", errorId, ex.getMessage());

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
