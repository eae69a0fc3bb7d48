package com.flamingo.ai.docqa.exception;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

@DisplayName("GlobalExceptionHandler Tests")
class GlobalExceptionHandlerTest {

  private SimpleMeterRegistry meterRegistry;
  private GlobalExceptionHandler handler;
  private MockHttpServletRequest request;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    handler = new GlobalExceptionHandler(meterRegistry);
    request = new MockHttpServletRequest("GET", "/api/documents/123");
  }

  @Test
  @DisplayName("Should map a missing document to 404")
  void shouldMapMissingDocument() {
    ResponseEntity<ApiError> response =
        handler.handleDocumentNotFound(new DocumentNotFoundException(UUID.randomUUID()), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.DOCUMENT_NOT_FOUND);
    assertThat(response.getBody().getPath()).isEqualTo("/api/documents/123");
    assertThat(response.getBody().getErrorId()).hasSize(8);
    assertThat(meterRegistry.counter("api_errors_total", "error_type", "document_not_found").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should show the user message of a rejected upload")
  void shouldMapRejectedUpload() {
    ResponseEntity<ApiError> response =
        handler.handleDocumentProcessing(
            new DocumentProcessingException(null, "Unsupported file type: image/png", "Supported formats: PDF"),
            request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    assertThat(response.getBody().getMessage()).isEqualTo("Supported formats: PDF");
  }

  @Test
  @DisplayName("Should hide model failure details behind 503")
  void shouldMapModelUnavailable() {
    ResponseEntity<ApiError> response =
        handler.handleModelUnavailable(
            new ModelUnavailableException("api key sk-123 rejected"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(response.getBody().getMessage()).doesNotContain("sk-123");
  }

  @Test
  @DisplayName("Should map conflicting state to 409")
  void shouldMapConflict() {
    ResponseEntity<ApiError> response =
        handler.handleConflict(new IllegalStateException("Document is still being ingested"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.CONFLICT);
  }

  @Test
  @DisplayName("Should map unexpected errors to 500 without details")
  void shouldMapUnexpectedError() {
    ResponseEntity<ApiError> response =
        handler.handleGeneric(new NullPointerException("secret"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().getMessage()).doesNotContain("secret");
  }
}
