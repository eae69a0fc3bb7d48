package com.flamingo.ai.docqa.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docqa.api.rest.ConversationController;
import com.flamingo.ai.docqa.api.rest.DocumentController;
import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests that pin the REST paths:
 *
 * <ul>
 *   <li>POST /api/documents - Upload document
 *   <li>GET /api/documents/{documentId}/chunks - List chunks
 *   <li>POST /api/documents/{documentId}/reingest - Re-ingest document
 *   <li>POST /api/documents/{documentId}/cancel - Cancel ingestion
 *   <li>DELETE /api/documents/{documentId} - Remove document
 *   <li>POST /api/conversations/{conversationId}/ask - Ask a question
 *   <li>GET /api/conversations/{conversationId}/export - Export transcript
 *   <li>POST /api/conversations/import - Import transcript
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("DocumentController API contract")
  class DocumentControllerContract {

    @Test
    @DisplayName("should be mapped to /api/documents")
    void shouldBeMappedToApiDocuments() {
      RequestMapping mapping = DocumentController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/documents");
    }

    @Test
    @DisplayName("should expose document lifecycle endpoints")
    void shouldExposeLifecycleEndpoints() {
      assertThat(postPaths(DocumentController.class))
          .contains("", "/{documentId}/reingest", "/{documentId}/cancel");
      assertThat(getPaths(DocumentController.class)).contains("/{documentId}", "/{documentId}/chunks");
      assertThat(
              Arrays.stream(DocumentController.class.getDeclaredMethods())
                  .map(method -> method.getAnnotation(DeleteMapping.class))
                  .filter(mapping -> mapping != null)
                  .flatMap(mapping -> Arrays.stream(mapping.value())))
          .containsExactly("/{documentId}");
    }
  }

  @Nested
  @DisplayName("ConversationController API contract")
  class ConversationControllerContract {

    @Test
    @DisplayName("should be mapped to /api/conversations")
    void shouldBeMappedToApiConversations() {
      RequestMapping mapping = ConversationController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/conversations");
    }

    @Test
    @DisplayName("should expose ask, export and import endpoints")
    void shouldExposeConversationEndpoints() {
      assertThat(postPaths(ConversationController.class))
          .contains("", "/{conversationId}/ask", "/import");
      assertThat(getPaths(ConversationController.class))
          .contains("/{conversationId}", "/{conversationId}/turns", "/{conversationId}/export");
    }
  }

  private static List<String> postPaths(Class<?> controller) {
    return Arrays.stream(controller.getDeclaredMethods())
        .map(method -> method.getAnnotation(PostMapping.class))
        .filter(mapping -> mapping != null)
        .map(mapping -> pathOf(mapping.value(), mapping.path()))
        .toList();
  }

  private static List<String> getPaths(Class<?> controller) {
    return Arrays.stream(controller.getDeclaredMethods())
        .map((Method method) -> method.getAnnotation(GetMapping.class))
        .filter(mapping -> mapping != null)
        .map(mapping -> pathOf(mapping.value(), mapping.path()))
        .toList();
  }

  private static String pathOf(String[] value, String[] path) {
    String[] paths = value.length > 0 ? value : path;
    return paths.length > 0 ? paths[0] : "";
  }
}
