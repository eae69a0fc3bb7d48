package com.flamingo.ai.docqa;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docqa.service.conversation.ConversationManager;
import com.flamingo.ai.docqa.service.document.DocumentService;
import com.flamingo.ai.docqa.service.rag.embedding.EmbeddingGateway;
import com.flamingo.ai.docqa.service.rag.embedding.HashingEmbeddingGateway;
import com.flamingo.ai.docqa.service.rag.generation.AnswerGenerator;
import com.flamingo.ai.docqa.service.rag.generation.MockAnswerGenerator;
import com.flamingo.ai.docqa.service.rag.index.InMemoryVectorIndex;
import com.flamingo.ai.docqa.service.rag.index.VectorIndex;
import com.flamingo.ai.docqa.service.rag.pipeline.RagContext;
import com.flamingo.ai.docqa.service.rag.pipeline.RagOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/**
 * Verifies the Spring application context loads with the offline providers, so the test runs
 * without an API key or a running Elasticsearch.
 */
@SpringBootTest(
    properties = {
      "spring.datasource.url=jdbc:sqlite:target/docqa-context-test.db",
      "rag.embedding.provider=hashing",
      "rag.embedding.dimensions=256",
      "rag.generation.provider=mock",
      "rag.vector-index.backend=memory"
    })
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext.getBean(RagContext.class).isRunning()).isTrue();
  }

  @Test
  @DisplayName("Offline providers should be selected by configuration")
  void offlineProvidersShouldBeSelected() {
    assertThat(applicationContext.getBean(EmbeddingGateway.class))
        .isInstanceOf(HashingEmbeddingGateway.class);
    assertThat(applicationContext.getBean(AnswerGenerator.class))
        .isInstanceOf(MockAnswerGenerator.class);
    assertThat(applicationContext.getBean(VectorIndex.class)).isInstanceOf(InMemoryVectorIndex.class);
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(DocumentService.class)).isNotNull();
    assertThat(applicationContext.getBean(ConversationManager.class)).isNotNull();
    assertThat(applicationContext.getBean(RagOrchestrator.class)).isNotNull();
  }
}
