package com.flamingo.ai.docqa.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.flamingo.ai.docqa.domain.repository.ChunkRepository;
import com.flamingo.ai.docqa.domain.repository.ConversationRepository;
import com.flamingo.ai.docqa.domain.repository.DocumentRepository;
import com.flamingo.ai.docqa.domain.repository.TurnRepository;
import com.flamingo.ai.docqa.elasticsearch.ElasticsearchVectorIndex;
import com.flamingo.ai.docqa.service.rag.embedding.EmbeddingGateway;
import com.flamingo.ai.docqa.service.rag.embedding.HashingEmbeddingGateway;
import com.flamingo.ai.docqa.service.rag.embedding.LangChain4jEmbeddingGateway;
import com.flamingo.ai.docqa.service.rag.generation.AnswerGenerator;
import com.flamingo.ai.docqa.service.rag.generation.LangChain4jAnswerGenerator;
import com.flamingo.ai.docqa.service.rag.generation.MockAnswerGenerator;
import com.flamingo.ai.docqa.service.rag.index.InMemoryVectorIndex;
import com.flamingo.ai.docqa.service.rag.index.VectorIndex;
import com.flamingo.ai.docqa.store.ConversationStore;
import com.flamingo.ai.docqa.store.DocumentStore;
import com.flamingo.ai.docqa.store.InMemoryConversationStore;
import com.flamingo.ai.docqa.store.InMemoryDocumentStore;
import com.flamingo.ai.docqa.store.JpaConversationStore;
import com.flamingo.ai.docqa.store.JpaDocumentStore;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Selects the vector index, model and storage backends from {@code rag.*} properties. */
@Configuration
public class RagBackendConfig {

  // ---- vector index ----

  @Bean
  @ConditionalOnProperty(name = "rag.vector-index.backend", havingValue = "memory", matchIfMissing = true)
  public VectorIndex inMemoryVectorIndex(RagConfig ragConfig) {
    return new InMemoryVectorIndex(
        ragConfig.getEmbedding().getDimensions(), ragConfig.getVectorIndex().getMetric());
  }

  @Bean
  @ConditionalOnProperty(name = "rag.vector-index.backend", havingValue = "elasticsearch")
  public VectorIndex elasticsearchVectorIndex(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      RagConfig ragConfig,
      @Value("${elasticsearch.index-name:docqa-chunks}") String indexName) {
    return new ElasticsearchVectorIndex(
        elasticsearchClient,
        meterRegistry,
        indexName,
        ragConfig.getEmbedding().getDimensions(),
        ragConfig.getVectorIndex().getMetric());
  }

  // ---- embedding ----

  @Bean
  @ConditionalOnProperty(name = "rag.embedding.provider", havingValue = "openai", matchIfMissing = true)
  public EmbeddingGateway langChain4jEmbeddingGateway(
      EmbeddingModel embeddingModel, MeterRegistry meterRegistry, RagConfig ragConfig) {
    return new LangChain4jEmbeddingGateway(
        embeddingModel,
        meterRegistry,
        ragConfig.getEmbedding().getDimensions(),
        ragConfig.getEmbedding().getBatchSize());
  }

  @Bean
  @ConditionalOnProperty(name = "rag.embedding.provider", havingValue = "hashing")
  public EmbeddingGateway hashingEmbeddingGateway(RagConfig ragConfig) {
    return new HashingEmbeddingGateway(
        ragConfig.getEmbedding().getDimensions(), ragConfig.getEmbedding().getBatchSize());
  }

  // ---- generation ----

  @Bean
  @ConditionalOnProperty(name = "rag.generation.provider", havingValue = "openai", matchIfMissing = true)
  public AnswerGenerator langChain4jAnswerGenerator(ChatModel chatModel, MeterRegistry meterRegistry) {
    return new LangChain4jAnswerGenerator(chatModel, meterRegistry);
  }

  @Bean
  @ConditionalOnProperty(name = "rag.generation.provider", havingValue = "mock")
  public AnswerGenerator mockAnswerGenerator() {
    return new MockAnswerGenerator();
  }

  // ---- storage ----

  @Bean
  @ConditionalOnProperty(name = "rag.storage.type", havingValue = "jpa", matchIfMissing = true)
  public DocumentStore jpaDocumentStore(
      DocumentRepository documentRepository, ChunkRepository chunkRepository) {
    return new JpaDocumentStore(documentRepository, chunkRepository);
  }

  @Bean
  @ConditionalOnProperty(name = "rag.storage.type", havingValue = "jpa", matchIfMissing = true)
  public ConversationStore jpaConversationStore(
      ConversationRepository conversationRepository, TurnRepository turnRepository) {
    return new JpaConversationStore(conversationRepository, turnRepository);
  }

  @Bean
  @ConditionalOnProperty(name = "rag.storage.type", havingValue = "memory")
  public DocumentStore inMemoryDocumentStore() {
    return new InMemoryDocumentStore();
  }

  @Bean
  @ConditionalOnProperty(name = "rag.storage.type", havingValue = "memory")
  public ConversationStore inMemoryConversationStore() {
    return new InMemoryConversationStore();
  }
}
