package com.flamingo.ai.docqa.config;

import com.flamingo.ai.docqa.service.conversation.ConversationManager;
import com.flamingo.ai.docqa.service.conversation.export.JsonTranscriptFormatter;
import com.flamingo.ai.docqa.service.conversation.export.TranscriptFormatter;
import com.flamingo.ai.docqa.service.rag.chunking.Chunker;
import com.flamingo.ai.docqa.service.rag.context.ContextAssembler;
import com.flamingo.ai.docqa.service.rag.context.PromptBuilder;
import com.flamingo.ai.docqa.service.rag.context.TokenEstimator;
import com.flamingo.ai.docqa.service.rag.embedding.EmbeddingGateway;
import com.flamingo.ai.docqa.service.rag.extraction.TextExtractor;
import com.flamingo.ai.docqa.service.rag.generation.AnswerGenerator;
import com.flamingo.ai.docqa.service.rag.index.VectorIndex;
import com.flamingo.ai.docqa.service.rag.pipeline.IngestionPipeline;
import com.flamingo.ai.docqa.service.rag.pipeline.QueryPipeline;
import com.flamingo.ai.docqa.service.rag.pipeline.RagContext;
import com.flamingo.ai.docqa.service.rag.pipeline.RagOrchestrator;
import com.flamingo.ai.docqa.service.rag.retrieval.Retriever;
import com.flamingo.ai.docqa.store.ConversationStore;
import com.flamingo.ai.docqa.store.DocumentStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Assembles the pipeline from the selected backends. */
@Configuration
public class RagPipelineConfig {

  @Bean(initMethod = "init", destroyMethod = "shutdown")
  public RagContext ragContext(
      RagConfig ragConfig,
      EmbeddingGateway embeddingGateway,
      VectorIndex vectorIndex,
      @Qualifier("ingestionExecutor") ExecutorService ingestionExecutor,
      @Qualifier("queryExecutor") ExecutorService queryExecutor,
      @Qualifier("generationExecutor") ExecutorService generationExecutor) {
    return new RagContext(
        ragConfig, embeddingGateway, vectorIndex, ingestionExecutor, queryExecutor, generationExecutor);
  }

  @Bean
  public TokenEstimator tokenEstimator(RagConfig ragConfig) {
    return TokenEstimator.charactersPerToken(ragConfig.getContext().getCharsPerToken());
  }

  @Bean
  public ContextAssembler contextAssembler(TokenEstimator tokenEstimator) {
    return new ContextAssembler(tokenEstimator);
  }

  @Bean
  public PromptBuilder promptBuilder(RagConfig ragConfig) {
    return new PromptBuilder(ragConfig.getContext().getPromptPreamble());
  }

  @Bean
  public ConversationManager conversationManager(
      ConversationStore conversationStore,
      Clock clock,
      List<TranscriptFormatter> formatters,
      JsonTranscriptFormatter jsonTranscriptFormatter) {
    return new ConversationManager(conversationStore, clock, formatters, jsonTranscriptFormatter);
  }

  @Bean
  public IngestionPipeline ingestionPipeline(
      RagConfig ragConfig,
      TextExtractor textExtractor,
      Chunker chunker,
      EmbeddingGateway embeddingGateway,
      VectorIndex vectorIndex,
      DocumentStore documentStore,
      Clock clock,
      MeterRegistry meterRegistry) {
    return new IngestionPipeline(
        ragConfig,
        textExtractor,
        chunker,
        embeddingGateway,
        vectorIndex,
        documentStore,
        clock,
        meterRegistry);
  }

  @Bean
  public QueryPipeline queryPipeline(
      RagConfig ragConfig,
      EmbeddingGateway embeddingGateway,
      Retriever retriever,
      ContextAssembler contextAssembler,
      PromptBuilder promptBuilder,
      AnswerGenerator answerGenerator,
      ConversationManager conversationManager,
      @Qualifier("generationExecutor") ExecutorService generationExecutor,
      MeterRegistry meterRegistry) {
    return new QueryPipeline(
        ragConfig,
        embeddingGateway,
        retriever,
        contextAssembler,
        promptBuilder,
        answerGenerator,
        conversationManager,
        generationExecutor,
        meterRegistry);
  }

  @Bean
  public RagOrchestrator ragOrchestrator(
      RagContext ragContext,
      IngestionPipeline ingestionPipeline,
      QueryPipeline queryPipeline,
      DocumentStore documentStore,
      ConversationManager conversationManager,
      Clock clock) {
    return new RagOrchestrator(
        ragContext, ingestionPipeline, queryPipeline, documentStore, conversationManager, clock);
  }
}
