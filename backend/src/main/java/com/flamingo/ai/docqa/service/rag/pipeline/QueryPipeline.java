package com.flamingo.ai.docqa.service.rag.pipeline;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.domain.entity.Turn;
import com.flamingo.ai.docqa.exception.AnswerGenerationException;
import com.flamingo.ai.docqa.exception.DimensionMismatchException;
import com.flamingo.ai.docqa.exception.ModelUnavailableException;
import com.flamingo.ai.docqa.exception.OperationCancelledException;
import com.flamingo.ai.docqa.exception.VectorIndexException;
import com.flamingo.ai.docqa.service.conversation.ConversationManager;
import com.flamingo.ai.docqa.service.rag.concurrent.CancellationToken;
import com.flamingo.ai.docqa.service.rag.context.AssembledContext;
import com.flamingo.ai.docqa.service.rag.context.ContextAssembler;
import com.flamingo.ai.docqa.service.rag.context.PromptBuilder;
import com.flamingo.ai.docqa.service.rag.embedding.EmbeddingGateway;
import com.flamingo.ai.docqa.service.rag.generation.AnswerGenerator;
import com.flamingo.ai.docqa.service.rag.retrieval.RetrievedChunk;
import com.flamingo.ai.docqa.service.rag.retrieval.Retriever;
import com.flamingo.ai.docqa.service.rag.retry.RetryPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * Answers one question against the indexed documents and records the result.
 *
 * <p>Every answer attempt appends exactly one assistant turn, successful or failed, unless the
 * caller cancels the query, in which case nothing is recorded.
 */
@Slf4j
public class QueryPipeline {

  public static final String REASON_MODEL_UNAVAILABLE = "ModelUnavailable";
  public static final String REASON_INDEX_UNAVAILABLE = "IndexUnavailable";
  public static final String REASON_DIMENSION_MISMATCH = "DimensionMismatch";

  private final RagConfig config;
  private final EmbeddingGateway embeddingGateway;
  private final Retriever retriever;
  private final ContextAssembler contextAssembler;
  private final PromptBuilder promptBuilder;
  private final AnswerGenerator answerGenerator;
  private final ConversationManager conversationManager;
  private final ExecutorService generationExecutor;
  private final MeterRegistry meterRegistry;
  private final RetryPolicy embeddingRetry;
  private final RetryPolicy generationRetry;

  public QueryPipeline(
      RagConfig config,
      EmbeddingGateway embeddingGateway,
      Retriever retriever,
      ContextAssembler contextAssembler,
      PromptBuilder promptBuilder,
      AnswerGenerator answerGenerator,
      ConversationManager conversationManager,
      ExecutorService generationExecutor,
      MeterRegistry meterRegistry) {
    this.config = config;
    this.embeddingGateway = embeddingGateway;
    this.retriever = retriever;
    this.contextAssembler = contextAssembler;
    this.promptBuilder = promptBuilder;
    this.answerGenerator = answerGenerator;
    this.conversationManager = conversationManager;
    this.generationExecutor = generationExecutor;
    this.meterRegistry = meterRegistry;
    this.embeddingRetry = RetryPolicy.from("query-embedding", config.getEmbedding().getRetry());
    this.generationRetry = RetryPolicy.from("generation", config.getGeneration().getRetry());
  }

  /**
   * Answers {@code question} and appends the assistant turn to the conversation.
   *
   * @return the appended assistant turn
   * @throws OperationCancelledException if the caller cancelled; no turn is appended
   */
  Turn answer(UUID conversationId, String question, CancellationToken token) {
    try {
      token.throwIfCancelled();
      float[] queryVector =
          embeddingRetry.execute(
              () -> embeddingGateway.embedQuery(question),
              ModelUnavailableException.class::isInstance,
              token);

      List<RetrievedChunk> ranked =
          retriever.retrieve(
              queryVector,
              config.getRetrieval().getTopK(),
              config.getRetrieval().getScoreThreshold());
      AssembledContext context =
          contextAssembler.assemble(ranked, config.getContext().getTokenBudget());
      String prompt = promptBuilder.build(question, context);
      log.debug(
          "Prompt for conversation {}: {} sources, ~{} context tokens",
          conversationId,
          context.citations().size(),
          context.estimatedTokens());

      String answer = generate(prompt, token);
      if (token.isCancellationRequested()) {
        token.throwIfCancelled();
      }

      meterRegistry.counter("query.answered").increment();
      return conversationManager.append(conversationId, Turn.answer(answer, context.citations()));
    } catch (AnswerGenerationException e) {
      return recordFailure(conversationId, e.getKind().getReason(), e);
    } catch (ModelUnavailableException e) {
      return recordFailure(conversationId, REASON_MODEL_UNAVAILABLE, e);
    } catch (VectorIndexException e) {
      return recordFailure(conversationId, REASON_INDEX_UNAVAILABLE, e);
    } catch (DimensionMismatchException e) {
      return recordFailure(conversationId, REASON_DIMENSION_MISMATCH, e);
    } catch (OperationCancelledException e) {
      if (e.isDeadlineExceeded()) {
        return recordFailure(conversationId, AnswerGenerationException.Kind.TIMEOUT.getReason(), e);
      }
      meterRegistry.counter("query.cancelled").increment();
      log.info("Query in conversation {} cancelled; nothing recorded", conversationId);
      throw e;
    } catch (RuntimeException e) {
      log.error("Unexpected failure while answering in conversation {}", conversationId, e);
      return recordFailure(conversationId, AnswerGenerationException.Kind.UNAVAILABLE.getReason(), e);
    }
  }

  private String generate(String prompt, CancellationToken token) {
    return generationRetry.execute(
        () -> generateOnce(prompt, token),
        e ->
            e instanceof AnswerGenerationException age
                && age.getKind() == AnswerGenerationException.Kind.UNAVAILABLE,
        token);
  }

  /** Runs one generation call on the generation pool, bounded by the timeout and the token. */
  private String generateOnce(String prompt, CancellationToken token) {
    Duration timeout = config.getGeneration().getTimeout();
    Duration limit = token.remaining().filter(r -> r.compareTo(timeout) < 0).orElse(timeout);

    Future<String> call = generationExecutor.submit(() -> answerGenerator.generate(prompt));
    token.onCancel(() -> call.cancel(true));
    try {
      return call.get(limit.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      call.cancel(true);
      token.throwIfCancelled();
      throw new AnswerGenerationException(
          AnswerGenerationException.Kind.TIMEOUT, "Generation exceeded " + limit, e);
    } catch (CancellationException e) {
      token.throwIfCancelled();
      throw new AnswerGenerationException(
          AnswerGenerationException.Kind.UNAVAILABLE, "Generation was aborted", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof AnswerGenerationException age) {
        throw age;
      }
      throw new AnswerGenerationException(
          AnswerGenerationException.Kind.UNAVAILABLE, "Generation failed: " + cause.getMessage(), cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      call.cancel(true);
      throw new OperationCancelledException("Interrupted while waiting for the answer", false);
    }
  }

  private Turn recordFailure(UUID conversationId, String reason, Exception cause) {
    meterRegistry.counter("query.failed", "reason", reason).increment();
    log.warn("Answer failed in conversation {} ({}): {}", conversationId, reason, cause.getMessage());
    return conversationManager.append(conversationId, Turn.failedAnswer(reason));
  }
}
