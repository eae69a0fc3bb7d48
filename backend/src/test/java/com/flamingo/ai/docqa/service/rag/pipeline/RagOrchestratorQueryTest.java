package com.flamingo.ai.docqa.service.rag.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.docqa.domain.entity.Chunk;
import com.flamingo.ai.docqa.domain.entity.Conversation;
import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.domain.entity.Turn;
import com.flamingo.ai.docqa.domain.enums.MessageRole;
import com.flamingo.ai.docqa.domain.enums.TurnStatus;
import com.flamingo.ai.docqa.exception.ConversationNotFoundException;
import com.flamingo.ai.docqa.exception.OperationCancelledException;
import com.flamingo.ai.docqa.service.rag.concurrent.CancellationToken;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RagOrchestrator query Tests")
class RagOrchestratorQueryTest {

  private PipelineFixture fixture;

  @BeforeEach
  void setUp() {
    fixture = new PipelineFixture();
  }

  @AfterEach
  void tearDown() {
    fixture.close();
  }

  @Test
  @DisplayName("Should answer from the best matching chunk and cite it")
  void shouldAnswerWithCitations() throws Exception {
    fixture.start();
    Document document = fixture.ingestText("colors.txt", "The sky is blue. Grass is green.");
    Conversation conversation = fixture.orchestrator.startConversation("Colors");

    Turn answer =
        fixture.orchestrator.ask(
            conversation.getId(), "What color is the sky?", CancellationToken.create());

    assertThat(answer.getStatus()).isEqualTo(TurnStatus.OK);
    assertThat(answer.getText()).contains("The sky is blue.");
    assertThat(answer.getCitations()).isNotEmpty();
    assertThat(answer.getCitations().get(0).marker()).isEqualTo(1);
    assertThat(answer.getCitations().get(0).chunkId()).isEqualTo(Chunk.idFor(document.getId(), 0));
    assertThat(answer.getCitations().get(0).documentId()).isEqualTo(document.getId());

    List<Turn> history = fixture.conversationManager.history(conversation.getId());
    assertThat(history).extracting(Turn::getRole).containsExactly(MessageRole.USER, MessageRole.ASSISTANT);
    assertThat(history).extracting(Turn::getSequenceNumber).containsExactly(0, 1);
    assertThat(fixture.counter("query.answered")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should answer without sources when nothing is indexed")
  void shouldAnswerWithoutSources() {
    fixture.start();
    Conversation conversation = fixture.orchestrator.startConversation(null);

    Turn answer =
        fixture.orchestrator.ask(conversation.getId(), "Anything?", CancellationToken.create());

    assertThat(answer.getStatus()).isEqualTo(TurnStatus.OK);
    assertThat(answer.getCitations()).isEmpty();
    assertThat(answer.getText()).contains("do not contain an answer");
  }

  @Test
  @DisplayName("Should record exactly one failed turn when generation is unavailable")
  void shouldRecordFailedTurnWhenGenerationUnavailable() throws Exception {
    fixture.answerGenerator =
        prompt -> {
          throw new IllegalStateException("503 from provider");
        };
    fixture.start();
    fixture.ingestText("colors.txt", "The sky is blue. Grass is green.");
    Conversation conversation = fixture.orchestrator.startConversation("Colors");
    int before = fixture.conversationManager.history(conversation.getId()).size();

    Turn answer =
        fixture.orchestrator.ask(
            conversation.getId(), "What color is the sky?", CancellationToken.create());

    assertThat(answer.isFailed()).isTrue();
    assertThat(answer.getFailureReason()).isEqualTo("Unavailable");
    List<Turn> history = fixture.conversationManager.history(conversation.getId());
    assertThat(history).hasSize(before + 2);
    assertThat(history.get(history.size() - 1).isFailed()).isTrue();
    assertThat(fixture.counter("query.failed", "reason", "Unavailable")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should record a failed turn when chunk lookup fails unexpectedly")
  void shouldRecordFailedTurnWhenChunkLookupFails() throws Exception {
    fixture.start();
    fixture.ingestText("colors.txt", "The sky is blue. Grass is green.");
    Conversation conversation = fixture.orchestrator.startConversation("Colors");
    fixture.documentStore.failChunkLookups(new IllegalStateException("database is locked"));

    Turn answer =
        fixture.orchestrator.ask(
            conversation.getId(), "What color is the sky?", CancellationToken.create());

    assertThat(answer.isFailed()).isTrue();
    assertThat(answer.getFailureReason()).isEqualTo("Unavailable");
    assertThat(fixture.conversationManager.history(conversation.getId()))
        .extracting(Turn::getRole)
        .containsExactly(MessageRole.USER, MessageRole.ASSISTANT);
    assertThat(fixture.counter("query.failed", "reason", "Unavailable")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should record a timeout when generation takes too long")
  void shouldRecordTimeout() {
    fixture.config.getGeneration().setTimeout(Duration.ofMillis(200));
    fixture.answerGenerator =
        prompt -> {
          try {
            Thread.sleep(5_000);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return "too late";
        };
    fixture.start();
    Conversation conversation = fixture.orchestrator.startConversation("Slow");

    Turn answer =
        fixture.orchestrator.ask(conversation.getId(), "Still there?", CancellationToken.create());

    assertThat(answer.isFailed()).isTrue();
    assertThat(answer.getFailureReason()).isEqualTo("Timeout");
  }

  @Test
  @DisplayName("Should record a timeout when the caller's deadline passes")
  void shouldRecordTimeoutOnDeadline() {
    fixture.answerGenerator =
        prompt -> {
          try {
            Thread.sleep(5_000);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return "too late";
        };
    fixture.start();
    Conversation conversation = fixture.orchestrator.startConversation("Deadline");

    Turn answer =
        fixture.orchestrator.ask(
            conversation.getId(), "Quick?", CancellationToken.withTimeout(Duration.ofMillis(200)));

    assertThat(answer.isFailed()).isTrue();
    assertThat(answer.getFailureReason()).isEqualTo("Timeout");
  }

  @Test
  @DisplayName("Should record no answer when the caller cancels")
  void shouldRecordNoAnswerWhenCancelled() throws Exception {
    CountDownLatch generating = new CountDownLatch(1);
    fixture.answerGenerator =
        prompt -> {
          generating.countDown();
          try {
            Thread.sleep(5_000);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return "never seen";
        };
    fixture.start();
    Conversation conversation = fixture.orchestrator.startConversation("Cancelled");
    CancellationToken token = CancellationToken.create();

    CompletableFuture<Turn> pending =
        fixture.orchestrator.askAsync(conversation.getId(), "Long question", token);
    assertThat(generating.await(5, TimeUnit.SECONDS)).isTrue();
    token.cancel();

    assertThatThrownBy(() -> pending.get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(OperationCancelledException.class);
    assertThat(fixture.conversationManager.history(conversation.getId()))
        .extracting(Turn::getRole)
        .containsExactly(MessageRole.USER);
    assertThat(fixture.counter("query.cancelled")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should reject questions for unknown conversations")
  void shouldRejectUnknownConversation() {
    fixture.start();
    UUID unknown = UUID.randomUUID();

    assertThatThrownBy(
            () -> fixture.orchestrator.ask(unknown, "Hello?", CancellationToken.create()))
        .isInstanceOf(ConversationNotFoundException.class);
  }
}
