package com.flamingo.ai.docqa.service.rag.pipeline;

import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.service.rag.concurrent.CancellationToken;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle to one asynchronous ingestion of one document revision.
 *
 * <p>{@link #completion()} completes with the document in its terminal status once the job has
 * finished, including any rollback after a failure or cancellation.
 */
public final class IngestionJob {

  private final UUID documentId;
  private final int revision;
  private final CancellationToken token = CancellationToken.create();
  private final CompletableFuture<Document> completion = new CompletableFuture<>();

  IngestionJob(UUID documentId, int revision) {
    this.documentId = documentId;
    this.revision = revision;
  }

  public UUID getDocumentId() {
    return documentId;
  }

  public int getRevision() {
    return revision;
  }

  CancellationToken token() {
    return token;
  }

  public CompletableFuture<Document> completion() {
    return completion;
  }

  /** Requests cancellation. The job stops at its next checkpoint and rolls back. */
  public void cancel() {
    token.cancel();
  }

  public boolean isCancellationRequested() {
    return token.isCancellationRequested();
  }

  /**
   * Waits for the job to finish.
   *
   * @return the final document, or empty if the job did not finish in time
   */
  public Optional<Document> await(Duration timeout) throws InterruptedException {
    try {
      return Optional.of(completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
    } catch (TimeoutException e) {
      return Optional.empty();
    } catch (ExecutionException e) {
      throw new IllegalStateException("Ingestion of " + documentId + " crashed", e.getCause());
    }
  }

  void complete(Document document) {
    completion.complete(document);
  }

  void crash(Throwable failure) {
    completion.completeExceptionally(failure);
  }
}
