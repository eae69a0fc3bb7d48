package com.flamingo.ai.docqa.service.rag.pipeline;

import com.flamingo.ai.docqa.domain.entity.Chunk;
import com.flamingo.ai.docqa.domain.entity.Conversation;
import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.domain.entity.Turn;
import com.flamingo.ai.docqa.domain.enums.DocumentStatus;
import com.flamingo.ai.docqa.exception.DocumentNotFoundException;
import com.flamingo.ai.docqa.service.conversation.ConversationManager;
import com.flamingo.ai.docqa.service.rag.concurrent.CancellationToken;
import com.flamingo.ai.docqa.service.rag.index.IndexLock;
import com.flamingo.ai.docqa.service.rag.index.VectorIndex;
import com.flamingo.ai.docqa.store.DocumentStore;
import io.micrometer.core.annotation.Timed;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the pipeline: document lifecycle on the ingestion pool and question answering.
 *
 * <p>Ingestion jobs for different documents run concurrently; at most one job per document runs at
 * a time.
 */
@Slf4j
public class RagOrchestrator {

  private final RagContext context;
  private final IngestionPipeline ingestionPipeline;
  private final QueryPipeline queryPipeline;
  private final DocumentStore documentStore;
  private final VectorIndex vectorIndex;
  private final ConversationManager conversationManager;
  private final Clock clock;

  public RagOrchestrator(
      RagContext context,
      IngestionPipeline ingestionPipeline,
      QueryPipeline queryPipeline,
      DocumentStore documentStore,
      ConversationManager conversationManager,
      Clock clock) {
    this.context = context;
    this.ingestionPipeline = ingestionPipeline;
    this.queryPipeline = queryPipeline;
    this.documentStore = documentStore;
    this.vectorIndex = context.getVectorIndex();
    this.conversationManager = conversationManager;
    this.clock = clock;
  }

  // ---- documents ----

  /**
   * Registers a new document and starts ingesting it in the background.
   *
   * @return the running job; the document starts in {@code UPLOADED}
   */
  public IngestionJob ingest(String fileName, String mimeType, byte[] content) {
    context.ensureRunning();
    Document document =
        Document.builder()
            .id(UUID.randomUUID())
            .fileName(fileName)
            .mimeType(mimeType)
            .fileSize((long) content.length)
            .createdAt(clock.instant())
            .build();
    log.info("Accepted document {} '{}' ({} bytes)", document.getId(), fileName, content.length);
    return submit(document, job -> ingestionPipeline.run(job, content));
  }

  /**
   * Replaces an existing document's content with a new revision under the same identifier. The
   * previous revision stays searchable until the new one is indexed.
   *
   * @throws DocumentNotFoundException if the document does not exist
   * @throws IllegalStateException if the document is still being ingested
   */
  public IngestionJob reingest(UUID documentId, String mimeType, byte[] content) {
    context.ensureRunning();
    Document current = getDocument(documentId);
    Document revision =
        Document.builder()
            .id(documentId)
            .fileName(current.getFileName())
            .mimeType(mimeType != null ? mimeType : current.getMimeType())
            .fileSize((long) content.length)
            .revision(current.getRevision() + 1)
            .createdAt(current.getCreatedAt())
            .build();
    log.info("Re-ingesting document {} as revision {}", documentId, revision.getRevision());
    return submit(revision, job -> ingestionPipeline.run(job, content));
  }

  private IngestionJob submit(Document document, Function<IngestionJob, Document> work) {
    IngestionJob job = new IngestionJob(document.getId(), document.getRevision());
    context.register(job);
    try {
      documentStore.save(document);
    } catch (RuntimeException e) {
      context.unregister(job);
      throw e;
    }
    try {
      context.getIngestionExecutor().execute(() -> runJob(job, work));
    } catch (RejectedExecutionException e) {
      context.unregister(job);
      document.markFailed("rejected", "Ingestion queue is full");
      documentStore.save(document);
      job.complete(document);
      log.warn("Ingestion queue full, rejected document {}", document.getId());
    }
    return job;
  }

  private void runJob(IngestionJob job, Function<IngestionJob, Document> work) {
    Document result;
    try {
      result = work.apply(job);
    } catch (RuntimeException | Error e) {
      log.error("Ingestion job for document {} crashed", job.getDocumentId(), e);
      context.unregister(job);
      job.crash(e);
      throw e;
    }
    // unregister first so that a caller woken by completion can start the next revision
    context.unregister(job);
    job.complete(result);
  }

  /**
   * Reconciles stored documents with the vector index after a restart. Documents left mid-pipeline
   * are failed as interrupted; indexed documents whose vectors are missing are re-embedded from
   * their stored chunks as a new revision.
   *
   * @return the restore jobs that were started
   */
  public List<IngestionJob> recover() {
    context.ensureRunning();
    List<IngestionJob> restores = new ArrayList<>();
    for (Document document : documentStore.findAll()) {
      if (context.activeJob(document.getId()).isPresent()) {
        continue;
      }
      if (!document.getStatus().isTerminal()) {
        ingestionPipeline.abandon(
            document,
            IngestionPipeline.REASON_INTERRUPTED,
            "Service stopped during " + document.getStatus());
      } else if (document.getStatus() == DocumentStatus.INDEXED
          && vectorIndex.count(document.getId()) < document.getChunkIds().size()) {
        Document revision =
            Document.builder()
                .id(document.getId())
                .fileName(document.getFileName())
                .mimeType(document.getMimeType())
                .fileSize(document.getFileSize())
                .revision(document.getRevision() + 1)
                .chunkIds(new ArrayList<>(document.getChunkIds()))
                .createdAt(document.getCreatedAt())
                .build();
        restores.add(submit(revision, ingestionPipeline::restore));
      }
    }
    return restores;
  }

  public Document getDocument(UUID documentId) {
    return documentStore
        .findById(documentId)
        .orElseThrow(() -> new DocumentNotFoundException(documentId));
  }

  public List<Document> listDocuments() {
    return documentStore.findAll();
  }

  public List<Chunk> getChunks(UUID documentId) {
    getDocument(documentId);
    return documentStore.findChunksByDocument(documentId);
  }

  public Optional<IngestionJob> findJob(UUID documentId) {
    return context.activeJob(documentId);
  }

  /**
   * Requests cancellation of the running ingestion of a document.
   *
   * @return whether a running job was found
   */
  public boolean cancelIngestion(UUID documentId) {
    getDocument(documentId);
    Optional<IngestionJob> job = context.activeJob(documentId);
    job.ifPresent(IngestionJob::cancel);
    return job.isPresent();
  }

  /**
   * Removes a document, its chunks and its vectors. A running ingestion is cancelled and awaited
   * first.
   */
  @Timed(value = "document.remove", description = "Time to remove a document")
  public void removeDocument(UUID documentId) {
    getDocument(documentId);
    Optional<IngestionJob> job = context.activeJob(documentId);
    if (job.isPresent()) {
      job.get().cancel();
      Duration timeout = context.getConfig().getIngestion().getCancelTimeout();
      try {
        if (job.get().await(timeout).isEmpty()) {
          throw new IllegalStateException(
              "Ingestion of " + documentId + " did not stop within " + timeout);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while removing document " + documentId, e);
      }
    }
    try (IndexLock ignored = vectorIndex.exclusive(documentId)) {
      vectorIndex.delete(documentId);
      documentStore.deleteChunks(documentId);
      documentStore.delete(documentId);
    }
    log.info("Removed document {}", documentId);
  }

  // ---- conversations ----

  public Conversation startConversation(String title) {
    return conversationManager.create(title);
  }

  /**
   * Records the question as a user turn, then answers it.
   *
   * @return the assistant turn, which may be a failed one
   * @throws com.flamingo.ai.docqa.exception.OperationCancelledException if cancelled by the
   *     caller; the question stays recorded but no answer is
   */
  @Timed(value = "query.ask", description = "Time to answer a question")
  public Turn ask(UUID conversationId, String question, CancellationToken token) {
    context.ensureRunning();
    conversationManager.append(conversationId, Turn.question(question));
    return queryPipeline.answer(conversationId, question, token);
  }

  /** Runs {@link #ask} on the query pool. Cancel through {@code token}. */
  public CompletableFuture<Turn> askAsync(
      UUID conversationId, String question, CancellationToken token) {
    return CompletableFuture.supplyAsync(
        () -> ask(conversationId, question, token), context.getQueryExecutor());
  }
}
