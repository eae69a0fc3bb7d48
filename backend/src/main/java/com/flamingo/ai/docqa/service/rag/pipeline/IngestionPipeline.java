package com.flamingo.ai.docqa.service.rag.pipeline;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.domain.entity.Chunk;
import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.domain.enums.DocumentStatus;
import com.flamingo.ai.docqa.exception.DimensionMismatchException;
import com.flamingo.ai.docqa.exception.DocumentNotFoundException;
import com.flamingo.ai.docqa.exception.ModelUnavailableException;
import com.flamingo.ai.docqa.exception.OperationCancelledException;
import com.flamingo.ai.docqa.exception.TextExtractionException;
import com.flamingo.ai.docqa.exception.VectorIndexException;
import com.flamingo.ai.docqa.service.rag.chunking.Chunker;
import com.flamingo.ai.docqa.service.rag.concurrent.CancellationToken;
import com.flamingo.ai.docqa.service.rag.embedding.EmbeddingGateway;
import com.flamingo.ai.docqa.service.rag.extraction.TextExtractor;
import com.flamingo.ai.docqa.service.rag.index.IndexLock;
import com.flamingo.ai.docqa.service.rag.index.VectorIndex;
import com.flamingo.ai.docqa.service.rag.index.VectorMetadata;
import com.flamingo.ai.docqa.service.rag.retry.RetryPolicy;
import com.flamingo.ai.docqa.store.DocumentStore;
import com.google.common.collect.Lists;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives one document through extraction, chunking, embedding and indexing.
 *
 * <p>A document either ends {@link DocumentStatus#INDEXED} with every chunk searchable, or
 * {@link DocumentStatus#FAILED} with none of its chunks in the index. All vectors are computed
 * before the index is touched, and the index is then rewritten inside an exclusive section.
 */
@Slf4j
public class IngestionPipeline {

  public static final String REASON_EXTRACTION = "extraction";
  public static final String REASON_EMBEDDING = "embedding";
  public static final String REASON_INDEXING = "indexing";
  public static final String REASON_CANCELLED = "cancelled";
  public static final String REASON_INTERNAL = "internal";
  public static final String REASON_INTERRUPTED = "interrupted";

  private final RagConfig config;
  private final TextExtractor textExtractor;
  private final Chunker chunker;
  private final EmbeddingGateway embeddingGateway;
  private final VectorIndex vectorIndex;
  private final DocumentStore documentStore;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final RetryPolicy embeddingRetry;

  public IngestionPipeline(
      RagConfig config,
      TextExtractor textExtractor,
      Chunker chunker,
      EmbeddingGateway embeddingGateway,
      VectorIndex vectorIndex,
      DocumentStore documentStore,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.config = config;
    this.textExtractor = textExtractor;
    this.chunker = chunker;
    this.embeddingGateway = embeddingGateway;
    this.vectorIndex = vectorIndex;
    this.documentStore = documentStore;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
    this.embeddingRetry = RetryPolicy.from("embedding", config.getEmbedding().getRetry());
  }

  /** Runs the job to a terminal status and returns the final document. */
  Document run(IngestionJob job, byte[] content) {
    Document document = load(job.getDocumentId());
    return guarded(
        document,
        () -> {
          job.token().throwIfCancelled();
          advance(document, DocumentStatus.EXTRACTING);
          String text;
          try {
            text = textExtractor.extract(content, document.getMimeType(), document.getFileName());
          } catch (TextExtractionException e) {
            return fail(document, REASON_EXTRACTION, e);
          }

          job.token().throwIfCancelled();
          advance(document, DocumentStatus.CHUNKING);
          List<Chunk> chunks =
              chunker.chunk(
                  document.getId(),
                  text,
                  config.getChunking().getSize(),
                  config.getChunking().getOverlap());
          return embedAndIndex(document, chunks, job.token());
        });
  }

  /**
   * Re-embeds the stored chunks of a document whose vectors were lost, for example after a
   * restart with an in-memory index. Extraction and chunking are not repeated.
   */
  Document restore(IngestionJob job) {
    Document document = load(job.getDocumentId());
    return guarded(
        document,
        () -> {
          List<Chunk> chunks = documentStore.findChunksByDocument(document.getId());
          advance(document, DocumentStatus.EXTRACTING);
          advance(document, DocumentStatus.CHUNKING);
          log.info("Restoring {} chunks of document {}", chunks.size(), document.getId());
          return embedAndIndex(document, chunks, job.token());
        });
  }

  /** Fails a document without running it, removing anything it left in the index. */
  Document abandon(Document document, String reason, String detail) {
    return fail(document, reason, new IllegalStateException(detail));
  }

  private Document embedAndIndex(Document document, List<Chunk> chunks, CancellationToken token) {
    token.throwIfCancelled();
    advance(document, DocumentStatus.EMBEDDING);
    List<float[]> vectors;
    try {
      vectors = embed(chunks, token);
    } catch (ModelUnavailableException | DimensionMismatchException e) {
      return fail(document, REASON_EMBEDDING, e);
    }

    try {
      writeIndex(document.getId(), document.getRevision(), chunks, vectors, token);
    } catch (VectorIndexException | DimensionMismatchException e) {
      return fail(document, REASON_INDEXING, e);
    }

    document.markIndexed(chunks.stream().map(Chunk::getId).toList(), clock.instant());
    documentStore.save(document);
    meterRegistry.counter("ingestion.success").increment();
    log.info(
        "Indexed document {} '{}' (revision {}): {} chunks",
        document.getId(),
        document.getFileName(),
        document.getRevision(),
        chunks.size());
    return document;
  }

  /** Turns cancellation and unexpected failures into a failed document. */
  private Document guarded(Document document, Supplier<Document> work) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      return work.get();
    } catch (OperationCancelledException e) {
      return fail(document, REASON_CANCELLED, e);
    } catch (RuntimeException e) {
      log.error("Unexpected failure while ingesting document {}", document.getId(), e);
      return fail(document, REASON_INTERNAL, e);
    } finally {
      sample.stop(meterRegistry.timer("ingestion.duration"));
    }
  }

  private Document load(UUID documentId) {
    return documentStore
        .findById(documentId)
        .orElseThrow(() -> new DocumentNotFoundException(documentId));
  }

  private void advance(Document document, DocumentStatus next) {
    document.transitionTo(next);
    documentStore.save(document);
    log.debug("Document {} -> {}", document.getId(), next);
  }

  private List<float[]> embed(List<Chunk> chunks, CancellationToken token) {
    List<float[]> vectors = new ArrayList<>(chunks.size());
    for (List<Chunk> batch : Lists.partition(chunks, config.getEmbedding().getBatchSize())) {
      token.throwIfCancelled();
      List<String> texts = batch.stream().map(Chunk::getText).toList();
      vectors.addAll(
          embeddingRetry.execute(
              () -> embeddingGateway.embed(texts), ModelUnavailableException.class::isInstance, token));
    }
    return vectors;
  }

  /** Replaces the document's vectors and chunk records in one exclusive section. */
  private void writeIndex(
      UUID documentId,
      int revision,
      List<Chunk> chunks,
      List<float[]> vectors,
      CancellationToken token) {
    try (IndexLock ignored = vectorIndex.exclusive(documentId)) {
      try {
        vectorIndex.delete(documentId);
        for (int i = 0; i < chunks.size(); i++) {
          token.throwIfCancelled();
          Chunk chunk = chunks.get(i);
          vectorIndex.insert(
              chunk.getId(),
              vectors.get(i),
              new VectorMetadata(documentId, chunk.getSequenceIndex(), revision));
          chunk.setRevision(revision);
          chunk.setEmbeddingId(chunk.getId());
        }
        documentStore.replaceChunks(documentId, chunks);
      } catch (RuntimeException e) {
        rollback(documentId, e);
        throw e;
      }
    }
  }

  private Document fail(Document document, String reason, Exception cause) {
    rollback(document.getId(), cause);
    document.markFailed(reason, cause.getMessage());
    documentStore.save(document);
    meterRegistry.counter("ingestion.failure", "reason", reason).increment();
    if (REASON_CANCELLED.equals(reason)) {
      log.info("Ingestion of document {} cancelled", document.getId());
    } else {
      log.warn("Ingestion of document {} failed at {}: {}", document.getId(), reason, cause.getMessage());
    }
    return document;
  }

  /** Removes every vector and chunk record of the document. */
  private void rollback(UUID documentId, Exception cause) {
    try (IndexLock ignored = vectorIndex.exclusive(documentId)) {
      vectorIndex.delete(documentId);
      documentStore.deleteChunks(documentId);
    } catch (RuntimeException e) {
      cause.addSuppressed(e);
      log.error("Rollback of document {} failed; index may hold stale vectors", documentId, e);
    }
  }
}
