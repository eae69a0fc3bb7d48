package com.flamingo.ai.docqa.service.rag.pipeline;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.exception.InvalidConfigException;
import com.flamingo.ai.docqa.service.rag.embedding.EmbeddingGateway;
import com.flamingo.ai.docqa.service.rag.index.VectorIndex;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Shared state of one pipeline instance: validated configuration, worker pools and the registry
 * of running ingestion jobs. Created once, initialized with {@link #init()} and released with
 * {@link #shutdown()}.
 */
@Slf4j
public class RagContext {

  @Getter private final RagConfig config;
  @Getter private final EmbeddingGateway embeddingGateway;
  @Getter private final VectorIndex vectorIndex;
  @Getter private final ExecutorService ingestionExecutor;
  @Getter private final ExecutorService queryExecutor;
  @Getter private final ExecutorService generationExecutor;

  private final Map<UUID, IngestionJob> activeJobs = new ConcurrentHashMap<>();
  private final AtomicBoolean running = new AtomicBoolean();

  public RagContext(
      RagConfig config,
      EmbeddingGateway embeddingGateway,
      VectorIndex vectorIndex,
      ExecutorService ingestionExecutor,
      ExecutorService queryExecutor,
      ExecutorService generationExecutor) {
    this.config = config;
    this.embeddingGateway = embeddingGateway;
    this.vectorIndex = vectorIndex;
    this.ingestionExecutor = ingestionExecutor;
    this.queryExecutor = queryExecutor;
    this.generationExecutor = generationExecutor;
  }

  /**
   * Validates the configuration and the compatibility of the embedding model with the index.
   *
   * @throws InvalidConfigException if anything is inconsistent; the pipeline must not start
   */
  public void init() {
    config.validate();
    int indexDimensions = vectorIndex.dimensions();
    if (config.getEmbedding().getDimensions() != indexDimensions) {
      throw new InvalidConfigException(
          "rag.embedding.dimensions",
          "is " + config.getEmbedding().getDimensions() + " but the vector index expects " + indexDimensions);
    }
    if (embeddingGateway.dimensions() != indexDimensions) {
      throw new InvalidConfigException(
          "rag.embedding.provider",
          "produces " + embeddingGateway.dimensions() + "-dimensional vectors but the vector index expects "
              + indexDimensions);
    }
    running.set(true);
    log.info(
        "RAG pipeline ready: dims={}, metric={}, chunk size={}, overlap={}, top-k={}",
        indexDimensions,
        vectorIndex.metric(),
        config.getChunking().getSize(),
        config.getChunking().getOverlap(),
        config.getRetrieval().getTopK());
  }

  /** Cancels every running ingestion job. Worker pools are owned and closed by the caller. */
  public void shutdown() {
    if (!running.getAndSet(false)) {
      return;
    }
    List<IngestionJob> jobs = List.copyOf(activeJobs.values());
    jobs.forEach(IngestionJob::cancel);
    log.info("RAG pipeline shut down, cancelled {} ingestion jobs", jobs.size());
  }

  public boolean isRunning() {
    return running.get();
  }

  /**
   * @throws IllegalStateException if {@link #init()} has not completed or shutdown has begun
   */
  public void ensureRunning() {
    if (!running.get()) {
      throw new IllegalStateException("RAG pipeline is not running");
    }
  }

  /**
   * Registers a job as the active one for its document.
   *
   * @throws IllegalStateException if another job for the document is still running
   */
  void register(IngestionJob job) {
    IngestionJob previous = activeJobs.putIfAbsent(job.getDocumentId(), job);
    if (previous != null) {
      throw new IllegalStateException("Document " + job.getDocumentId() + " is still being ingested");
    }
  }

  void unregister(IngestionJob job) {
    activeJobs.remove(job.getDocumentId(), job);
  }

  Optional<IngestionJob> activeJob(UUID documentId) {
    return Optional.ofNullable(activeJobs.get(documentId));
  }
}
