package com.flamingo.ai.docqa.config;

import com.flamingo.ai.docqa.exception.InvalidConfigException;
import com.flamingo.ai.docqa.service.rag.index.SimilarityMetric;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the RAG pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Retrieval retrieval = new Retrieval();
  private Context context = new Context();
  private Embedding embedding = new Embedding();
  private Generation generation = new Generation();
  private VectorIndex vectorIndex = new VectorIndex();
  private Storage storage = new Storage();
  private Ingestion ingestion = new Ingestion();

  @Getter
  @Setter
  public static class Chunking {
    /** Window size in characters. */
    private int size = 512;

    /** Characters shared by consecutive chunks; must be smaller than {@link #size}. */
    private int overlap = 50;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 6;

    /** Matches scoring below this value are dropped by the vector index. */
    private double scoreThreshold = 0.0;
  }

  @Getter
  @Setter
  public static class Context {
    /** Upper bound on the estimated token size of the assembled context. */
    private int tokenBudget = 3000;

    /** Characters per token used by the token estimator. */
    private int charsPerToken = 4;

    /** Instruction placed before the assembled context in the prompt. */
    private String promptPreamble =
        "Answer the question using only the numbered sources below. "
            + "Cite sources by their marker, for example [1]. "
            + "If the sources do not contain the answer, say so.";
  }

  @Getter
  @Setter
  public static class Embedding {
    /** Embedding backend: "openai" or "hashing" (deterministic, offline). */
    private String provider = "openai";

    private int dimensions = 1536;

    /** Maximum number of texts sent to the embedding service in one call. */
    private int batchSize = 32;

    private Retry retry = new Retry();
  }

  @Getter
  @Setter
  public static class Generation {
    /** Answer-generation backend: "openai" or "mock". */
    private String provider = "openai";

    /** Upper bound on a single generation call. */
    private Duration timeout = Duration.ofSeconds(60);

    private Retry retry = Retry.singleAttempt();
  }

  @Getter
  @Setter
  public static class VectorIndex {
    /** Vector store backend: "memory" or "elasticsearch". */
    private String backend = "memory";

    private SimilarityMetric metric = SimilarityMetric.COSINE;
  }

  @Getter
  @Setter
  public static class Storage {
    /** Document and conversation persistence: "jpa" or "memory". */
    private String type = "jpa";
  }

  @Getter
  @Setter
  public static class Ingestion {
    private int corePoolSize = 2;
    private int maxPoolSize = 4;
    private int queueCapacity = 100;

    /** How long document removal waits for a cancelled ingestion job to roll back. */
    private Duration cancelTimeout = Duration.ofSeconds(30);

    private long maxFileSizeBytes = 50 * 1024 * 1024L; // 50 MB
  }

  /** Exponential backoff settings shared by the embedding and generation calls. */
  @Getter
  @Setter
  public static class Retry {
    private int maxAttempts = 4;
    private Duration baseDelay = Duration.ofMillis(500);
    private double multiplier = 2.0;

    /** Randomization factor in [0, 1); 0 disables jitter. */
    private double jitter = 0.2;

    static Retry singleAttempt() {
      Retry retry = new Retry();
      retry.setMaxAttempts(1);
      return retry;
    }
  }

  /**
   * Checks every setting that has to hold for the pipeline to work.
   *
   * @throws InvalidConfigException naming the first offending property
   */
  public void validate() {
    if (chunking.size <= 0) {
      throw new InvalidConfigException("rag.chunking.size", "must be positive");
    }
    if (chunking.overlap < 0 || chunking.overlap >= chunking.size) {
      throw new InvalidConfigException(
          "rag.chunking.overlap", "must be in [0, " + chunking.size + ") but was " + chunking.overlap);
    }
    if (retrieval.topK <= 0) {
      throw new InvalidConfigException("rag.retrieval.top-k", "must be positive");
    }
    if (Double.isNaN(retrieval.scoreThreshold) || Double.isInfinite(retrieval.scoreThreshold)) {
      throw new InvalidConfigException("rag.retrieval.score-threshold", "must be a finite number");
    }
    if (context.tokenBudget <= 0) {
      throw new InvalidConfigException("rag.context.token-budget", "must be positive");
    }
    if (context.charsPerToken <= 0) {
      throw new InvalidConfigException("rag.context.chars-per-token", "must be positive");
    }
    if (embedding.dimensions <= 0) {
      throw new InvalidConfigException("rag.embedding.dimensions", "must be positive");
    }
    if (embedding.batchSize <= 0) {
      throw new InvalidConfigException("rag.embedding.batch-size", "must be positive");
    }
    validateRetry("rag.embedding.retry", embedding.retry);
    validateRetry("rag.generation.retry", generation.retry);
    if (generation.timeout == null || generation.timeout.isNegative() || generation.timeout.isZero()) {
      throw new InvalidConfigException("rag.generation.timeout", "must be positive");
    }
    if (vectorIndex.metric == null) {
      throw new InvalidConfigException("rag.vector-index.metric", "must be set");
    }
    if (ingestion.corePoolSize <= 0 || ingestion.maxPoolSize < ingestion.corePoolSize) {
      throw new InvalidConfigException(
          "rag.ingestion.max-pool-size", "must be at least core-pool-size, which must be positive");
    }
  }

  private static void validateRetry(String prefix, Retry retry) {
    if (retry.maxAttempts < 1) {
      throw new InvalidConfigException(prefix + ".max-attempts", "must be at least 1");
    }
    if (retry.baseDelay == null || retry.baseDelay.toMillis() < 1) {
      throw new InvalidConfigException(prefix + ".base-delay", "must be at least 1ms");
    }
    if (retry.multiplier < 1.0) {
      throw new InvalidConfigException(prefix + ".multiplier", "must be at least 1.0");
    }
    if (retry.jitter < 0.0 || retry.jitter >= 1.0) {
      throw new InvalidConfigException(prefix + ".jitter", "must be in [0, 1)");
    }
  }
}
