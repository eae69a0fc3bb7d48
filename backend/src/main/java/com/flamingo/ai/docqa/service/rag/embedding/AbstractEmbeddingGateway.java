package com.flamingo.ai.docqa.service.rag.embedding;

import com.flamingo.ai.docqa.exception.DimensionMismatchException;
import com.flamingo.ai.docqa.exception.ModelUnavailableException;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class that splits input into bounded batches and checks every returned vector.
 * Subclasses only embed a single batch.
 */
public abstract class AbstractEmbeddingGateway implements EmbeddingGateway {

  private final int dimensions;
  private final int batchSize;

  protected AbstractEmbeddingGateway(int dimensions, int batchSize) {
    if (dimensions <= 0 || batchSize <= 0) {
      throw new IllegalArgumentException("dimensions and batchSize must be positive");
    }
    this.dimensions = dimensions;
    this.batchSize = batchSize;
  }

  /** Embeds at most {@code batchSize} texts. */
  protected abstract List<float[]> embedBatch(List<String> batch);

  @Override
  public int dimensions() {
    return dimensions;
  }

  @Override
  public List<float[]> embed(List<String> texts) {
    List<float[]> vectors = new ArrayList<>(texts.size());
    for (List<String> batch : Lists.partition(texts, batchSize)) {
      List<float[]> embedded = embedBatch(batch);
      if (embedded.size() != batch.size()) {
        throw new ModelUnavailableException(
            "Embedding model returned " + embedded.size() + " vectors for " + batch.size() + " texts");
      }
      for (float[] vector : embedded) {
        if (vector.length != dimensions) {
          throw new DimensionMismatchException(dimensions, vector.length);
        }
        vectors.add(vector);
      }
    }
    return vectors;
  }
}
