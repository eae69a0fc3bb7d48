package com.flamingo.ai.docqa.service.rag.index;

import java.util.List;
import java.util.UUID;

/**
 * Stores chunk vectors and answers nearest-neighbour queries. Every vector has the same
 * dimensionality and is scored with the same metric for the lifetime of the index.
 */
public interface VectorIndex {

  int dimensions();

  SimilarityMetric metric();

  /**
   * Inserts or replaces the vector of a chunk.
   *
   * @throws com.flamingo.ai.docqa.exception.DimensionMismatchException if the vector length is
   *     not {@link #dimensions()}
   */
  void insert(String chunkId, float[] vector, VectorMetadata metadata);

  /**
   * Returns at most {@code k} matches scoring at least {@code scoreThreshold}, ordered by
   * descending score with ties broken by ascending chunk id.
   */
  List<VectorMatch> search(float[] query, int k, double scoreThreshold);

  /** Removes every vector of a document. Idempotent. */
  void delete(UUID documentId);

  /** Number of vectors stored for a document. */
  long count(UUID documentId);

  /**
   * Opens an exclusive write section for a document. Inserts and deletes for that document made
   * by the holder become visible to searches together when the section closes.
   */
  IndexLock exclusive(UUID documentId);
}
