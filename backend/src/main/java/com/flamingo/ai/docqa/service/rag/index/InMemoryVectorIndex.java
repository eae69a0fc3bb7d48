package com.flamingo.ai.docqa.service.rag.index;

import com.flamingo.ai.docqa.exception.DimensionMismatchException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Brute-force vector index held in memory.
 *
 * <p>Vectors are partitioned by document. Each partition has its own read/write lock: writers to
 * one document never block searches of, or writes to, other documents, and a search reads each
 * partition under its read lock so it sees either the state before or after an exclusive section.
 */
@Slf4j
public class InMemoryVectorIndex implements VectorIndex {

  private final int dimensions;
  private final SimilarityMetric metric;
  private final Map<UUID, Partition> partitions = new ConcurrentHashMap<>();

  public InMemoryVectorIndex(int dimensions, SimilarityMetric metric) {
    if (dimensions <= 0) {
      throw new IllegalArgumentException("dimensions must be positive");
    }
    this.dimensions = dimensions;
    this.metric = metric;
  }

  @Override
  public int dimensions() {
    return dimensions;
  }

  @Override
  public SimilarityMetric metric() {
    return metric;
  }

  @Override
  public void insert(String chunkId, float[] vector, VectorMetadata metadata) {
    checkDimensions(vector);
    Partition partition = partitionFor(metadata.documentId());
    partition.lock.writeLock().lock();
    try {
      partition.vectors.put(chunkId, new StoredVector(vector.clone(), metadata.revision()));
    } finally {
      partition.lock.writeLock().unlock();
    }
  }

  @Override
  public List<VectorMatch> search(float[] query, int k, double scoreThreshold) {
    checkDimensions(query);
    if (k <= 0) {
      return List.of();
    }

    List<VectorMatch> candidates = new ArrayList<>();
    for (Map.Entry<UUID, Partition> entry : partitions.entrySet()) {
      Partition partition = entry.getValue();
      partition.lock.readLock().lock();
      try {
        for (Map.Entry<String, StoredVector> vector : partition.vectors.entrySet()) {
          StoredVector stored = vector.getValue();
          double score = metric.score(query, stored.values());
          if (score >= scoreThreshold) {
            candidates.add(
                new VectorMatch(vector.getKey(), entry.getKey(), stored.revision(), score));
          }
        }
      } finally {
        partition.lock.readLock().unlock();
      }
    }

    candidates.sort(VectorMatch.RANKING);
    return candidates.size() > k ? List.copyOf(candidates.subList(0, k)) : candidates;
  }

  @Override
  public void delete(UUID documentId) {
    Partition partition = partitions.get(documentId);
    if (partition == null) {
      return;
    }
    partition.lock.writeLock().lock();
    try {
      int removed = partition.vectors.size();
      partition.vectors.clear();
      log.debug("Removed {} vectors of document {}", removed, documentId);
    } finally {
      partition.lock.writeLock().unlock();
    }
  }

  @Override
  public long count(UUID documentId) {
    Partition partition = partitions.get(documentId);
    if (partition == null) {
      return 0;
    }
    partition.lock.readLock().lock();
    try {
      return partition.vectors.size();
    } finally {
      partition.lock.readLock().unlock();
    }
  }

  @Override
  public IndexLock exclusive(UUID documentId) {
    ReentrantReadWriteLock.WriteLock writeLock = partitionFor(documentId).lock.writeLock();
    writeLock.lock();
    return writeLock::unlock;
  }

  private Partition partitionFor(UUID documentId) {
    return partitions.computeIfAbsent(documentId, id -> new Partition());
  }

  private void checkDimensions(float[] vector) {
    if (vector.length != dimensions) {
      throw new DimensionMismatchException(dimensions, vector.length);
    }
  }

  // Partitions are never removed, so a writer always locks the partition searches will read.
  private static final class Partition {
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, StoredVector> vectors = new LinkedHashMap<>();
  }

  private record StoredVector(float[] values, int revision) {}
}
