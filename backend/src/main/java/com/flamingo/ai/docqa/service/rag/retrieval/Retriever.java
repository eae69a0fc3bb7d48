package com.flamingo.ai.docqa.service.rag.retrieval;

import com.flamingo.ai.docqa.domain.entity.Chunk;
import com.flamingo.ai.docqa.exception.ChunkNotFoundException;
import com.flamingo.ai.docqa.service.rag.index.VectorIndex;
import com.flamingo.ai.docqa.service.rag.index.VectorMatch;
import com.flamingo.ai.docqa.store.DocumentStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Finds the chunks most similar to a query vector.
 *
 * <p>Vector matches whose chunk record is missing from the document store are skipped: the answer
 * is built from the remaining chunks and the inconsistency is logged and counted. A match whose
 * chunk record belongs to another revision of the document is skipped too, since the record was
 * replaced by a re-ingestion after the search scored the old vector.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Retriever {

  private final VectorIndex vectorIndex;
  private final DocumentStore documentStore;
  private final MeterRegistry meterRegistry;

  /**
   * Returns at most {@code k} chunks scoring at least {@code scoreThreshold}, most relevant first.
   */
  @Timed(value = "retrieval.retrieve", description = "Time to retrieve chunks")
  public List<RetrievedChunk> retrieve(float[] queryVector, int k, double scoreThreshold) {
    List<VectorMatch> matches = vectorIndex.search(queryVector, k, scoreThreshold);
    if (matches.isEmpty()) {
      return List.of();
    }

    Map<String, Chunk> chunksById =
        documentStore.findChunks(matches.stream().map(VectorMatch::chunkId).toList()).stream()
            .collect(Collectors.toMap(Chunk::getId, Function.identity(), (a, b) -> a));

    List<RetrievedChunk> results = new ArrayList<>(matches.size());
    for (VectorMatch match : matches) {
      try {
        Chunk chunk = resolve(chunksById, match);
        if (chunk.getRevision() != match.revision()) {
          log.debug(
              "Skipping match {}: scored revision {} but the stored chunk is revision {}",
              match.chunkId(),
              match.revision(),
              chunk.getRevision());
          meterRegistry.counter("retrieval.stale_match").increment();
          continue;
        }
        results.add(new RetrievedChunk(chunk, match.score()));
      } catch (ChunkNotFoundException e) {
        log.warn(
            "Skipping match for document {}: {} (index and store are out of sync)",
            match.documentId(),
            e.getMessage());
        meterRegistry.counter("retrieval.chunk_not_found").increment();
      }
    }
    log.debug("Retrieved {} of {} matched chunks", results.size(), matches.size());
    return results;
  }

  private static Chunk resolve(Map<String, Chunk> chunksById, VectorMatch match) {
    Chunk chunk = chunksById.get(match.chunkId());
    if (chunk == null) {
      throw new ChunkNotFoundException(match.chunkId());
    }
    return chunk;
  }
}
