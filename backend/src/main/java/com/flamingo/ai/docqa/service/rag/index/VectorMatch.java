package com.flamingo.ai.docqa.service.rag.index;

import java.util.Comparator;
import java.util.UUID;

/** A single search hit, tagged with the document revision its vector was written for. */
public record VectorMatch(String chunkId, UUID documentId, int revision, double score) {

  /** Descending score, ties broken by ascending chunk id. */
  public static final Comparator<VectorMatch> RANKING =
      Comparator.comparingDouble(VectorMatch::score)
          .reversed()
          .thenComparing(VectorMatch::chunkId);
}
