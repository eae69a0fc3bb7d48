package com.flamingo.ai.docqa.service.rag.embedding;

import java.util.List;

/** Turns text into fixed-length vectors. */
public interface EmbeddingGateway {

  /** Length of every vector this gateway returns. */
  int dimensions();

  /**
   * Embeds passages, one vector per input text and in input order.
   *
   * @throws com.flamingo.ai.docqa.exception.ModelUnavailableException if the model cannot be
   *     reached; the caller may retry
   * @throws com.flamingo.ai.docqa.exception.DimensionMismatchException if the model returns
   *     vectors of an unexpected length
   */
  List<float[]> embed(List<String> texts);

  /** Embeds a user question. */
  default float[] embedQuery(String query) {
    return embed(List.of(query)).get(0);
  }
}
