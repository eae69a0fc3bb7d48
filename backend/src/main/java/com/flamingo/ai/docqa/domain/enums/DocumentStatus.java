package com.flamingo.ai.docqa.domain.enums;

/**
 * Ingestion status of an uploaded document.
 *
 * <p>Statuses advance strictly in declaration order; {@link #FAILED} is reachable from every
 * non-terminal status.
 */
public enum DocumentStatus {
  /** Document has been accepted but the pipeline has not picked it up yet. */
  UPLOADED,

  /** Raw bytes are being converted to plain text. */
  EXTRACTING,

  /** Plain text is being split into overlapping chunks. */
  CHUNKING,

  /** Chunks are being embedded and written to the vector index. */
  EMBEDDING,

  /** All chunks are searchable. */
  INDEXED,

  /** Ingestion stopped; see the document's failure reason. */
  FAILED;

  public boolean isTerminal() {
    return this == INDEXED || this == FAILED;
  }

  /** Returns whether a document in this status may move to {@code next}. */
  public boolean canTransitionTo(DocumentStatus next) {
    if (isTerminal()) {
      return false;
    }
    if (next == FAILED) {
      return true;
    }
    return next.ordinal() == ordinal() + 1;
  }
}
