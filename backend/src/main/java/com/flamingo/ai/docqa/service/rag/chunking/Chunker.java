package com.flamingo.ai.docqa.service.rag.chunking;

import com.flamingo.ai.docqa.domain.entity.Chunk;
import java.util.List;
import java.util.UUID;

/** Splits extracted text into ordered chunks. */
public interface Chunker {

  /**
   * Splits {@code text} into chunks of at most {@code size} characters where consecutive chunks
   * share {@code overlap} characters.
   *
   * @return chunks in sequence order; empty for empty text
   * @throws com.flamingo.ai.docqa.exception.InvalidConfigException if size or overlap are invalid
   */
  List<Chunk> chunk(UUID documentId, String text, int size, int overlap);
}
