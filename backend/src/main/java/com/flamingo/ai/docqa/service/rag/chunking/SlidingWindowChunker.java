package com.flamingo.ai.docqa.service.rag.chunking;

import com.flamingo.ai.docqa.domain.entity.Chunk;
import com.flamingo.ai.docqa.exception.InvalidConfigException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Fixed-size character windows. A window starts every {@code size - overlap} characters, and the
 * last window is truncated at the end of the text. Offsets are measured in UTF-16 code units.
 */
@Component
@Slf4j
public class SlidingWindowChunker implements Chunker {

  @Override
  public List<Chunk> chunk(UUID documentId, String text, int size, int overlap) {
    validate(size, overlap);
    if (text == null || text.isEmpty()) {
      return List.of();
    }

    int step = size - overlap;
    int length = text.length();
    List<Chunk> chunks = new ArrayList<>(length / step + 1);

    int sequence = 0;
    for (int start = 0; start < length; start += step) {
      int end = Math.min(start + size, length);
      chunks.add(
          Chunk.builder()
              .id(Chunk.idFor(documentId, sequence))
              .documentId(documentId)
              .sequenceIndex(sequence)
              .startOffset(start)
              .endOffset(end)
              .text(text.substring(start, end))
              .build());
      sequence++;
    }

    log.debug(
        "Split document {} ({} chars) into {} chunks (size={}, overlap={})",
        documentId,
        length,
        chunks.size(),
        size,
        overlap);
    return chunks;
  }

  /** Rejects window settings that cannot make progress. */
  public static void validate(int size, int overlap) {
    if (size <= 0) {
      throw new InvalidConfigException("rag.chunking.size", "must be positive but was " + size);
    }
    if (overlap < 0 || overlap >= size) {
      throw new InvalidConfigException(
          "rag.chunking.overlap", "must be in [0, " + size + ") but was " + overlap);
    }
  }
}
