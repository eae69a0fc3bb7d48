package com.flamingo.ai.docqa.service.rag.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.flamingo.ai.docqa.domain.entity.Chunk;
import com.flamingo.ai.docqa.exception.InvalidConfigException;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SlidingWindowChunker Tests")
class SlidingWindowChunkerTest {

  private final SlidingWindowChunker chunker = new SlidingWindowChunker();
  private final UUID documentId = UUID.randomUUID();

  @Test
  @DisplayName("Should split text into overlapping windows")
  void shouldSplitTextIntoOverlappingWindows() {
    List<Chunk> chunks = chunker.chunk(documentId, "The sky is blue. Grass is green.", 20, 5);

    assertThat(chunks).extracting(Chunk::getStartOffset).containsExactly(0, 15, 30);
    assertThat(chunks)
        .extracting(Chunk::getText)
        .containsExactly("The sky is blue. Gra", ". Grass is green.", "n.");
    assertThat(chunks).extracting(Chunk::getSequenceIndex).containsExactly(0, 1, 2);
  }

  @Test
  @DisplayName("Should derive ordered chunk ids from document and sequence")
  void shouldDeriveOrderedChunkIds() {
    List<Chunk> chunks = chunker.chunk(documentId, "x".repeat(120), 10, 0);

    assertThat(chunks).hasSize(12);
    assertThat(chunks.get(0).getId()).isEqualTo(Chunk.idFor(documentId, 0));
    assertThat(chunks.get(2).getId()).isLessThan(chunks.get(11).getId());
    assertThat(chunks).allMatch(chunk -> chunk.getDocumentId().equals(documentId));
  }

  @Test
  @DisplayName("Should produce identical chunks for identical input")
  void shouldBeDeterministic() {
    String text = "Chunking the same text twice must give the same windows every time. ".repeat(5);

    List<Chunk> first = chunker.chunk(documentId, text, 40, 8);
    List<Chunk> second = chunker.chunk(documentId, text, 40, 8);

    assertThat(second).hasSameSizeAs(first);
    assertThat(second)
        .extracting(Chunk::getId, Chunk::getStartOffset, Chunk::getEndOffset, Chunk::getText)
        .containsExactlyElementsOf(
            first.stream()
                .map(
                    chunk ->
                        tuple(
                            chunk.getId(),
                            chunk.getStartOffset(),
                            chunk.getEndOffset(),
                            chunk.getText()))
                .toList());
  }

  @Test
  @DisplayName("Should keep consecutive windows overlapping by the configured amount")
  void shouldOverlapConsecutiveWindows() {
    String text = "abcdefghijklmnopqrstuvwxyz0123456789";

    List<Chunk> chunks = chunker.chunk(documentId, text, 10, 3);

    for (int i = 1; i < chunks.size(); i++) {
      Chunk previous = chunks.get(i - 1);
      Chunk current = chunks.get(i);
      assertThat(current.getStartOffset()).isEqualTo(previous.getEndOffset() - 3);
      assertThat(text.substring(current.getStartOffset(), current.getEndOffset()))
          .isEqualTo(current.getText());
    }
    assertThat(chunks.get(chunks.size() - 1).getEndOffset()).isEqualTo(text.length());
  }

  @Test
  @DisplayName("Should return a single chunk for text shorter than the window")
  void shouldReturnSingleChunkForShortText() {
    List<Chunk> chunks = chunker.chunk(documentId, "short", 512, 50);

    assertThat(chunks).singleElement().satisfies(chunk -> assertThat(chunk.getText()).isEqualTo("short"));
  }

  @Test
  @DisplayName("Should return no chunks for empty text")
  void shouldReturnNoChunksForEmptyText() {
    assertThat(chunker.chunk(documentId, "", 20, 5)).isEmpty();
  }

  @Test
  @DisplayName("Should reject overlap that is not smaller than the size")
  void shouldRejectOverlapNotSmallerThanSize() {
    assertThatThrownBy(() -> chunker.chunk(documentId, "text", 10, 10))
        .isInstanceOf(InvalidConfigException.class)
        .hasMessageContaining("rag.chunking.overlap");
  }

  @Test
  @DisplayName("Should reject non-positive size")
  void shouldRejectNonPositiveSize() {
    assertThatThrownBy(() -> chunker.chunk(documentId, "text", 0, 0))
        .isInstanceOf(InvalidConfigException.class)
        .hasMessageContaining("rag.chunking.size");
  }
}
