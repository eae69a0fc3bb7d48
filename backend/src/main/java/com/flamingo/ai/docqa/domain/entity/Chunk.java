package com.flamingo.ai.docqa.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * A contiguous span of a document's extracted text: the unit of embedding and retrieval.
 *
 * <p>The vector itself lives in the vector index; this record only carries its identifier.
 */
@Entity
@Table(name = "chunks", indexes = @Index(name = "idx_chunks_document", columnList = "documentId"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString(exclude = "text")
public class Chunk {

  @Id private String id;

  @Column(nullable = false)
  private UUID documentId;

  private int sequenceIndex;

  /** Revision of the document this chunk was written for. */
  private int revision;

  /** Inclusive start offset in the extracted text. */
  private int startOffset;

  /** Exclusive end offset in the extracted text. */
  private int endOffset;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String text;

  /** Identifier of the vector in the index; {@code null} until the chunk is indexed. */
  private String embeddingId;

  /**
   * Derives the chunk identifier from its document and position. The sequence index is zero
   * padded so that lexicographic order of identifiers matches sequence order.
   */
  public static String idFor(UUID documentId, int sequenceIndex) {
    return String.format("%s_%06d", documentId, sequenceIndex);
  }
}
