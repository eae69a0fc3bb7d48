package com.flamingo.ai.docqa.domain.entity;

import com.flamingo.ai.docqa.domain.converter.StringListConverter;
import com.flamingo.ai.docqa.domain.enums.DocumentStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * An uploaded document and its ingestion state.
 *
 * <p>The status only moves forward (see {@link DocumentStatus#canTransitionTo}); a re-ingestion
 * replaces the record with a fresh revision instead of rewinding it.
 */
@Entity
@Table(name = "documents")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Document {

  @Id private UUID id;

  @Column(nullable = false)
  private String fileName;

  private String mimeType;

  private Long fileSize;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private DocumentStatus status = DocumentStatus.UPLOADED;

  /** Short machine-readable failure reason, e.g. {@code extraction} or {@code embedding}. */
  private String failureReason;

  /** Human-readable detail of the failure, for operators. */
  @Column(columnDefinition = "TEXT")
  private String failureDetail;

  /** Incremented every time the document is re-ingested under the same identifier. */
  @Builder.Default private int revision = 1;

  /** Chunk identifiers in sequence order; populated once the document is indexed. */
  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> chunkIds = new ArrayList<>();

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  private Instant indexedAt;

  /**
   * Moves the document to the next pipeline status.
   *
   * @throws IllegalStateException if the transition would regress or skip a stage
   */
  public void transitionTo(DocumentStatus next) {
    if (!status.canTransitionTo(next)) {
      throw new IllegalStateException(
          "Illegal status transition for document " + id + ": " + status + " -> " + next);
    }
    this.status = next;
  }

  /** Marks the document as searchable. */
  public void markIndexed(List<String> indexedChunkIds, Instant at) {
    transitionTo(DocumentStatus.INDEXED);
    this.chunkIds = new ArrayList<>(indexedChunkIds);
    this.indexedAt = at;
  }

  /** Marks the document as failed with a reason and optional detail. */
  public void markFailed(String reason, String detail) {
    transitionTo(DocumentStatus.FAILED);
    this.failureReason = reason;
    this.failureDetail = detail;
    this.chunkIds = new ArrayList<>();
  }

  /** Returns a detached copy, used by stores that hand out snapshots. */
  public Document copy() {
    return toBuilder().chunkIds(new ArrayList<>(chunkIds)).build();
  }
}
