package com.flamingo.ai.docqa.api.dto.response;

import com.flamingo.ai.docqa.domain.entity.Document;
import com.flamingo.ai.docqa.domain.enums.DocumentStatus;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for document data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private UUID id;
  private String fileName;
  private String mimeType;
  private Long fileSize;
  private DocumentStatus status;
  private int revision;
  private int chunkCount;
  private String failureReason;
  private String failureDetail;
  private Instant createdAt;
  private Instant indexedAt;

  /** Creates a DocumentResponse from a Document entity. */
  public static DocumentResponse fromEntity(Document document) {
    return DocumentResponse.builder()
        .id(document.getId())
        .fileName(document.getFileName())
        .mimeType(document.getMimeType())
        .fileSize(document.getFileSize())
        .status(document.getStatus())
        .revision(document.getRevision())
        .chunkCount(document.getChunkIds() == null ? 0 : document.getChunkIds().size())
        .failureReason(document.getFailureReason())
        .failureDetail(document.getFailureDetail())
        .createdAt(document.getCreatedAt())
        .indexedAt(document.getIndexedAt())
        .build();
  }
}
