package com.flamingo.ai.docqa.api.dto.response;

import com.flamingo.ai.docqa.domain.entity.Chunk;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a chunk of a document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkResponse {

  private String id;
  private int sequenceIndex;
  private int startOffset;
  private int endOffset;
  private String text;
  private boolean indexed;

  public static ChunkResponse fromEntity(Chunk chunk) {
    return ChunkResponse.builder()
        .id(chunk.getId())
        .sequenceIndex(chunk.getSequenceIndex())
        .startOffset(chunk.getStartOffset())
        .endOffset(chunk.getEndOffset())
        .text(chunk.getText())
        .indexed(chunk.getEmbeddingId() != null)
        .build();
  }
}
