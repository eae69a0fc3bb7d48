package com.flamingo.ai.docqa.api.dto.response;

import com.flamingo.ai.docqa.domain.entity.Turn;
import com.flamingo.ai.docqa.domain.enums.MessageRole;
import com.flamingo.ai.docqa.domain.enums.TurnStatus;
import com.flamingo.ai.docqa.domain.model.SourceCitation;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a conversation turn. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnResponse {

  private UUID id;
  private int sequenceNumber;
  private MessageRole role;
  private String text;
  private List<SourceCitation> citations;
  private TurnStatus status;
  private String failureReason;
  private Instant createdAt;

  public static TurnResponse fromEntity(Turn turn) {
    return TurnResponse.builder()
        .id(turn.getId())
        .sequenceNumber(turn.getSequenceNumber())
        .role(turn.getRole())
        .text(turn.getText())
        .citations(turn.getCitations())
        .status(turn.getStatus())
        .failureReason(turn.getFailureReason())
        .createdAt(turn.getCreatedAt())
        .build();
  }
}
