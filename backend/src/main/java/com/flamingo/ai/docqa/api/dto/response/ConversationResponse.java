package com.flamingo.ai.docqa.api.dto.response;

import com.flamingo.ai.docqa.domain.entity.Conversation;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for conversation data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationResponse {

  private UUID id;
  private String title;
  private Instant createdAt;

  public static ConversationResponse fromEntity(Conversation conversation) {
    return ConversationResponse.builder()
        .id(conversation.getId())
        .title(conversation.getTitle())
        .createdAt(conversation.getCreatedAt())
        .build();
  }
}
