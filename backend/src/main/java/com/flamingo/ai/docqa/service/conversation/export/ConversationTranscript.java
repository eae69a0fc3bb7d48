package com.flamingo.ai.docqa.service.conversation.export;

import com.flamingo.ai.docqa.domain.enums.MessageRole;
import com.flamingo.ai.docqa.domain.enums.TurnStatus;
import com.flamingo.ai.docqa.domain.model.SourceCitation;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Serializable snapshot of a conversation, the unit of export and import.
 *
 * @param version transcript format version
 */
public record ConversationTranscript(
    int version, UUID conversationId, String title, Instant createdAt, List<Entry> turns) {

  public static final int CURRENT_VERSION = 1;

  /** One turn of the transcript. */
  public record Entry(
      UUID id,
      int sequenceNumber,
      MessageRole role,
      String text,
      List<SourceCitation> citations,
      TurnStatus status,
      String failureReason,
      Instant createdAt) {}
}
