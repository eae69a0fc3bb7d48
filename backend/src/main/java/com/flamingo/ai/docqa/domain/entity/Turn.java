package com.flamingo.ai.docqa.domain.entity;

import com.flamingo.ai.docqa.domain.converter.CitationListConverter;
import com.flamingo.ai.docqa.domain.enums.MessageRole;
import com.flamingo.ai.docqa.domain.enums.TurnStatus;
import com.flamingo.ai.docqa.domain.model.SourceCitation;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * One message in a conversation. Turns have no setters: once appended they never change.
 *
 * <p>Identifier, sequence number and timestamp are assigned by the conversation manager when the
 * turn is appended.
 */
@Entity
@Table(
    name = "turns",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_turns_conversation_sequence",
            columnNames = {"conversationId", "sequenceNumber"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString(exclude = "text")
public class Turn {

  @Id private UUID id;

  @Column(nullable = false)
  private UUID conversationId;

  private int sequenceNumber;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private MessageRole role;

  @Column(columnDefinition = "TEXT", nullable = false)
  @Builder.Default
  private String text = "";

  @Convert(converter = CitationListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<SourceCitation> citations = List.of();

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private TurnStatus status = TurnStatus.OK;

  /** Why the turn failed, e.g. {@code Unavailable} or {@code Timeout}; null for OK turns. */
  private String failureReason;

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  /** Creates a successful user question. */
  public static Turn question(String text) {
    return Turn.builder().role(MessageRole.USER).text(text).build();
  }

  /** Creates a successful assistant answer with its sources. */
  public static Turn answer(String text, List<SourceCitation> citations) {
    return Turn.builder()
        .role(MessageRole.ASSISTANT)
        .text(text)
        .citations(List.copyOf(citations))
        .build();
  }

  /** Creates an assistant turn recording a failed answer attempt. */
  public static Turn failedAnswer(String reason) {
    return Turn.builder()
        .role(MessageRole.ASSISTANT)
        .text("")
        .status(TurnStatus.FAILED)
        .failureReason(reason)
        .build();
  }

  public boolean isFailed() {
    return status == TurnStatus.FAILED;
  }
}
