package com.flamingo.ai.docqa.service.conversation;

import com.flamingo.ai.docqa.domain.entity.Conversation;
import com.flamingo.ai.docqa.domain.entity.Turn;
import com.flamingo.ai.docqa.domain.enums.ExportFormat;
import com.flamingo.ai.docqa.domain.enums.TurnStatus;
import com.flamingo.ai.docqa.exception.ConversationNotFoundException;
import com.flamingo.ai.docqa.service.conversation.export.ConversationTranscript;
import com.flamingo.ai.docqa.service.conversation.export.JsonTranscriptFormatter;
import com.flamingo.ai.docqa.service.conversation.export.TranscriptFormatter;
import com.flamingo.ai.docqa.store.ConversationStore;
import com.google.common.util.concurrent.Striped;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns conversations and their append-only turn logs.
 *
 * <p>Appends to one conversation are serialized, so sequence numbers are gapless and strictly
 * increasing; appends to different conversations do not wait on each other beyond lock striping.
 * {@link #history} returns a snapshot that later appends do not change.
 */
@Slf4j
public class ConversationManager {

  private final ConversationStore store;
  private final Clock clock;
  private final Map<ExportFormat, TranscriptFormatter> formatters = new EnumMap<>(ExportFormat.class);
  private final JsonTranscriptFormatter jsonFormatter;
  private final Striped<Lock> appendLocks = Striped.lock(64);

  public ConversationManager(
      ConversationStore store,
      Clock clock,
      List<TranscriptFormatter> formatters,
      JsonTranscriptFormatter jsonFormatter) {
    this.store = store;
    this.clock = clock;
    this.jsonFormatter = jsonFormatter;
    for (TranscriptFormatter formatter : formatters) {
      this.formatters.put(formatter.format(), formatter);
    }
    this.formatters.put(ExportFormat.JSON, jsonFormatter);
  }

  public Conversation create(String title) {
    Conversation conversation =
        Conversation.builder().id(UUID.randomUUID()).title(title).createdAt(clock.instant()).build();
    store.save(conversation);
    log.info("Created conversation {}", conversation.getId());
    return conversation;
  }

  public Conversation get(UUID conversationId) {
    return store
        .findById(conversationId)
        .orElseThrow(() -> new ConversationNotFoundException(conversationId));
  }

  public List<Conversation> list() {
    return store.findAll();
  }

  /**
   * Appends a turn, assigning its identifier, next sequence number and timestamp.
   *
   * @return the stored turn
   * @throws ConversationNotFoundException if the conversation does not exist
   */
  public Turn append(UUID conversationId, Turn turn) {
    requireExists(conversationId);
    Lock lock = appendLocks.get(conversationId);
    lock.lock();
    try {
      Turn stored =
          turn.toBuilder()
              .id(UUID.randomUUID())
              .conversationId(conversationId)
              .sequenceNumber(store.countTurns(conversationId))
              .createdAt(clock.instant())
              .build();
      store.appendTurn(stored);
      log.debug(
          "Appended {} turn #{} to conversation {}",
          stored.getRole(),
          stored.getSequenceNumber(),
          conversationId);
      return stored;
    } finally {
      lock.unlock();
    }
  }

  /** Turns of a conversation in sequence order, as an immutable snapshot. */
  public List<Turn> history(UUID conversationId) {
    requireExists(conversationId);
    return List.copyOf(store.findTurns(conversationId));
  }

  public byte[] export(UUID conversationId, ExportFormat format) {
    TranscriptFormatter formatter = formatters.get(format);
    if (formatter == null) {
      throw new IllegalArgumentException("Unsupported export format: " + format);
    }
    return formatter.write(transcriptOf(get(conversationId)));
  }

  /**
   * Restores a conversation exported as JSON, keeping its identifiers and timestamps.
   *
   * @throws IllegalArgumentException if the data is not a valid transcript
   * @throws IllegalStateException if a conversation with the same identifier already exists
   */
  public Conversation importJson(byte[] data) {
    ConversationTranscript transcript = jsonFormatter.read(data);
    UUID conversationId = transcript.conversationId();
    Lock lock = appendLocks.get(conversationId);
    lock.lock();
    try {
      if (store.exists(conversationId)) {
        throw new IllegalStateException("Conversation already exists: " + conversationId);
      }
      Conversation conversation =
          Conversation.builder()
              .id(conversationId)
              .title(transcript.title())
              .createdAt(transcript.createdAt() != null ? transcript.createdAt() : clock.instant())
              .build();

      List<ConversationTranscript.Entry> entries =
          transcript.turns() == null ? List.of() : transcript.turns();
      List<Turn> turns = new ArrayList<>(entries.size());
      for (ConversationTranscript.Entry entry : entries) {
        if (entry.role() == null) {
          throw new IllegalArgumentException(
              "Invalid conversation transcript: turn " + turns.size() + " has no role");
        }
        turns.add(
            Turn.builder()
                .id(entry.id() != null ? entry.id() : UUID.randomUUID())
                .conversationId(conversationId)
                .sequenceNumber(turns.size())
                .role(entry.role())
                .text(entry.text() == null ? "" : entry.text())
                .citations(entry.citations() == null ? List.of() : List.copyOf(entry.citations()))
                .status(entry.status() == null ? TurnStatus.OK : entry.status())
                .failureReason(entry.failureReason())
                .createdAt(
                    entry.createdAt() != null ? entry.createdAt() : conversation.getCreatedAt())
                .build());
      }
      store.saveWithTurns(conversation, turns);
      log.info("Imported conversation {} with {} turns", conversationId, entries.size());
      return conversation;
    } finally {
      lock.unlock();
    }
  }

  private ConversationTranscript transcriptOf(Conversation conversation) {
    List<ConversationTranscript.Entry> entries =
        store.findTurns(conversation.getId()).stream()
            .map(
                turn ->
                    new ConversationTranscript.Entry(
                        turn.getId(),
                        turn.getSequenceNumber(),
                        turn.getRole(),
                        turn.getText(),
                        turn.getCitations(),
                        turn.getStatus(),
                        turn.getFailureReason(),
                        turn.getCreatedAt()))
            .toList();
    return new ConversationTranscript(
        ConversationTranscript.CURRENT_VERSION,
        conversation.getId(),
        conversation.getTitle(),
        conversation.getCreatedAt(),
        entries);
  }

  private void requireExists(UUID conversationId) {
    if (!store.exists(conversationId)) {
      throw new ConversationNotFoundException(conversationId);
    }
  }
}
