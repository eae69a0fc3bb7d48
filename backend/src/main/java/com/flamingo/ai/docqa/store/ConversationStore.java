package com.flamingo.ai.docqa.store;

import com.flamingo.ai.docqa.domain.entity.Conversation;
import com.flamingo.ai.docqa.domain.entity.Turn;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Persistence of conversations and their append-only turn logs. */
public interface ConversationStore {

  Conversation save(Conversation conversation);

  Optional<Conversation> findById(UUID conversationId);

  boolean exists(UUID conversationId);

  /** All conversations, newest first. */
  List<Conversation> findAll();

  /** Stores a new conversation together with its turns. Nothing is stored if any write fails. */
  void saveWithTurns(Conversation conversation, List<Turn> turns);

  /** Appends one turn atomically. Callers serialize appends per conversation. */
  void appendTurn(Turn turn);

  /** Turns of a conversation in sequence order. */
  List<Turn> findTurns(UUID conversationId);

  int countTurns(UUID conversationId);
}
