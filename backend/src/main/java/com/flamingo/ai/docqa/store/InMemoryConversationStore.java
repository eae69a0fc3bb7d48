package com.flamingo.ai.docqa.store;

import com.flamingo.ai.docqa.domain.entity.Conversation;
import com.flamingo.ai.docqa.domain.entity.Turn;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/** Conversation store held in memory. */
public class InMemoryConversationStore implements ConversationStore {

  private final Map<UUID, Conversation> conversations = new ConcurrentHashMap<>();
  private final Map<UUID, List<Turn>> turns = new ConcurrentHashMap<>();

  @Override
  public Conversation save(Conversation conversation) {
    conversations.put(conversation.getId(), conversation.toBuilder().build());
    turns.computeIfAbsent(conversation.getId(), id -> new CopyOnWriteArrayList<>());
    return conversation;
  }

  @Override
  public Optional<Conversation> findById(UUID conversationId) {
    return Optional.ofNullable(conversations.get(conversationId)).map(c -> c.toBuilder().build());
  }

  @Override
  public boolean exists(UUID conversationId) {
    return conversations.containsKey(conversationId);
  }

  @Override
  public List<Conversation> findAll() {
    return conversations.values().stream()
        .sorted(Comparator.comparing(Conversation::getCreatedAt).reversed())
        .map(c -> c.toBuilder().build())
        .toList();
  }

  @Override
  public void saveWithTurns(Conversation conversation, List<Turn> imported) {
    turns.put(conversation.getId(), new CopyOnWriteArrayList<>(imported));
    conversations.put(conversation.getId(), conversation.toBuilder().build());
  }

  @Override
  public void appendTurn(Turn turn) {
    turns.computeIfAbsent(turn.getConversationId(), id -> new CopyOnWriteArrayList<>()).add(turn);
  }

  @Override
  public List<Turn> findTurns(UUID conversationId) {
    return List.copyOf(turns.getOrDefault(conversationId, List.of()));
  }

  @Override
  public int countTurns(UUID conversationId) {
    return turns.getOrDefault(conversationId, List.of()).size();
  }
}
