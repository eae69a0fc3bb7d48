package com.flamingo.ai.docqa.store;

import com.flamingo.ai.docqa.domain.entity.Conversation;
import com.flamingo.ai.docqa.domain.entity.Turn;
import com.flamingo.ai.docqa.domain.repository.ConversationRepository;
import com.flamingo.ai.docqa.domain.repository.TurnRepository;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.transaction.annotation.Transactional;

/** Conversation store on the relational database. */
@RequiredArgsConstructor
public class JpaConversationStore implements ConversationStore {

  private final ConversationRepository conversationRepository;
  private final TurnRepository turnRepository;

  @Override
  @Transactional
  public Conversation save(Conversation conversation) {
    return conversationRepository.save(conversation);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Conversation> findById(UUID conversationId) {
    return conversationRepository.findById(conversationId);
  }

  @Override
  @Transactional(readOnly = true)
  public boolean exists(UUID conversationId) {
    return conversationRepository.existsById(conversationId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Conversation> findAll() {
    return conversationRepository.findAllByOrderByCreatedAtDesc();
  }

  @Override
  @Transactional
  public void saveWithTurns(Conversation conversation, List<Turn> turns) {
    conversationRepository.save(conversation);
    turnRepository.saveAll(turns);
    turnRepository.flush();
  }

  @Override
  @Transactional
  public void appendTurn(Turn turn) {
    turnRepository.saveAndFlush(turn);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Turn> findTurns(UUID conversationId) {
    return turnRepository.findByConversationIdOrderBySequenceNumberAsc(conversationId);
  }

  @Override
  @Transactional(readOnly = true)
  public int countTurns(UUID conversationId) {
    return turnRepository.countByConversationId(conversationId);
  }
}
