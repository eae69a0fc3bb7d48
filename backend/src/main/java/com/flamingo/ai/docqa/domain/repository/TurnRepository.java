package com.flamingo.ai.docqa.domain.repository;

import com.flamingo.ai.docqa.domain.entity.Turn;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for conversation turns. */
@Repository
public interface TurnRepository extends JpaRepository<Turn, UUID> {

  /** Finds all turns of a conversation in append order. */
  List<Turn> findByConversationIdOrderBySequenceNumberAsc(UUID conversationId);

  /** Counts the turns of a conversation. */
  int countByConversationId(UUID conversationId);
}
