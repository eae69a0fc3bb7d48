package com.flamingo.ai.docqa.domain.repository;

import com.flamingo.ai.docqa.domain.entity.Conversation;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Conversation headers. */
@Repository
public interface ConversationRepository extends JpaRepository<Conversation, UUID> {

  /** Finds all conversations, newest first. */
  List<Conversation> findAllByOrderByCreatedAtDesc();
}
