package com.flamingo.ai.docqa.exception;

import java.util.UUID;

/** Exception thrown when a conversation is not found. */
public class ConversationNotFoundException extends RuntimeException {

  private final UUID conversationId;

  public ConversationNotFoundException(UUID conversationId) {
    super("Conversation not found: " + conversationId);
    this.conversationId = conversationId;
  }

  public UUID getConversationId() {
    return conversationId;
  }
}
