package com.flamingo.ai.docqa.domain.enums;

/** Defines the author of a conversation turn. */
public enum MessageRole {
  /** Question asked by the user. */
  USER,

  /** Answer produced by the assistant. */
  ASSISTANT
}
