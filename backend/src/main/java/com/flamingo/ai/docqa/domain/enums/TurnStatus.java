package com.flamingo.ai.docqa.domain.enums;

/** Terminal state of a conversation turn. */
public enum TurnStatus {
  OK,
  FAILED
}
