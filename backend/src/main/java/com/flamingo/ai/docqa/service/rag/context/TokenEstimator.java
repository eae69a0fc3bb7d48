package com.flamingo.ai.docqa.service.rag.context;

/** Estimates how many model tokens a text occupies. Must not decrease as text grows. */
@FunctionalInterface
public interface TokenEstimator {

  int estimate(String text);

  /** Rounds {@code length / charsPerToken} up. */
  static TokenEstimator charactersPerToken(int charsPerToken) {
    if (charsPerToken <= 0) {
      throw new IllegalArgumentException("charsPerToken must be positive");
    }
    return text -> (text.length() + charsPerToken - 1) / charsPerToken;
  }
}
