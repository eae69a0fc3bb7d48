package com.flamingo.ai.docqa.service.rag.generation;

/** Produces an answer from a fully rendered prompt. */
@FunctionalInterface
public interface AnswerGenerator {

  /**
   * @throws com.flamingo.ai.docqa.exception.AnswerGenerationException if the model fails or times
   *     out
   */
  String generate(String prompt);
}
