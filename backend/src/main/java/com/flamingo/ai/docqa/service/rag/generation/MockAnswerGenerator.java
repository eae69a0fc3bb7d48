package com.flamingo.ai.docqa.service.rag.generation;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Deterministic generator for local development without a model service. It echoes the first
 * source of the prompt, cited by its marker.
 */
@Slf4j
public class MockAnswerGenerator implements AnswerGenerator {

  private static final Pattern FIRST_SOURCE = Pattern.compile("\\[1] ([^\\n]*)");

  public MockAnswerGenerator() {
    log.info("Using mock answer generation; answers are not produced by a model");
  }

  @Override
  public String generate(String prompt) {
    Matcher matcher = FIRST_SOURCE.matcher(prompt);
    if (matcher.find()) {
      return "[mocked answer] According to [1]: " + matcher.group(1).strip();
    }
    return "[mocked answer] The indexed documents do not contain an answer to this question.";
  }
}
