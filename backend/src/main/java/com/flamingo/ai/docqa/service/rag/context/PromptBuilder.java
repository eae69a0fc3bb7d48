package com.flamingo.ai.docqa.service.rag.context;

import lombok.RequiredArgsConstructor;

/** Renders the final prompt from the instruction preamble, the context and the question. */
@RequiredArgsConstructor
public class PromptBuilder {

  private final String preamble;

  public String build(String question, AssembledContext context) {
    StringBuilder prompt = new StringBuilder();
    prompt.append(preamble).append("\n\n");
    prompt.append("=== SOURCES ===\n");
    if (context.isEmpty()) {
      prompt.append("(no relevant sources were found)\n");
    } else {
      prompt.append(context.text()).append('\n');
    }
    prompt.append("=== END SOURCES ===\n\n");
    prompt.append("Question: ").append(question);
    return prompt.toString();
  }
}
