package com.flamingo.ai.docqa.service.rag.generation;

import com.flamingo.ai.docqa.exception.AnswerGenerationException;
import com.google.common.base.Throwables;
import dev.langchain4j.model.chat.ChatModel;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Generates answers with a LangChain4j {@link ChatModel}. */
@RequiredArgsConstructor
@Slf4j
public class LangChain4jAnswerGenerator implements AnswerGenerator {

  private final ChatModel chatModel;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "generation.generate", description = "Time to generate an answer")
  @CircuitBreaker(name = "llm")
  public String generate(String prompt) {
    try {
      String answer = chatModel.chat(prompt);
      meterRegistry.counter("generation.requests.success").increment();
      return answer == null ? "" : answer;
    } catch (RuntimeException e) {
      meterRegistry.counter("generation.requests.failure").increment();
      AnswerGenerationException.Kind kind =
          isTimeout(e) ? AnswerGenerationException.Kind.TIMEOUT : AnswerGenerationException.Kind.UNAVAILABLE;
      log.warn("Answer generation failed ({}): {}", kind.getReason(), e.getMessage());
      throw new AnswerGenerationException(kind, "Answer generation failed: " + e.getMessage(), e);
    }
  }

  static boolean isTimeout(Throwable failure) {
    return Throwables.getCausalChain(failure).stream()
        .anyMatch(
            t ->
                t instanceof TimeoutException
                    || t instanceof SocketTimeoutException
                    || t instanceof HttpTimeoutException
                    || t.getClass().getSimpleName().contains("Timeout"));
  }
}
