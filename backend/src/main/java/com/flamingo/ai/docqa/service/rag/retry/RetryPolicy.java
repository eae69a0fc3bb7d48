package com.flamingo.ai.docqa.service.rag.retry;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.service.rag.concurrent.CancellationToken;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded exponential backoff with jitter around a single external call.
 *
 * <p>Only failures accepted by the retryable predicate are retried, and never once the
 * cancellation token fires. When the attempts are used up, the last failure is rethrown to the
 * caller, which treats it as terminal.
 */
@Slf4j
public class RetryPolicy {

  private final String name;
  private final int maxAttempts;
  private final IntervalFunction intervalFunction;

  public RetryPolicy(
      String name, int maxAttempts, Duration baseDelay, double multiplier, double jitter) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    this.name = name;
    this.maxAttempts = maxAttempts;
    this.intervalFunction =
        jitter > 0
            ? IntervalFunction.ofExponentialRandomBackoff(baseDelay, multiplier, jitter)
            : IntervalFunction.ofExponentialBackoff(baseDelay, multiplier);
  }

  public static RetryPolicy from(String name, RagConfig.Retry settings) {
    return new RetryPolicy(
        name,
        settings.getMaxAttempts(),
        settings.getBaseDelay(),
        settings.getMultiplier(),
        settings.getJitter());
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  /**
   * Runs {@code call}, retrying failures that {@code retryable} accepts.
   *
   * @throws com.flamingo.ai.docqa.exception.OperationCancelledException if the token fires before
   *     or between attempts
   */
  public <T> T execute(
      Supplier<T> call, Predicate<Throwable> retryable, CancellationToken token) {
    RetryConfig config =
        RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(intervalFunction)
            .retryOnException(e -> retryable.test(e) && !token.isCancelled())
            .build();
    Retry retry = Retry.of(name, config);
    retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "{} attempt {}/{} failed, retrying in {}: {}",
                    name,
                    event.getNumberOfRetryAttempts(),
                    maxAttempts,
                    event.getWaitInterval(),
                    event.getLastThrowable() == null
                        ? "unknown"
                        : event.getLastThrowable().getMessage()))
        .onError(
            event ->
                log.warn(
                    "{} gave up after {} attempts: {}",
                    name,
                    event.getNumberOfRetryAttempts(),
                    event.getLastThrowable() == null
                        ? "unknown"
                        : event.getLastThrowable().getMessage()));

    Supplier<T> guarded =
        () -> {
          token.throwIfCancelled();
          return call.get();
        };
    try {
      return Retry.decorateSupplier(retry, guarded).get();
    } catch (RuntimeException e) {
      // a cancel that lands during backoff surfaces as the pending failure; report the cancel
      if (token.isCancelled() && retryable.test(e)) {
        token.throwIfCancelled();
      }
      throw e;
    }
  }
}
