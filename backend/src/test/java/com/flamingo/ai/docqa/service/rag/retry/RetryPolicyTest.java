package com.flamingo.ai.docqa.service.rag.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.docqa.exception.ModelUnavailableException;
import com.flamingo.ai.docqa.exception.OperationCancelledException;
import com.flamingo.ai.docqa.service.rag.concurrent.CancellationToken;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RetryPolicy Tests")
class RetryPolicyTest {

  private static final Predicate<Throwable> UNAVAILABLE = ModelUnavailableException.class::isInstance;

  private final RetryPolicy policy = new RetryPolicy("test", 3, Duration.ofMillis(1), 2.0, 0.0);

  @Test
  @DisplayName("Should retry retryable failures until success")
  void shouldRetryUntilSuccess() {
    AtomicInteger attempts = new AtomicInteger();

    String result =
        policy.execute(
            () -> {
              if (attempts.incrementAndGet() < 3) {
                throw new ModelUnavailableException("busy");
              }
              return "ok";
            },
            UNAVAILABLE,
            CancellationToken.create());

    assertThat(result).isEqualTo("ok");
    assertThat(attempts).hasValue(3);
  }

  @Test
  @DisplayName("Should rethrow the last failure once attempts are exhausted")
  void shouldRethrowLastFailureWhenExhausted() {
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                policy.execute(
                    () -> {
                      throw new ModelUnavailableException("attempt " + attempts.incrementAndGet());
                    },
                    UNAVAILABLE,
                    CancellationToken.create()))
        .isInstanceOf(ModelUnavailableException.class)
        .hasMessage("attempt 3");
  }

  @Test
  @DisplayName("Should not retry failures the predicate rejects")
  void shouldNotRetryPermanentFailures() {
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                policy.execute(
                    () -> {
                      attempts.incrementAndGet();
                      throw new IllegalArgumentException("bad input");
                    },
                    UNAVAILABLE,
                    CancellationToken.create()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(attempts).hasValue(1);
  }

  @Test
  @DisplayName("Should stop retrying once the token is cancelled")
  void shouldStopRetryingWhenCancelled() {
    CancellationToken token = CancellationToken.create();
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(
            () ->
                policy.execute(
                    () -> {
                      attempts.incrementAndGet();
                      token.cancel();
                      throw new ModelUnavailableException("busy");
                    },
                    UNAVAILABLE,
                    token))
        .isInstanceOf(OperationCancelledException.class);
    assertThat(attempts).hasValue(1);
  }

  @Test
  @DisplayName("Should not call the operation when already cancelled")
  void shouldNotCallWhenAlreadyCancelled() {
    CancellationToken token = CancellationToken.create();
    token.cancel();
    AtomicInteger attempts = new AtomicInteger();

    assertThatThrownBy(() -> policy.execute(attempts::incrementAndGet, UNAVAILABLE, token))
        .isInstanceOf(OperationCancelledException.class);
    assertThat(attempts).hasValue(0);
  }

  @Test
  @DisplayName("Should reject fewer than one attempt")
  void shouldRejectZeroAttempts() {
    assertThatThrownBy(() -> new RetryPolicy("bad", 0, Duration.ofMillis(1), 2.0, 0.0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
