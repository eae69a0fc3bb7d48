package com.flamingo.ai.docqa.service.rag.concurrent;

import com.flamingo.ai.docqa.exception.OperationCancelledException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for an ingestion job or a query, with an optional deadline.
 *
 * <p>Long running steps call {@link #throwIfCancelled()} between units of work; blocking calls
 * register a listener with {@link #onCancel(Runnable)} to abort early. Listeners must be
 * idempotent.
 */
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
  private final Clock clock;
  private final Instant deadline;

  private CancellationToken(Clock clock, Instant deadline) {
    this.clock = clock;
    this.deadline = deadline;
  }

  /** A token without deadline. */
  public static CancellationToken create() {
    return new CancellationToken(Clock.systemUTC(), null);
  }

  /** A token that also counts as cancelled once {@code timeout} has elapsed. */
  public static CancellationToken withTimeout(Duration timeout) {
    return withTimeout(timeout, Clock.systemUTC());
  }

  public static CancellationToken withTimeout(Duration timeout, Clock clock) {
    return new CancellationToken(clock, clock.instant().plus(timeout));
  }

  /** Requests cancellation and notifies listeners once. */
  public void cancel() {
    if (cancelled.compareAndSet(false, true)) {
      listeners.forEach(Runnable::run);
    }
  }

  /** Whether {@link #cancel()} was called. */
  public boolean isCancellationRequested() {
    return cancelled.get();
  }

  public boolean isDeadlineExceeded() {
    return deadline != null && !clock.instant().isBefore(deadline);
  }

  public boolean isCancelled() {
    return isCancellationRequested() || isDeadlineExceeded();
  }

  /** Time left until the deadline, empty when the token has none. Never negative. */
  public Optional<Duration> remaining() {
    if (deadline == null) {
      return Optional.empty();
    }
    Duration left = Duration.between(clock.instant(), deadline);
    return Optional.of(left.isNegative() ? Duration.ZERO : left);
  }

  /** Runs {@code listener} on cancellation, or immediately if already cancelled. */
  public void onCancel(Runnable listener) {
    listeners.add(listener);
    if (cancelled.get()) {
      listener.run();
    }
  }

  /**
   * @throws OperationCancelledException if cancellation was requested or the deadline passed
   */
  public void throwIfCancelled() {
    if (isCancellationRequested()) {
      throw new OperationCancelledException("Operation cancelled", false);
    }
    if (isDeadlineExceeded()) {
      throw new OperationCancelledException("Deadline exceeded", true);
    }
  }
}
