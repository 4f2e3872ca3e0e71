package com.scholary.docjobs.retry;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Retry-with-bounded-attempts combinator used by every worker.
 *
 * <p>Parameterized by the maximum number of attempts, a {@link DelayFunction} and a predicate that
 * decides whether an error is worth another attempt. Non-retryable errors end the loop at once.
 */
public final class RetryPolicy {

  private final int maxAttempts;
  private final DelayFunction delay;
  private final Predicate<Throwable> retryable;
  private final Sleeper sleeper;

  public RetryPolicy(
      int maxAttempts, DelayFunction delay, Predicate<Throwable> retryable, Sleeper sleeper) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
    }
    this.maxAttempts = maxAttempts;
    this.delay = delay;
    this.retryable = retryable;
    this.sleeper = sleeper;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  /** One attempt of the guarded operation; receives the 1-based attempt number. */
  @FunctionalInterface
  public interface Attempt<T> {
    T call(int attempt) throws Exception;
  }

  /** Observes failed attempts, for logging and progress reporting. */
  @FunctionalInterface
  public interface Listener {
    Listener NONE = (attempt, maxAttempts, error, nextDelay) -> {};

    /**
     * @param nextDelay the pause before the next attempt, or null if no attempt follows
     */
    void onFailure(int attempt, int maxAttempts, Throwable error, Duration nextDelay);
  }

  public <T> T execute(Attempt<T> operation) throws RetryExhaustedException {
    return execute(operation, AttemptBudget.unlimited(), Listener.NONE);
  }

  public <T> T execute(Attempt<T> operation, AttemptBudget budget, Listener listener)
      throws RetryExhaustedException {
    Throwable lastError = null;

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      if (!budget.tryAcquire()) {
        throw new RetryExhaustedException(
            String.format("Attempt budget of %d calls exhausted", budget.limit()),
            attempt - 1,
            lastError);
      }

      try {
        return operation.call(attempt);
      } catch (Exception e) {
        lastError = e;

        boolean willRetry = attempt < maxAttempts && retryable.test(e);
        Duration pause = willRetry ? delay.delayAfter(attempt) : null;
        listener.onFailure(attempt, maxAttempts, e, pause);

        if (!willRetry) {
          throw new RetryExhaustedException(
              String.format("Failed after %d attempt(s)", attempt), attempt, e);
        }

        try {
          if (!pause.isZero() && !pause.isNegative()) {
            sleeper.sleep(pause);
          }
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new RetryExhaustedException("Retry interrupted", attempt, e);
        }
      }
    }

    throw new RetryExhaustedException(
        String.format("Failed after %d attempt(s)", maxAttempts), maxAttempts, lastError);
  }
}
