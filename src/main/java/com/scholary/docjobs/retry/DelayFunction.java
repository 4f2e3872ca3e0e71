package com.scholary.docjobs.retry;

import java.time.Duration;

/**
 * Computes the pause before the next attempt.
 *
 * <p>Only fixed and linearly increasing delays are supported. There is no exponential backoff and
 * no jitter.
 */
@FunctionalInterface
public interface DelayFunction {

  /**
   * @param failedAttempt the 1-based number of the attempt that just failed
   * @return how long to wait before the next attempt
   */
  Duration delayAfter(int failedAttempt);

  static DelayFunction fixed(Duration delay) {
    return failedAttempt -> delay;
  }

  /** {@code base + increment * (failedAttempt - 1)}: e.g. 1.5s, 3s, 4.5s for 1.5s/1.5s. */
  static DelayFunction linear(Duration base, Duration increment) {
    return failedAttempt -> base.plus(increment.multipliedBy(Math.max(0, failedAttempt - 1)));
  }

  static DelayFunction none() {
    return failedAttempt -> Duration.ZERO;
  }
}
