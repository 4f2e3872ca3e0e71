package com.scholary.docjobs.retry;

/**
 * Thrown when an operation did not succeed within its retry policy.
 *
 * <p>The cause is the error of the last attempt, or null when the shared attempt budget ran out
 * before the first attempt.
 */
public class RetryExhaustedException extends Exception {

  private final int attempts;

  public RetryExhaustedException(String message, int attempts, Throwable lastError) {
    super(message, lastError);
    this.attempts = attempts;
  }

  public int getAttempts() {
    return attempts;
  }

  /** Message of the last attempt's error, falling back to this exception's message. */
  public String lastErrorMessage() {
    Throwable cause = getCause();
    if (cause != null && cause.getMessage() != null) {
      return cause.getMessage();
    }
    return getMessage();
  }
}
