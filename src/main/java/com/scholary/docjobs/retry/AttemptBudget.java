package com.scholary.docjobs.retry;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A cap on the total number of attempts shared by every item of a job.
 *
 * <p>Used by modules that run many interchangeable calls and only need some of them to succeed
 * (e.g. 12 grading runs out of at most 30 calls).
 */
public final class AttemptBudget {

  private static final AttemptBudget UNLIMITED = new AttemptBudget(Integer.MAX_VALUE);

  private final int limit;
  private final AtomicInteger used = new AtomicInteger();

  private AttemptBudget(int limit) {
    this.limit = limit;
  }

  public static AttemptBudget of(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("Attempt budget must be positive: " + limit);
    }
    return new AttemptBudget(limit);
  }

  public static AttemptBudget unlimited() {
    return UNLIMITED;
  }

  /** Claims one attempt; false once the budget is spent. */
  public boolean tryAcquire() {
    if (this == UNLIMITED) {
      return true;
    }
    int current;
    do {
      current = used.get();
      if (current >= limit) {
        return false;
      }
    } while (!used.compareAndSet(current, current + 1));
    return true;
  }

  public int used() {
    return used.get();
  }

  public int limit() {
    return limit;
  }
}
