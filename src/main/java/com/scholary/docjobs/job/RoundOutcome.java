package com.scholary.docjobs.job;

import java.util.List;

/**
 * Result of evaluating one round of items against its threshold.
 *
 * @param failures per-item error lines of the failed items, in item order
 */
public record RoundOutcome(
    int round, int total, int succeeded, SuccessThreshold threshold, List<String> failures) {

  public RoundOutcome {
    failures = List.copyOf(failures);
  }

  public int failed() {
    return total - succeeded;
  }

  public boolean thresholdMet() {
    return threshold.isMet(succeeded, total);
  }
}
