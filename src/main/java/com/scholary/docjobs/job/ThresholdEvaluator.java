package com.scholary.docjobs.job;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives round and job outcomes from item statuses.
 *
 * <p>Pure functions only: the job status is always recomputed from the items, never maintained
 * incrementally.
 */
public final class ThresholdEvaluator {

  private ThresholdEvaluator() {}

  /** Evaluates a round; every item must already be terminal. */
  public static RoundOutcome evaluateRound(
      int round, List<JobItem> items, SuccessThreshold threshold) {
    int succeeded = 0;
    List<String> failures = new ArrayList<>();
    for (JobItem item : items) {
      if (!item.getStatus().isTerminal()) {
        throw new IllegalStateException(
            String.format(
                "Item %d of round %d is still %s", item.getItemIndex(), round, item.getStatus()));
      }
      if (item.getStatus() == JobItemStatus.COMPLETED) {
        succeeded++;
      } else {
        failures.add(describe(item));
      }
    }
    return new RoundOutcome(round, items.size(), succeeded, threshold, failures);
  }

  /**
   * Completed iff every round met its threshold. The summary lists partial failures of a
   * completed job, or the first round that missed its threshold.
   */
  public static JobOutcome deriveJobStatus(List<RoundOutcome> rounds) {
    List<String> partial = new ArrayList<>();
    for (RoundOutcome round : rounds) {
      if (!round.thresholdMet()) {
        StringBuilder message =
            new StringBuilder(
                String.format(
                    "Round %d: %d of %d items succeeded, required %s",
                    round.round(), round.succeeded(), round.total(), round.threshold()));
        for (String failure : round.failures()) {
          message.append("\n").append(failure);
        }
        return new JobOutcome(JobStatus.FAILED, message.toString());
      }
      if (round.failed() > 0) {
        partial.add(
            String.format(
                "Round %d: %d of %d items failed", round.round(), round.failed(), round.total()));
      }
    }

    if (partial.isEmpty()) {
      return new JobOutcome(JobStatus.COMPLETED, "Completed");
    }
    return new JobOutcome(
        JobStatus.COMPLETED, "Completed with errors. " + String.join("; ", partial));
  }

  private static String describe(JobItem item) {
    String label = item.getLabel() != null ? item.getLabel() : "item " + item.getItemIndex();
    String error = item.getErrorMessage() != null ? item.getErrorMessage() : "failed";
    return String.format("- %s: %s", label, error);
  }
}
