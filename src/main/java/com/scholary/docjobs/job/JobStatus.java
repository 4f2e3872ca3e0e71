package com.scholary.docjobs.job;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a job.
 *
 * <p>{@code PENDING -> PROCESSING -> {COMPLETED, FAILED}}, plus {@code PENDING -> FAILED} when a
 * job cannot be started. Terminal states are absorbing; only the purge flag changes afterwards.
 */
public enum JobStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /** States from which a job may move into this one. */
  public Set<JobStatus> allowedPredecessors() {
    switch (this) {
      case PROCESSING:
        return EnumSet.of(PENDING);
      case COMPLETED:
        return EnumSet.of(PROCESSING);
      case FAILED:
        return EnumSet.of(PENDING, PROCESSING);
      default:
        return EnumSet.noneOf(JobStatus.class);
    }
  }

  public boolean canTransitionTo(JobStatus next) {
    return next.allowedPredecessors().contains(this);
  }

  public static Set<JobStatus> terminalStates() {
    return EnumSet.of(COMPLETED, FAILED);
  }
}
