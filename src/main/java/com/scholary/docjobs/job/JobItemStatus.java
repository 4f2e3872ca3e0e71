package com.scholary.docjobs.job;

import java.util.EnumSet;
import java.util.Set;

/** Mini state machine of a job item, mirroring {@link JobStatus}. */
public enum JobItemStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  public Set<JobItemStatus> allowedPredecessors() {
    switch (this) {
      case PROCESSING:
        return EnumSet.of(PENDING);
      case COMPLETED:
        return EnumSet.of(PROCESSING);
      case FAILED:
        return EnumSet.of(PENDING, PROCESSING);
      default:
        return EnumSet.noneOf(JobItemStatus.class);
    }
  }

  public boolean canTransitionTo(JobItemStatus next) {
    return next.allowedPredecessors().contains(this);
  }
}
