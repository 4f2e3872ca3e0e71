package com.scholary.docjobs.module;

import com.scholary.docjobs.job.JobItemStatus;

/** Terminal state of one item, as seen by later rounds and by assembly. */
public record ItemResult(
    int index,
    String label,
    JobItemStatus status,
    int attempts,
    String outputText,
    String errorMessage) {

  public boolean succeeded() {
    return status == JobItemStatus.COMPLETED;
  }
}
