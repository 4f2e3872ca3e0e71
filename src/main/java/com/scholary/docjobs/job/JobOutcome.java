package com.scholary.docjobs.job;

/**
 * Status derived for a job from its rounds.
 *
 * @param status either {@link JobStatus#COMPLETED} or {@link JobStatus#FAILED}
 * @param summary user-presentable summary: partial failures when completed, the cause when failed
 */
public record JobOutcome(JobStatus status, String summary) {

  public boolean isCompleted() {
    return status == JobStatus.COMPLETED;
  }
}
