package com.scholary.docjobs.service;

import com.scholary.docjobs.job.JobItemStatus;
import com.scholary.docjobs.job.JobStatus;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read model of a job for its owner.
 *
 * @param usageUnits units charged to the job so far
 * @param filesPurged true once the retention sweeper removed the job's outputs
 */
public record JobStatusView(
    UUID jobId,
    String moduleKey,
    JobStatus status,
    String statusDetail,
    String errorMessage,
    long usageUnits,
    long tokensUsed,
    Instant createdAt,
    Instant updatedAt,
    boolean filesPurged,
    List<ItemView> items,
    List<ArtifactView> artifacts) {

  public record ItemView(
      int round,
      int index,
      String label,
      JobItemStatus status,
      int attempts,
      String errorMessage,
      boolean outputAvailable) {}

  public record ArtifactView(String name, String contentType, boolean available) {}
}
