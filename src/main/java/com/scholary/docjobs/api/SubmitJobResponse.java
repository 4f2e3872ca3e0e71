package com.scholary.docjobs.api;

import com.scholary.docjobs.job.JobStatus;
import java.util.UUID;

/**
 * Response for an accepted job submission.
 *
 * <p>Returns the job ID and the URL to poll for status.
 */
public record SubmitJobResponse(UUID jobId, String module, JobStatus status, String statusUrl) {}
