package com.scholary.docjobs.service;

import com.scholary.docjobs.job.JobStatus;
import java.util.UUID;

/** Receipt of an accepted submission. */
public record JobSubmission(UUID jobId, String moduleKey, JobStatus status) {}
