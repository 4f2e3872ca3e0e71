package com.scholary.docjobs.history;

import com.scholary.docjobs.job.JobStatus;
import java.time.Instant;
import java.util.UUID;

/** A history entry joined with the live state of its job. */
public record HistoryView(
    UUID jobId,
    String moduleKey,
    Instant createdAt,
    JobStatus status,
    String statusDetail,
    Instant updatedAt,
    boolean filesPurged) {}
