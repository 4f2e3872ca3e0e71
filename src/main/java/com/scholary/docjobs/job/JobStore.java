package com.scholary.docjobs.job;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable record of jobs, their items and their aggregate artifacts.
 *
 * <p>State-changing methods return {@code false} when the row was not in an allowed predecessor
 * state; callers treat that as "someone else already moved it" rather than as an error.
 */
public interface JobStore {

  /** Creates a job in {@link JobStatus#PENDING}. */
  Job create(UUID userId, String moduleKey, String payloadJson);

  /** {@code PENDING -> PROCESSING}. */
  boolean claim(UUID jobId, String detail);

  /** Overwrites the progress note of a processing job. */
  void updateDetail(UUID jobId, String detail);

  /** Persists one pending item per label, indexed from 0 within the round. */
  List<JobItem> addItems(UUID jobId, int round, List<String> labels);

  /** {@code PENDING -> PROCESSING} for an item. */
  boolean startItem(long itemId);

  /** Counts one LLM call against the item. */
  void recordAttempt(long itemId);

  boolean completeItem(long itemId, String outputText, String outputPath, long units, long tokens);

  boolean failItem(long itemId, String error);

  /** Adds to the job's running usage counters; never decreases them. */
  void addUsage(UUID jobId, long units, long tokens);

  void addArtifact(UUID jobId, String name, String contentType, String path);

  /** {@code PROCESSING -> COMPLETED}. */
  boolean complete(UUID jobId, String detail);

  /** {@code PENDING|PROCESSING -> FAILED} with a user-presentable error. */
  boolean fail(UUID jobId, String error);

  Optional<Job> find(UUID jobId);

  List<Job> findAll(Collection<UUID> jobIds);

  List<JobItem> items(UUID jobId);

  Optional<JobItem> item(UUID jobId, int round, int itemIndex);

  List<JobArtifact> artifacts(UUID jobId);

  Optional<JobArtifact> artifact(UUID jobId, String name);

  /** Terminal, unpurged jobs created before {@code cutoff}, ordered by creation time and id. */
  List<Job> findPurgeCandidates(Instant cutoff, int limit);

  /** The next page of {@link #findPurgeCandidates}, strictly after the given job. */
  List<Job> findPurgeCandidatesAfter(Instant cutoff, Job after, int limit);

  /**
   * Nulls every output location of the job and sets {@code files_purged_at}, all in one
   * transaction. Returns false if the job was already purged or is not terminal.
   */
  boolean markPurged(UUID jobId, Instant purgedAt);
}
