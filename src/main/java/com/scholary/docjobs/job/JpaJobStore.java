package com.scholary.docjobs.job;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** {@link JobStore} on Spring Data JPA. */
@Repository
public class JpaJobStore implements JobStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(JpaJobStore.class);

  private final JobRepository jobs;
  private final JobItemRepository items;
  private final JobArtifactRepository artifacts;
  private final Clock clock;

  public JpaJobStore(
      JobRepository jobs, JobItemRepository items, JobArtifactRepository artifacts, Clock clock) {
    this.jobs = jobs;
    this.items = items;
    this.artifacts = artifacts;
    this.clock = clock;
  }

  @Override
  @Transactional
  public Job create(UUID userId, String moduleKey, String payloadJson) {
    Job job = new Job(UUID.randomUUID(), userId, moduleKey, payloadJson, clock.instant());
    return jobs.save(job);
  }

  @Override
  @Transactional
  public boolean claim(UUID jobId, String detail) {
    return jobs.transition(
            jobId,
            JobStatus.PROCESSING.allowedPredecessors(),
            JobStatus.PROCESSING,
            detail,
            clock.instant())
        == 1;
  }

  @Override
  @Transactional
  public void updateDetail(UUID jobId, String detail) {
    jobs.updateDetail(jobId, detail, clock.instant());
  }

  @Override
  @Transactional
  public List<JobItem> addItems(UUID jobId, int round, List<String> labels) {
    Instant now = clock.instant();
    List<JobItem> created = new ArrayList<>(labels.size());
    for (int i = 0; i < labels.size(); i++) {
      created.add(new JobItem(jobId, round, i, labels.get(i), now));
    }
    return items.saveAll(created);
  }

  @Override
  @Transactional
  public boolean startItem(long itemId) {
    return items.transition(
            itemId,
            JobItemStatus.PROCESSING.allowedPredecessors(),
            JobItemStatus.PROCESSING,
            clock.instant())
        == 1;
  }

  @Override
  @Transactional
  public void recordAttempt(long itemId) {
    items.incrementAttempts(itemId, clock.instant());
  }

  @Override
  @Transactional
  public boolean completeItem(
      long itemId, String outputText, String outputPath, long units, long tokens) {
    return items.complete(itemId, outputText, outputPath, units, tokens, clock.instant()) == 1;
  }

  @Override
  @Transactional
  public boolean failItem(long itemId, String error) {
    return items.fail(
            itemId,
            JobItemStatus.FAILED.allowedPredecessors(),
            ErrorMessages.trim(error),
            clock.instant())
        == 1;
  }

  @Override
  @Transactional
  public void addUsage(UUID jobId, long units, long tokens) {
    jobs.addUsage(jobId, Math.max(0, units), Math.max(0, tokens), clock.instant());
  }

  @Override
  @Transactional
  public void addArtifact(UUID jobId, String name, String contentType, String path) {
    artifacts.save(new JobArtifact(jobId, name, contentType, path));
  }

  @Override
  @Transactional
  public boolean complete(UUID jobId, String detail) {
    return jobs.transition(
            jobId,
            JobStatus.COMPLETED.allowedPredecessors(),
            JobStatus.COMPLETED,
            detail,
            clock.instant())
        == 1;
  }

  @Override
  @Transactional
  public boolean fail(UUID jobId, String error) {
    String trimmed = ErrorMessages.trim(error);
    return jobs.fail(
            jobId, JobStatus.FAILED.allowedPredecessors(), "Failed", trimmed, clock.instant())
        == 1;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Job> find(UUID jobId) {
    return jobs.findById(jobId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Job> findAll(Collection<UUID> jobIds) {
    return jobs.findAllById(jobIds);
  }

  @Override
  @Transactional(readOnly = true)
  public List<JobItem> items(UUID jobId) {
    return items.findByJobIdOrderByRoundAscItemIndexAsc(jobId);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<JobItem> item(UUID jobId, int round, int itemIndex) {
    return items.findByJobIdAndRoundAndItemIndex(jobId, round, itemIndex);
  }

  @Override
  @Transactional(readOnly = true)
  public List<JobArtifact> artifacts(UUID jobId) {
    return artifacts.findByJobIdOrderByIdAsc(jobId);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<JobArtifact> artifact(UUID jobId, String name) {
    return artifacts.findByJobIdAndName(jobId, name);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Job> findPurgeCandidates(Instant cutoff, int limit) {
    return jobs.findPurgeCandidates(JobStatus.terminalStates(), cutoff, PageRequest.of(0, limit));
  }

  @Override
  @Transactional(readOnly = true)
  public List<Job> findPurgeCandidatesAfter(Instant cutoff, Job after, int limit) {
    return jobs.findPurgeCandidatesAfter(
        JobStatus.terminalStates(),
        cutoff,
        after.getCreatedAt(),
        after.getId(),
        PageRequest.of(0, limit));
  }

  @Override
  @Transactional
  public boolean markPurged(UUID jobId, Instant purgedAt) {
    int updated = jobs.markPurged(jobId, JobStatus.terminalStates(), purgedAt);
    if (updated == 0) {
      return false;
    }
    int itemRows = items.clearOutputPaths(jobId);
    int artifactRows = artifacts.clearPaths(jobId);
    LOGGER.debug(
        "Purged job {}: cleared {} item paths and {} artifact paths",
        jobId,
        itemRows,
        artifactRows);
    return true;
  }
}
