package com.scholary.docjobs.job;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/** JobStore backed by maps, with the same conditional transitions as the JPA store. */
public class InMemoryJobStore implements JobStore {

  private static final Comparator<Job> CANDIDATE_ORDER =
      Comparator.comparing(Job::getCreatedAt).thenComparing(Job::getId);

  private final Clock clock;
  private final Map<UUID, Job> jobs = new LinkedHashMap<>();
  private final Map<Long, JobItem> items = new LinkedHashMap<>();
  private final List<JobArtifact> artifacts = new ArrayList<>();
  private long nextItemId = 1;

  public InMemoryJobStore(Clock clock) {
    this.clock = clock;
  }

  /** Adds a job as-is, bypassing {@link #create}; used to seed terminal jobs. */
  public synchronized Job put(Job job) {
    jobs.put(job.getId(), job);
    return job;
  }

  @Override
  public synchronized Job create(UUID userId, String moduleKey, String payloadJson) {
    Job job = new Job(UUID.randomUUID(), userId, moduleKey, payloadJson, clock.instant());
    jobs.put(job.getId(), job);
    return job;
  }

  @Override
  public synchronized boolean claim(UUID jobId, String detail) {
    return transition(jobId, JobStatus.PROCESSING, detail);
  }

  @Override
  public synchronized void updateDetail(UUID jobId, String detail) {
    Job job = jobs.get(jobId);
    if (job != null && job.getStatus() == JobStatus.PROCESSING) {
      job.setStatusDetail(detail);
    }
  }

  @Override
  public synchronized List<JobItem> addItems(UUID jobId, int round, List<String> labels) {
    List<JobItem> created = new ArrayList<>();
    for (int i = 0; i < labels.size(); i++) {
      JobItem item = new JobItem(jobId, round, i, labels.get(i), clock.instant());
      item.setId(nextItemId++);
      items.put(item.getId(), item);
      created.add(item);
    }
    return created;
  }

  @Override
  public synchronized boolean startItem(long itemId) {
    JobItem item = items.get(itemId);
    if (item == null || !item.getStatus().canTransitionTo(JobItemStatus.PROCESSING)) {
      return false;
    }
    item.setStatus(JobItemStatus.PROCESSING);
    return true;
  }

  @Override
  public synchronized void recordAttempt(long itemId) {
    JobItem item = items.get(itemId);
    item.setAttemptCount(item.getAttemptCount() + 1);
  }

  @Override
  public synchronized boolean completeItem(
      long itemId, String outputText, String outputPath, long units, long tokens) {
    JobItem item = items.get(itemId);
    if (item == null || item.getStatus() != JobItemStatus.PROCESSING) {
      return false;
    }
    item.setStatus(JobItemStatus.COMPLETED);
    item.setOutputText(outputText);
    item.setOutputPath(outputPath);
    item.setUnits(units);
    item.setTokensUsed(tokens);
    item.setErrorMessage(null);
    return true;
  }

  @Override
  public synchronized boolean failItem(long itemId, String error) {
    JobItem item = items.get(itemId);
    if (item == null || !item.getStatus().canTransitionTo(JobItemStatus.FAILED)) {
      return false;
    }
    item.setStatus(JobItemStatus.FAILED);
    item.setErrorMessage(ErrorMessages.trim(error));
    return true;
  }

  @Override
  public synchronized void addUsage(UUID jobId, long units, long tokens) {
    Job job = jobs.get(jobId);
    job.setUsageDelta(job.getUsageDelta() + Math.max(0, units));
    job.setTokensUsed(job.getTokensUsed() + Math.max(0, tokens));
  }

  @Override
  public synchronized void addArtifact(UUID jobId, String name, String contentType, String path) {
    artifacts.add(new JobArtifact(jobId, name, contentType, path));
  }

  @Override
  public synchronized boolean complete(UUID jobId, String detail) {
    return transition(jobId, JobStatus.COMPLETED, detail);
  }

  @Override
  public synchronized boolean fail(UUID jobId, String error) {
    Job job = jobs.get(jobId);
    if (job == null || !job.getStatus().canTransitionTo(JobStatus.FAILED)) {
      return false;
    }
    job.setStatus(JobStatus.FAILED);
    job.setStatusDetail("Failed");
    job.setErrorMessage(ErrorMessages.trim(error));
    return true;
  }

  @Override
  public synchronized Optional<Job> find(UUID jobId) {
    return Optional.ofNullable(jobs.get(jobId));
  }

  @Override
  public synchronized List<Job> findAll(Collection<UUID> jobIds) {
    return jobIds.stream().map(jobs::get).filter(j -> j != null).collect(Collectors.toList());
  }

  @Override
  public synchronized List<JobItem> items(UUID jobId) {
    return items.values().stream()
        .filter(i -> i.getJobId().equals(jobId))
        .sorted(
            Comparator.comparingInt(JobItem::getRound).thenComparingInt(JobItem::getItemIndex))
        .collect(Collectors.toList());
  }

  @Override
  public synchronized Optional<JobItem> item(UUID jobId, int round, int itemIndex) {
    return items(jobId).stream()
        .filter(i -> i.getRound() == round && i.getItemIndex() == itemIndex)
        .findFirst();
  }

  @Override
  public synchronized List<JobArtifact> artifacts(UUID jobId) {
    return artifacts.stream()
        .filter(a -> a.getJobId().equals(jobId))
        .collect(Collectors.toList());
  }

  @Override
  public synchronized Optional<JobArtifact> artifact(UUID jobId, String name) {
    return artifacts(jobId).stream().filter(a -> a.getName().equals(name)).findFirst();
  }

  @Override
  public synchronized List<Job> findPurgeCandidates(Instant cutoff, int limit) {
    return jobs.values().stream()
        .filter(j -> j.getStatus().isTerminal())
        .filter(j -> !j.isPurged())
        .filter(j -> j.getCreatedAt().isBefore(cutoff))
        .sorted(CANDIDATE_ORDER)
        .limit(limit)
        .collect(Collectors.toList());
  }

  @Override
  public synchronized List<Job> findPurgeCandidatesAfter(Instant cutoff, Job after, int limit) {
    return jobs.values().stream()
        .filter(j -> j.getStatus().isTerminal())
        .filter(j -> !j.isPurged())
        .filter(j -> j.getCreatedAt().isBefore(cutoff))
        .filter(j -> CANDIDATE_ORDER.compare(j, after) > 0)
        .sorted(CANDIDATE_ORDER)
        .limit(limit)
        .collect(Collectors.toList());
  }

  @Override
  public synchronized boolean markPurged(UUID jobId, Instant purgedAt) {
    Job job = jobs.get(jobId);
    if (job == null || job.isPurged() || !job.getStatus().isTerminal()) {
      return false;
    }
    job.setFilesPurgedAt(purgedAt);
    job.setPayloadJson(null);
    for (JobItem item : items(jobId)) {
      item.setOutputPath(null);
      item.setOutputText(null);
    }
    for (JobArtifact artifact : artifacts(jobId)) {
      artifact.setPath(null);
    }
    return true;
  }

  private boolean transition(UUID jobId, JobStatus next, String detail) {
    Job job = jobs.get(jobId);
    if (job == null || !job.getStatus().canTransitionTo(next)) {
      return false;
    }
    job.setStatus(next);
    job.setStatusDetail(detail);
    return true;
  }
}
