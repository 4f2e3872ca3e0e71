package com.scholary.docjobs.history;

import com.scholary.docjobs.config.JobsProperties;
import com.scholary.docjobs.job.Job;
import com.scholary.docjobs.job.JobStore;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per-user index of recently started jobs.
 *
 * <p>Keeps at most {@code jobs.history.max-entries-per-module} entries per user and module and
 * lists only entries younger than {@code jobs.history.window}. Status is hydrated from the job
 * table on every read.
 */
@Service
public class HistoryIndex {

  private static final Logger LOGGER = LoggerFactory.getLogger(HistoryIndex.class);

  static final int MAX_LIMIT = 50;

  private final HistoryEntryRepository entries;
  private final JobStore jobStore;
  private final Clock clock;
  private final JobsProperties.History config;

  public HistoryIndex(
      HistoryEntryRepository entries,
      JobStore jobStore,
      Clock clock,
      JobsProperties properties) {
    this.entries = entries;
    this.jobStore = jobStore;
    this.clock = clock;
    this.config = properties.history();
  }

  /** Records that a user started a job. Recording the same job twice has no effect. */
  @Transactional
  public void recordJobStart(UUID userId, String moduleKey, UUID jobId) {
    int inserted = entries.insertIfAbsent(userId, moduleKey, jobId.toString(), clock.instant());
    if (inserted == 0) {
      LOGGER.debug("History entry already present: module={}, job={}", moduleKey, jobId);
      return;
    }
    int pruned = entries.pruneBeyond(userId, moduleKey, config.maxEntriesPerModule());
    if (pruned > 0) {
      LOGGER.debug("Pruned {} history entries: user={}, module={}", pruned, userId, moduleKey);
    }
  }

  /**
   * Newest first.
   *
   * @param moduleKey restricts the listing to one module when not null
   * @param limit clamped to [1, 50]
   */
  @Transactional(readOnly = true)
  public List<HistoryView> fetchRecent(UUID userId, String moduleKey, int limit) {
    int clamped = Math.max(1, Math.min(MAX_LIMIT, limit));
    Instant since = clock.instant().minus(config.window());
    PageRequest page = PageRequest.of(0, clamped);
    List<HistoryEntry> recent =
        moduleKey == null
            ? entries.findRecent(userId, since, page)
            : entries.findRecentForModule(userId, moduleKey, since, page);

    List<UUID> jobIds = new ArrayList<>();
    for (HistoryEntry entry : recent) {
      parseJobKey(entry).ifPresent(jobIds::add);
    }
    Map<UUID, Job> jobs =
        jobStore.findAll(jobIds).stream()
            .collect(Collectors.toMap(Job::getId, Function.identity()));

    List<HistoryView> views = new ArrayList<>(recent.size());
    for (HistoryEntry entry : recent) {
      Optional<Job> job = parseJobKey(entry).map(jobs::get);
      if (job.isEmpty()) {
        continue;
      }
      Job j = job.get();
      views.add(
          new HistoryView(
              j.getId(),
              entry.getModuleKey(),
              entry.getCreatedAt(),
              j.getStatus(),
              j.getStatusDetail(),
              j.getUpdatedAt(),
              j.isPurged()));
    }
    return views;
  }

  /** Drops entries older than the history window. */
  @Transactional
  public int purgeExpired() {
    return entries.deleteOlderThan(clock.instant().minus(config.window()));
  }

  private static Optional<UUID> parseJobKey(HistoryEntry entry) {
    try {
      return Optional.of(UUID.fromString(entry.getJobKey()));
    } catch (IllegalArgumentException e) {
      LOGGER.warn("Ignoring history entry with malformed job key: id={}", entry.getId());
      return Optional.empty();
    }
  }
}
