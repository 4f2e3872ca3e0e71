package com.scholary.docjobs.retention;

import com.scholary.docjobs.artifact.ArtifactStore;
import com.scholary.docjobs.artifact.ArtifactStoreException;
import com.scholary.docjobs.config.JobsProperties;
import com.scholary.docjobs.history.HistoryIndex;
import com.scholary.docjobs.job.Job;
import com.scholary.docjobs.job.JobStore;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Deletes the outputs of finished jobs once they are older than {@code jobs.retention.max-age}.
 *
 * <p>Files go first; only when that succeeded are the job's locations cleared and {@code
 * files_purged_at} set, in one transaction. A job whose files could not be deleted is left as is
 * and picked up again by the next sweep. Purged jobs never match again.
 */
@Component
public class RetentionSweeper {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetentionSweeper.class);

  private final JobStore jobStore;
  private final ArtifactStore artifactStore;
  private final HistoryIndex historyIndex;
  private final Clock clock;
  private final JobsProperties.Retention config;

  public RetentionSweeper(
      JobStore jobStore,
      ArtifactStore artifactStore,
      HistoryIndex historyIndex,
      Clock clock,
      JobsProperties properties) {
    this.jobStore = jobStore;
    this.artifactStore = artifactStore;
    this.historyIndex = historyIndex;
    this.clock = clock;
    this.config = properties.retention();
  }

  @Scheduled(
      fixedDelayString = "${jobs.retention.sweep-interval:PT1H}",
      initialDelayString = "${jobs.retention.initial-delay:PT1M}")
  public void scheduledSweep() {
    try {
      sweep();
    } catch (RuntimeException e) {
      LOGGER.error("Retention sweep failed", e);
    }
  }

  /**
   * Purge every candidate, one page of {@code jobs.retention.batch-size} jobs at a time. Pages
   * follow creation order, so jobs that keep failing never hide younger ones.
   */
  public SweepReport sweep() {
    Instant now = clock.instant();
    Instant cutoff = now.minus(config.maxAge());

    int candidates = 0;
    int purged = 0;
    int skipped = 0;
    List<Job> page = jobStore.findPurgeCandidates(cutoff, config.batchSize());
    while (!page.isEmpty()) {
      candidates += page.size();
      for (Job job : page) {
        if (purge(job)) {
          purged++;
        } else {
          skipped++;
        }
      }
      if (page.size() < config.batchSize()) {
        break;
      }
      page =
          jobStore.findPurgeCandidatesAfter(cutoff, page.get(page.size() - 1), config.batchSize());
    }

    int historyDeleted = historyIndex.purgeExpired();
    SweepReport report = new SweepReport(candidates, purged, skipped, historyDeleted);
    if (candidates > 0 || historyDeleted > 0) {
      LOGGER.info(
          "Retention sweep: candidates={}, purged={}, skipped={}, historyDeleted={}",
          report.candidates(),
          report.purged(),
          report.skipped(),
          report.historyEntriesDeleted());
    }
    return report;
  }

  /** Returns false when the job is left for the next sweep. */
  private boolean purge(Job job) {
    try {
      artifactStore.deleteJob(job.getId());
    } catch (ArtifactStoreException e) {
      LOGGER.warn(
          "Could not delete outputs, will retry next sweep: jobId={}, error={}",
          job.getId(),
          e.getMessage());
      return false;
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected error deleting outputs: jobId={}", job.getId(), e);
      return false;
    }
    try {
      return jobStore.markPurged(job.getId(), clock.instant());
    } catch (RuntimeException e) {
      LOGGER.error("Could not mark job as purged: jobId={}", job.getId(), e);
      return false;
    }
  }
}
