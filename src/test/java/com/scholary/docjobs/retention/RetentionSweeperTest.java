package com.scholary.docjobs.retention;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.docjobs.artifact.ArtifactStore;
import com.scholary.docjobs.artifact.ArtifactStoreException;
import com.scholary.docjobs.config.TestJobsProperties;
import com.scholary.docjobs.history.HistoryIndex;
import com.scholary.docjobs.job.InMemoryJobStore;
import com.scholary.docjobs.job.Job;
import com.scholary.docjobs.job.JobItem;
import com.scholary.docjobs.job.JobStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;

@ExtendWith(MockitoExtension.class)
class RetentionSweeperTest {

  private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

  @Mock private ArtifactStore artifactStore;
  @Mock private HistoryIndex historyIndex;

  private InMemoryJobStore jobStore;
  private RetentionSweeper sweeper;

  @BeforeEach
  void setUp() {
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    jobStore = new InMemoryJobStore(clock);
    sweeper =
        new RetentionSweeper(
            jobStore, artifactStore, historyIndex, clock, TestJobsProperties.defaults());
  }

  private Job seed(Duration age, JobStatus status) {
    Job job =
        new Job(UUID.randomUUID(), UUID.randomUUID(), "summarizer", "{}", NOW.minus(age));
    job.setStatus(status);
    jobStore.put(job);
    List<JobItem> items = jobStore.addItems(job.getId(), 1, List.of("paper.pdf"));
    JobItem item = items.get(0);
    jobStore.startItem(item.getId());
    jobStore.completeItem(item.getId(), "summary", "/data/" + job.getId() + "/item", 1, 100);
    jobStore.addArtifact(job.getId(), "combined_summary.md", "text/markdown", "/data/combined");
    return job;
  }

  @Test
  void sweep_shouldPurgeTerminalJobsOlderThanMaxAge() {
    Job old = seed(Duration.ofHours(25), JobStatus.COMPLETED);

    SweepReport report = sweeper.sweep();

    assertThat(report.purged()).isEqualTo(1);
    verify(artifactStore).deleteJob(old.getId());

    Job purged = jobStore.find(old.getId()).orElseThrow();
    assertThat(purged.isPurged()).isTrue();
    assertThat(purged.getFilesPurgedAt()).isEqualTo(NOW);
    assertThat(purged.getPayloadJson()).isNull();
    assertThat(purged.getStatus()).isEqualTo(JobStatus.COMPLETED);
    assertThat(jobStore.items(old.getId()))
        .allSatisfy(
            item -> {
              assertThat(item.getOutputPath()).isNull();
              assertThat(item.getOutputText()).isNull();
            });
    assertThat(jobStore.artifacts(old.getId())).allSatisfy(a -> assertThat(a.getPath()).isNull());
  }

  @Test
  void sweep_shouldBeIdempotent() {
    seed(Duration.ofHours(25), JobStatus.FAILED);

    SweepReport first = sweeper.sweep();
    SweepReport second = sweeper.sweep();

    assertThat(first.purged()).isEqualTo(1);
    assertThat(second.candidates()).isZero();
    assertThat(second.purged()).isZero();
  }

  @Test
  void sweep_shouldLeaveYoungAndRunningJobsAlone() {
    Job young = seed(Duration.ofHours(23), JobStatus.COMPLETED);
    Job running = seed(Duration.ofHours(30), JobStatus.PROCESSING);

    SweepReport report = sweeper.sweep();

    assertThat(report.candidates()).isZero();
    assertThat(jobStore.find(young.getId()).orElseThrow().isPurged()).isFalse();
    assertThat(jobStore.find(running.getId()).orElseThrow().isPurged()).isFalse();
    verify(artifactStore, never()).deleteJob(young.getId());
  }

  @Test
  void sweep_shouldKeepPathsWhenDeletionFails() {
    Job old = seed(Duration.ofDays(3), JobStatus.COMPLETED);
    doThrow(new ArtifactStoreException("bucket unavailable"))
        .when(artifactStore)
        .deleteJob(old.getId());

    SweepReport report = sweeper.sweep();

    assertThat(report.skipped()).isEqualTo(1);
    assertThat(report.purged()).isZero();
    Job kept = jobStore.find(old.getId()).orElseThrow();
    assertThat(kept.isPurged()).isFalse();
    assertThat(jobStore.items(old.getId()).get(0).getOutputPath()).isNotNull();
  }

  @Test
  void sweep_shouldContinueAfterUnexpectedDeletionError() {
    Job broken = seed(Duration.ofHours(30), JobStatus.COMPLETED);
    Job healthy = seed(Duration.ofHours(26), JobStatus.COMPLETED);
    doThrow(SdkClientException.create("Unable to execute HTTP request"))
        .when(artifactStore)
        .deleteJob(broken.getId());
    when(historyIndex.purgeExpired()).thenReturn(2);

    SweepReport report = sweeper.sweep();

    assertThat(report.candidates()).isEqualTo(2);
    assertThat(report.purged()).isEqualTo(1);
    assertThat(report.skipped()).isEqualTo(1);
    assertThat(report.historyEntriesDeleted()).isEqualTo(2);
    assertThat(jobStore.find(broken.getId()).orElseThrow().isPurged()).isFalse();
    assertThat(jobStore.find(healthy.getId()).orElseThrow().isPurged()).isTrue();
  }

  @Test
  void sweep_shouldContinueWhenMarkingPurgedFails() {
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    UUID[] failing = new UUID[1];
    InMemoryJobStore flakyStore =
        new InMemoryJobStore(clock) {
          @Override
          public synchronized boolean markPurged(UUID jobId, Instant purgedAt) {
            if (jobId.equals(failing[0])) {
              throw new IllegalStateException("connection reset");
            }
            return super.markPurged(jobId, purgedAt);
          }
        };
    jobStore = flakyStore;
    sweeper =
        new RetentionSweeper(
            flakyStore, artifactStore, historyIndex, clock, TestJobsProperties.defaults());
    Job first = seed(Duration.ofHours(30), JobStatus.FAILED);
    Job second = seed(Duration.ofHours(26), JobStatus.COMPLETED);
    failing[0] = first.getId();

    SweepReport report = sweeper.sweep();

    assertThat(report.purged()).isEqualTo(1);
    assertThat(report.skipped()).isEqualTo(1);
    assertThat(flakyStore.find(first.getId()).orElseThrow().isPurged()).isFalse();
    assertThat(flakyStore.find(second.getId()).orElseThrow().isPurged()).isTrue();
    verify(historyIndex).purgeExpired();
  }

  @Test
  void sweep_shouldReachYoungerJobsBehindRepeatedFailures() {
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    sweeper =
        new RetentionSweeper(
            jobStore, artifactStore, historyIndex, clock, TestJobsProperties.withSweepBatchSize(1));
    Job oldest = seed(Duration.ofHours(40), JobStatus.COMPLETED);
    Job older = seed(Duration.ofHours(35), JobStatus.FAILED);
    Job eligible = seed(Duration.ofHours(25), JobStatus.COMPLETED);
    for (Job stuck : List.of(oldest, older)) {
      doThrow(new ArtifactStoreException("access denied"))
          .when(artifactStore)
          .deleteJob(stuck.getId());
    }

    SweepReport first = sweeper.sweep();
    SweepReport second = sweeper.sweep();

    assertThat(first.candidates()).isEqualTo(3);
    assertThat(first.purged()).isEqualTo(1);
    assertThat(first.skipped()).isEqualTo(2);
    assertThat(jobStore.find(eligible.getId()).orElseThrow().isPurged()).isTrue();
    assertThat(second.candidates()).isEqualTo(2);
    assertThat(second.purged()).isZero();
  }

  @Test
  void sweep_shouldExpireHistoryEntries() {
    when(historyIndex.purgeExpired()).thenReturn(3);

    SweepReport report = sweeper.sweep();

    assertThat(report.historyEntriesDeleted()).isEqualTo(3);
  }
}
