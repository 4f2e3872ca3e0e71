package com.scholary.docjobs.service;

import com.scholary.docjobs.artifact.ArtifactStore;
import com.scholary.docjobs.artifact.ReportWriter;
import com.scholary.docjobs.history.HistoryIndex;
import com.scholary.docjobs.history.HistoryView;
import com.scholary.docjobs.job.Job;
import com.scholary.docjobs.job.JobArtifact;
import com.scholary.docjobs.job.JobItem;
import com.scholary.docjobs.job.JobStore;
import com.scholary.docjobs.module.ModuleDefinition;
import com.scholary.docjobs.module.ModuleRegistry;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;

/** Status, downloads, history and module listing, all scoped to the requester. */
@Service
public class JobQueryService {

  private static final String TEXT_CONTENT_TYPE = "text/plain; charset=utf-8";

  private final JobStore jobStore;
  private final ArtifactStore artifactStore;
  private final HistoryIndex historyIndex;
  private final ModuleRegistry registry;

  public JobQueryService(
      JobStore jobStore,
      ArtifactStore artifactStore,
      HistoryIndex historyIndex,
      ModuleRegistry registry) {
    this.jobStore = jobStore;
    this.artifactStore = artifactStore;
    this.historyIndex = historyIndex;
    this.registry = registry;
  }

  public JobStatusView getStatus(Requester requester, UUID jobId) {
    Job job = readableJob(requester, jobId);
    List<JobStatusView.ItemView> items =
        jobStore.items(jobId).stream()
            .map(
                item ->
                    new JobStatusView.ItemView(
                        item.getRound(),
                        item.getItemIndex(),
                        item.getLabel(),
                        item.getStatus(),
                        item.getAttemptCount(),
                        item.getErrorMessage(),
                        item.getOutputPath() != null))
            .toList();
    List<JobStatusView.ArtifactView> artifacts =
        jobStore.artifacts(jobId).stream()
            .map(
                artifact ->
                    new JobStatusView.ArtifactView(
                        artifact.getName(), artifact.getContentType(), artifact.getPath() != null))
            .toList();
    return new JobStatusView(
        job.getId(),
        job.getModuleKey(),
        job.getStatus(),
        job.getStatusDetail(),
        job.getErrorMessage(),
        job.getUsageDelta(),
        job.getTokensUsed(),
        job.getCreatedAt(),
        job.getUpdatedAt(),
        job.isPurged(),
        items,
        artifacts);
  }

  /**
   * Open an aggregate output of a job.
   *
   * @throws ArtifactGoneException if the job's outputs were purged
   * @throws ArtifactNotFoundException if the job has no output of that name
   */
  public StoredOutput openArtifact(Requester requester, UUID jobId, String name) {
    Job job = readableJob(requester, jobId);
    JobArtifact artifact =
        jobStore
            .artifact(jobId, name)
            .orElseThrow(() -> goneOrMissing(job, "No artifact named " + name));
    if (artifact.getPath() == null) {
      throw new ArtifactGoneException("Outputs of job " + jobId + " have been deleted");
    }
    return new StoredOutput(
        artifact.getName(), artifact.getContentType(), artifactStore.open(artifact.getPath()));
  }

  /**
   * Open the stored output of a single item.
   *
   * @throws ArtifactGoneException if the job's outputs were purged
   * @throws ArtifactNotFoundException if the item does not exist or produced no output
   */
  public StoredOutput openItemOutput(Requester requester, UUID jobId, int round, int index) {
    Job job = readableJob(requester, jobId);
    JobItem item =
        jobStore
            .item(jobId, round, index)
            .orElseThrow(
                () -> new ArtifactNotFoundException("No item " + index + " in round " + round));
    if (item.getOutputPath() == null) {
      throw goneOrMissing(job, "Item " + index + " of round " + round + " has no output");
    }
    String location = item.getOutputPath();
    String filename = location.substring(location.lastIndexOf('/') + 1);
    return new StoredOutput(filename, contentTypeOf(filename), artifactStore.open(location));
  }

  static String contentTypeOf(String filename) {
    if (filename.endsWith(".json")) {
      return ReportWriter.JSON;
    }
    if (filename.endsWith(".md")) {
      return ReportWriter.MARKDOWN;
    }
    return TEXT_CONTENT_TYPE;
  }

  public List<HistoryView> listHistory(Requester requester, String moduleKey, int limit) {
    return historyIndex.fetchRecent(requester.userId(), moduleKey, limit);
  }

  public List<ModuleInfo> listModules() {
    return registry.all().stream().map(JobQueryService::toInfo).toList();
  }

  private static ModuleInfo toInfo(ModuleDefinition definition) {
    return new ModuleInfo(
        definition.key(),
        definition.processor().displayName(),
        definition.processor().description(),
        definition.policy().attemptCap(),
        definition.policy().concurrencyCap(),
        definition.policy().successThreshold().toString());
  }

  private Job readableJob(Requester requester, UUID jobId) {
    Job job = jobStore.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    if (!requester.canRead(job.getUserId())) {
      throw new JobAccessDeniedException(jobId);
    }
    return job;
  }

  private static RuntimeException goneOrMissing(Job job, String missingMessage) {
    if (job.isPurged()) {
      return new ArtifactGoneException("Outputs of job " + job.getId() + " have been deleted");
    }
    return new ArtifactNotFoundException(missingMessage);
  }
}
