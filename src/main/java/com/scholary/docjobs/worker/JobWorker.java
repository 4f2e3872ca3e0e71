package com.scholary.docjobs.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.docjobs.artifact.ArtifactStore;
import com.scholary.docjobs.config.AsyncConfig;
import com.scholary.docjobs.job.ErrorMessages;
import com.scholary.docjobs.job.Job;
import com.scholary.docjobs.job.JobItem;
import com.scholary.docjobs.job.JobOutcome;
import com.scholary.docjobs.job.JobStore;
import com.scholary.docjobs.job.RoundOutcome;
import com.scholary.docjobs.job.ThresholdEvaluator;
import com.scholary.docjobs.llm.LlmResponse;
import com.scholary.docjobs.llm.LlmService;
import com.scholary.docjobs.logging.StructuredLogger;
import com.scholary.docjobs.module.ArtifactContent;
import com.scholary.docjobs.module.ItemResult;
import com.scholary.docjobs.module.ModuleConfigService;
import com.scholary.docjobs.module.ModuleDefinition;
import com.scholary.docjobs.module.ModulePolicy;
import com.scholary.docjobs.module.ModuleProcessor;
import com.scholary.docjobs.module.ModuleRegistry;
import com.scholary.docjobs.module.ModuleSettings;
import com.scholary.docjobs.module.PlannedItem;
import com.scholary.docjobs.module.RoundContext;
import com.scholary.docjobs.module.RoundPlan;
import com.scholary.docjobs.module.RoundResult;
import com.scholary.docjobs.retry.AttemptBudget;
import com.scholary.docjobs.retry.RetryExhaustedException;
import com.scholary.docjobs.retry.RetryPolicy;
import com.scholary.docjobs.retry.Sleeper;
import com.scholary.docjobs.usage.UsageLedger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs one job from claim to terminal state.
 *
 * <p>Rounds are planned by the job's {@link ModuleProcessor} one at a time. Items of a round run
 * through {@link BoundedFanOut} under the module's concurrency cap, each inside the module's
 * {@link RetryPolicy}. A round that misses its threshold ends the job; otherwise the processor
 * assembles the aggregate outputs once every round is done. The job status is derived from the
 * persisted item statuses, never tracked separately.
 *
 * <p>Nothing thrown while processing escapes {@link #run}: unexpected errors fail the job.
 */
@Service
public class JobWorker {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobWorker.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  /** Guard against a processor that never stops planning. */
  static final int MAX_ROUNDS = 10;

  private final JobStore jobStore;
  private final ModuleRegistry registry;
  private final ModuleConfigService moduleConfigService;
  private final LlmService llmService;
  private final ArtifactStore artifactStore;
  private final UsageLedger usageLedger;
  private final ObjectMapper objectMapper;
  private final Sleeper sleeper;
  private final BoundedFanOut fanOut;

  public JobWorker(
      JobStore jobStore,
      ModuleRegistry registry,
      ModuleConfigService moduleConfigService,
      LlmService llmService,
      ArtifactStore artifactStore,
      UsageLedger usageLedger,
      ObjectMapper objectMapper,
      Sleeper sleeper,
      @Qualifier(AsyncConfig.LLM_CALL_EXECUTOR) Executor llmCallExecutor) {
    this.jobStore = jobStore;
    this.registry = registry;
    this.moduleConfigService = moduleConfigService;
    this.llmService = llmService;
    this.artifactStore = artifactStore;
    this.usageLedger = usageLedger;
    this.objectMapper = objectMapper;
    this.sleeper = sleeper;
    this.fanOut = new BoundedFanOut(llmCallExecutor);
  }

  /**
   * Process a job. A job that is missing or already claimed is left alone.
   *
   * @param jobId the job to run
   */
  public void run(UUID jobId) {
    Optional<Job> found = jobStore.find(jobId);
    if (found.isEmpty()) {
      LOGGER.warn("Job not found, nothing to run: jobId={}", jobId);
      return;
    }
    Job job = found.get();
    StructuredLogger.setJobContext(jobId, job.getModuleKey(), String.valueOf(job.getUserId()));
    long startTime = System.currentTimeMillis();
    try {
      if (!jobStore.claim(jobId, "Starting")) {
        LOGGER.info("Job already claimed or finished: status={}", job.getStatus());
        return;
      }
      ModuleDefinition definition = registry.require(job.getModuleKey());
      JobOutcome outcome = process(job, definition.processor(), definition.policy());
      structuredLogger.logJobFinished(
          outcome.status().name(), outcome.summary(), System.currentTimeMillis() - startTime);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.warn("Job interrupted");
      failQuietly(jobId, "Processing was interrupted");
    } catch (Exception e) {
      LOGGER.error("Job processing failed", e);
      failQuietly(jobId, "Internal error: " + ErrorMessages.describe(e));
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private void failQuietly(UUID jobId, String error) {
    try {
      jobStore.fail(jobId, error);
    } catch (RuntimeException e) {
      LOGGER.error("Could not mark job as failed: jobId={}", jobId, e);
    }
  }

  private <P> JobOutcome process(Job job, ModuleProcessor<P> processor, ModulePolicy policy)
      throws Exception {
    UUID jobId = job.getId();
    P payload = objectMapper.readValue(job.getPayloadJson(), processor.payloadType());
    ModuleSettings settings = moduleConfigService.settingsFor(processor.key());
    RetryPolicy retryPolicy = policy.retryPolicy(sleeper);
    AttemptBudget budget = policy.newAttemptBudget();

    List<RoundResult> results = new ArrayList<>();
    List<RoundOutcome> outcomes = new ArrayList<>();
    for (int round = 1; ; round++) {
      if (round > MAX_ROUNDS) {
        throw new IllegalStateException("Module planned more than " + MAX_ROUNDS + " rounds");
      }
      Optional<RoundPlan> plan =
          processor.planRound(
              new RoundContext<>(jobId, round, payload, settings, policy, results));
      if (plan.isEmpty()) {
        break;
      }

      List<JobItem> finished =
          runRound(job, processor.key(), round, plan.get(), policy, retryPolicy, budget);
      RoundOutcome outcome =
          ThresholdEvaluator.evaluateRound(round, finished, plan.get().threshold());
      outcomes.add(outcome);
      results.add(toResult(round, finished));
      LOGGER.info(
          "Round {} finished: {}/{} items succeeded, threshold={}, met={}",
          round,
          outcome.succeeded(),
          outcome.total(),
          outcome.threshold(),
          outcome.thresholdMet());
      if (!outcome.thresholdMet()) {
        break;
      }
    }

    JobOutcome outcome = ThresholdEvaluator.deriveJobStatus(outcomes);
    if (!outcome.isCompleted()) {
      jobStore.fail(jobId, outcome.summary());
      return outcome;
    }

    jobStore.updateDetail(jobId, "Assembling results");
    for (ArtifactContent artifact : processor.assemble(payload, settings, results)) {
      String location =
          artifactStore.write(jobId, artifact.name(), artifact.bytes(), artifact.contentType());
      jobStore.addArtifact(jobId, artifact.name(), artifact.contentType(), location);
    }
    long completionUnits = processor.completionUnits(payload, results);
    if (completionUnits > 0) {
      usageLedger.recordUsage(job.getUserId(), processor.key(), 0, completionUnits);
      jobStore.addUsage(jobId, completionUnits, 0);
    }
    jobStore.complete(jobId, outcome.summary());
    return outcome;
  }

  private List<JobItem> runRound(
      Job job,
      String moduleKey,
      int round,
      RoundPlan plan,
      ModulePolicy policy,
      RetryPolicy retryPolicy,
      AttemptBudget budget)
      throws InterruptedException {
    UUID jobId = job.getId();
    List<PlannedItem> planned = plan.items();
    List<JobItem> rows =
        jobStore.addItems(jobId, round, planned.stream().map(PlannedItem::label).toList());
    int total = rows.size();
    AtomicInteger done = new AtomicInteger();

    jobStore.updateDetail(jobId, progressDetail(round, 0, total));
    structuredLogger.logJobProgress(round, 0, total, "round_started");

    fanOut.run(
        total,
        policy.concurrencyCap(),
        index -> {
          runItem(job, moduleKey, rows.get(index), planned.get(index), retryPolicy, budget);
          int count = done.incrementAndGet();
          jobStore.updateDetail(jobId, progressDetail(round, count, total));
          structuredLogger.logJobProgress(round, count, total, "item_finished");
        });

    List<JobItem> finished = new ArrayList<>();
    for (JobItem item : jobStore.items(jobId)) {
      if (item.getRound() == round) {
        finished.add(item);
      }
    }
    return finished;
  }

  static String progressDetail(int round, int done, int total) {
    return String.format("Round %d: %d/%d items processed", round, done, total);
  }

  private void runItem(
      Job job,
      String moduleKey,
      JobItem row,
      PlannedItem item,
      RetryPolicy retryPolicy,
      AttemptBudget budget) {
    UUID jobId = job.getId();
    long itemId = row.getId();
    int round = row.getRound();
    int index = row.getItemIndex();

    jobStore.startItem(itemId);
    structuredLogger.logItemStarted(round, index, row.getLabel());
    long startTime = System.currentTimeMillis();
    AtomicLong tokens = new AtomicLong();
    AtomicInteger attempts = new AtomicInteger();

    String output;
    try {
      output =
          retryPolicy.execute(
              attempt -> {
                attempts.set(attempt);
                jobStore.recordAttempt(itemId);
                LlmResponse response = llmService.execute(item.request());
                tokens.addAndGet(Math.max(0, response.tokensUsed()));
                return item.interpreter().interpret(response);
              },
              budget,
              (attempt, maxAttempts, error, nextDelay) -> {
                if (nextDelay != null) {
                  structuredLogger.logItemRetry(
                      round,
                      index,
                      attempt,
                      maxAttempts,
                      error.getClass().getSimpleName(),
                      error.getMessage());
                }
              });
    } catch (RetryExhaustedException e) {
      Throwable cause = e.getCause();
      if (cause != null && !ModulePolicy.isRetryable(cause)) {
        // storage or programming error, not an LLM failure: fail the whole job
        throw new IllegalStateException(
            "Item " + index + " of round " + round + " aborted: " + ErrorMessages.describe(cause),
            cause);
      }
      jobStore.failItem(itemId, e.lastErrorMessage());
      chargeTokens(job, moduleKey, tokens.get());
      structuredLogger.logItemFailed(round, index, attempts.get(), e.lastErrorMessage());
      return;
    }

    String location;
    try {
      location =
          artifactStore.write(
              jobId,
              itemOutputName(round, index, item.outputName()),
              output.getBytes(StandardCharsets.UTF_8),
              item.contentType());
    } catch (RuntimeException e) {
      chargeTokens(job, moduleKey, tokens.get());
      throw e;
    }
    jobStore.completeItem(itemId, output, location, item.units(), tokens.get());
    if (tokens.get() > 0 || item.units() > 0) {
      usageLedger.recordUsage(job.getUserId(), moduleKey, tokens.get(), item.units());
      jobStore.addUsage(jobId, item.units(), tokens.get());
    }
    structuredLogger.logItemCompleted(
        round, index, attempts.get(), tokens.get(), System.currentTimeMillis() - startTime);
  }

  /** Prefixed with round and index, so documents sharing a file name never collide. */
  static String itemOutputName(int round, int index, String outputName) {
    return String.format("item_r%d_%03d_%s", round, index, outputName);
  }

  /** Tokens of an item that did not complete are still metered; no units are charged. */
  private void chargeTokens(Job job, String moduleKey, long tokens) {
    if (tokens > 0) {
      usageLedger.recordUsage(job.getUserId(), moduleKey, tokens, 0);
      jobStore.addUsage(job.getId(), 0, tokens);
    }
  }

  private static RoundResult toResult(int round, List<JobItem> items) {
    List<ItemResult> results = new ArrayList<>(items.size());
    for (JobItem item : items) {
      results.add(
          new ItemResult(
              item.getItemIndex(),
              item.getLabel(),
              item.getStatus(),
              item.getAttemptCount(),
              item.getOutputText(),
              item.getErrorMessage()));
    }
    return new RoundResult(round, results);
  }
}
