package com.scholary.docjobs.module;

import com.scholary.docjobs.config.JobsProperties.ModuleOverrides;
import com.scholary.docjobs.job.SuccessThreshold;
import com.scholary.docjobs.llm.LlmException;
import com.scholary.docjobs.retry.AttemptBudget;
import com.scholary.docjobs.retry.DelayFunction;
import com.scholary.docjobs.retry.RetryPolicy;
import com.scholary.docjobs.retry.Sleeper;
import java.time.Duration;

/**
 * Failure policy of a module.
 *
 * @param attemptCap maximum LLM calls per item
 * @param concurrencyCap maximum in-flight LLM calls per job
 * @param retryDelay pause after the first failed attempt
 * @param retryDelayIncrement added to the pause after every further failed attempt
 * @param successThreshold share of items that must succeed in the module's main rounds
 * @param attemptBudget job-wide cap on LLM calls across all items, null for none
 * @param estimatedTokensPerUnit token estimate used to project a submission's cost
 */
public record ModulePolicy(
    int attemptCap,
    int concurrencyCap,
    Duration retryDelay,
    Duration retryDelayIncrement,
    SuccessThreshold successThreshold,
    Integer attemptBudget,
    long estimatedTokensPerUnit) {

  public ModulePolicy {
    if (attemptCap < 1) {
      throw new IllegalArgumentException("attemptCap must be at least 1: " + attemptCap);
    }
    if (concurrencyCap < 1) {
      throw new IllegalArgumentException("concurrencyCap must be at least 1: " + concurrencyCap);
    }
    if (retryDelay == null || retryDelay.isNegative()) {
      throw new IllegalArgumentException("retryDelay must be >= 0: " + retryDelay);
    }
    if (retryDelayIncrement == null || retryDelayIncrement.isNegative()) {
      throw new IllegalArgumentException(
          "retryDelayIncrement must be >= 0: " + retryDelayIncrement);
    }
    if (successThreshold == null) {
      throw new IllegalArgumentException("successThreshold must be set");
    }
    if (attemptBudget != null && attemptBudget < 1) {
      throw new IllegalArgumentException("attemptBudget must be positive: " + attemptBudget);
    }
    if (estimatedTokensPerUnit < 0) {
      throw new IllegalArgumentException(
          "estimatedTokensPerUnit must be >= 0: " + estimatedTokensPerUnit);
    }
  }

  public RetryPolicy retryPolicy(Sleeper sleeper) {
    return new RetryPolicy(
        attemptCap,
        DelayFunction.linear(retryDelay, retryDelayIncrement),
        ModulePolicy::isRetryable,
        sleeper);
  }

  public AttemptBudget newAttemptBudget() {
    return attemptBudget == null ? AttemptBudget.unlimited() : AttemptBudget.of(attemptBudget);
  }

  /** Provider and parse failures are retried; anything else is a bug or a storage problem. */
  public static boolean isRetryable(Throwable error) {
    return error instanceof LlmException;
  }

  public ModulePolicy withOverrides(ModuleOverrides overrides) {
    if (overrides == null) {
      return this;
    }
    return new ModulePolicy(
        overrides.attemptCap() != null ? overrides.attemptCap() : attemptCap,
        overrides.concurrencyCap() != null ? overrides.concurrencyCap() : concurrencyCap,
        overrides.retryDelay() != null ? overrides.retryDelay() : retryDelay,
        overrides.retryDelayIncrement() != null
            ? overrides.retryDelayIncrement()
            : retryDelayIncrement,
        overrides.successThreshold() != null
            ? SuccessThreshold.parse(overrides.successThreshold())
            : successThreshold,
        overrides.attemptBudget() != null ? overrides.attemptBudget() : attemptBudget,
        overrides.estimatedTokensPerUnit() != null
            ? overrides.estimatedTokensPerUnit()
            : estimatedTokensPerUnit);
  }
}
