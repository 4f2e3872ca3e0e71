package com.scholary.docjobs.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the job engine.
 *
 * <p>These map to the "jobs.*" keys in application.yml. Per-module entries under {@code
 * jobs.modules} override the defaults each module ships with; any field left out keeps its
 * default.
 */
@ConfigurationProperties(prefix = "jobs")
@Validated
public record JobsProperties(
    @Valid @NotNull Executor executor,
    @Valid @NotNull Retention retention,
    @Valid @NotNull History history,
    @Valid @NotNull Quota quota,
    Map<String, ModuleOverrides> modules) {

  public JobsProperties {
    modules = modules == null ? Map.of() : Map.copyOf(modules);
  }

  /** Thread pools: one task per job, and a separate pool for the LLM calls of all jobs. */
  public record Executor(
      @Positive int jobThreads,
      @PositiveOrZero int jobQueueSize,
      @Positive int llmThreads,
      @PositiveOrZero int llmQueueSize) {}

  public record Retention(
      @NotNull Duration maxAge, @NotNull Duration sweepInterval, @Positive int batchSize) {}

  public record History(@NotNull Duration window, @Positive int maxEntriesPerModule) {}

  public record Quota(
      @NotNull Duration tokenWindow,
      @NotNull Duration policyCacheTtl,
      @Positive long policyCacheMaxSize) {}

  /** Optional per-module policy overrides; null fields fall back to the module default. */
  public record ModuleOverrides(
      Integer attemptCap,
      Integer concurrencyCap,
      Duration retryDelay,
      Duration retryDelayIncrement,
      String successThreshold,
      Integer attemptBudget,
      Long estimatedTokensPerUnit) {}
}
