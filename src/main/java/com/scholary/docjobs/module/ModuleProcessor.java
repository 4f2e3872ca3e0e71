package com.scholary.docjobs.module;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Module-specific half of a job.
 *
 * <p>The worker owns the lifecycle (claiming, retries, fan-out, usage, status). A processor only
 * says what to run in each round, how to read the answers and what to produce at the end.
 *
 * @param <P> the module's payload type, decoded from the job's stored JSON
 */
public interface ModuleProcessor<P> {

  /** Stable identifier used in URLs, usage events and configuration. */
  String key();

  String displayName();

  String description();

  Class<P> payloadType();

  ModulePolicy defaultPolicy();

  ModuleSettings defaultSettings();

  /**
   * Checks module rules that bean validation cannot express.
   *
   * @throws InvalidPayloadException if the payload cannot be processed
   */
  default void validate(P payload) {}

  /** Units the submission is expected to consume, for the admission-time quota check. */
  long projectedUnits(P payload);

  /**
   * Plans the next round, or returns empty when the job has no further work.
   *
   * <p>Only called while every earlier round met its threshold.
   */
  Optional<RoundPlan> planRound(RoundContext<P> context);

  /** Builds the job's aggregate outputs after all rounds succeeded. */
  List<ArtifactContent> assemble(P payload, ModuleSettings settings, List<RoundResult> rounds)
      throws IOException;

  /** Units charged once on completion, on top of the per-item units. */
  default long completionUnits(P payload, List<RoundResult> rounds) {
    return 0;
  }
}
