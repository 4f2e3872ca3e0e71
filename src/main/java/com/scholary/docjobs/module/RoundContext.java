package com.scholary.docjobs.module;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * What a processor sees when planning a round.
 *
 * @param round 1-based number of the round being planned
 * @param previousRounds results of every earlier round, in order
 */
public record RoundContext<P>(
    UUID jobId,
    int round,
    P payload,
    ModuleSettings settings,
    ModulePolicy policy,
    List<RoundResult> previousRounds) {

  public RoundContext {
    previousRounds = List.copyOf(previousRounds);
  }

  public Optional<RoundResult> previousRound() {
    if (previousRounds.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(previousRounds.get(previousRounds.size() - 1));
  }
}
