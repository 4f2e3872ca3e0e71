package com.scholary.docjobs.usage;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** A user's consumption since {@code windowStart}, split by module. */
public record UsageSnapshot(
    UUID userId, Instant windowStart, long totalTokens, Map<String, ModuleUsage> modules) {

  public UsageSnapshot {
    modules = Map.copyOf(modules);
  }

  public record ModuleUsage(long tokens, long units) {}
}
