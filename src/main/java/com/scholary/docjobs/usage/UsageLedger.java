package com.scholary.docjobs.usage;

import com.scholary.docjobs.config.JobsProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only log of usage events and the window sums quota checks are based on.
 *
 * <p>Recording never rejects; limits are enforced only at admission time.
 */
@Service
public class UsageLedger {

  private static final Logger LOGGER = LoggerFactory.getLogger(UsageLedger.class);

  private final UsageEventRepository events;
  private final Clock clock;
  private final JobsProperties.Quota quota;

  public UsageLedger(UsageEventRepository events, Clock clock, JobsProperties properties) {
    this.events = events;
    this.clock = clock;
    this.quota = properties.quota();
  }

  /** Appends one event. Negative values are clamped to zero. */
  @Transactional
  public void recordUsage(UUID userId, String moduleKey, long tokens, long units) {
    long safeTokens = Math.max(0, tokens);
    long safeUnits = Math.max(0, units);
    events.save(new UsageEvent(userId, moduleKey, safeTokens, safeUnits, clock.instant()));
    LOGGER.debug(
        "Recorded usage: user={}, module={}, tokens={}, units={}",
        userId,
        moduleKey,
        safeTokens,
        safeUnits);
  }

  /** Tokens the user consumed across all modules since {@code since}. */
  @Transactional(readOnly = true)
  public long tokensSince(UUID userId, Instant since) {
    return events.sumTokensSince(userId, since);
  }

  /** Units the user consumed in one module since {@code since}; a null bound means lifetime. */
  @Transactional(readOnly = true)
  public long unitsSince(UUID userId, String moduleKey, Instant since) {
    if (since == null) {
      return events.sumUnitsLifetime(userId, moduleKey);
    }
    return events.sumUnitsSince(userId, moduleKey, since);
  }

  /** Per-user, per-module consumption over the rolling token window, for the admin view. */
  @Transactional(readOnly = true)
  public Map<UUID, UsageSnapshot> usageForUsers(Collection<UUID> userIds) {
    Map<UUID, UsageSnapshot> result = new LinkedHashMap<>();
    if (userIds.isEmpty()) {
      return result;
    }

    Instant since = clock.instant().minus(quota.tokenWindow());
    Map<UUID, Map<String, UsageSnapshot.ModuleUsage>> byUser = new LinkedHashMap<>();
    for (UUID userId : userIds) {
      byUser.put(userId, new TreeMap<>());
    }

    List<UsageEventRepository.ModuleUsageRow> rows =
        events.sumByUserAndModuleSince(userIds, since);
    for (UsageEventRepository.ModuleUsageRow row : rows) {
      UsageSnapshot.ModuleUsage usage =
          new UsageSnapshot.ModuleUsage(nullToZero(row.getTokens()), nullToZero(row.getUnits()));
      byUser.computeIfAbsent(row.getUserId(), id -> new TreeMap<>()).put(row.getModuleKey(), usage);
    }

    for (Map.Entry<UUID, Map<String, UsageSnapshot.ModuleUsage>> entry : byUser.entrySet()) {
      long totalTokens =
          entry.getValue().values().stream().mapToLong(UsageSnapshot.ModuleUsage::tokens).sum();
      result.put(
          entry.getKey(), new UsageSnapshot(entry.getKey(), since, totalTokens, entry.getValue()));
    }
    return result;
  }

  private static long nullToZero(Long value) {
    return value == null ? 0 : value;
  }
}
