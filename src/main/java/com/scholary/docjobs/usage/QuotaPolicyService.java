package com.scholary.docjobs.usage;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.docjobs.config.JobsProperties;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves the effective quota policy of a user for a module.
 *
 * <p>Policies are read on every submission and changed rarely, so they are kept in a Caffeine
 * cache that every admin mutation invalidates.
 */
@Service
public class QuotaPolicyService {

  private static final Logger LOGGER = LoggerFactory.getLogger(QuotaPolicyService.class);

  private final UserUsageGroupRepository assignments;
  private final UsageGroupRepository groups;
  private final UsageGroupLimitRepository limits;
  private final Cache<PolicyKey, Optional<QuotaPolicy>> cache;

  public QuotaPolicyService(
      UserUsageGroupRepository assignments,
      UsageGroupRepository groups,
      UsageGroupLimitRepository limits,
      JobsProperties properties) {
    this.assignments = assignments;
    this.groups = groups;
    this.limits = limits;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(properties.quota().policyCacheMaxSize())
            .expireAfterWrite(properties.quota().policyCacheTtl())
            .build();
  }

  /** Empty when the user belongs to no usage group. */
  public Optional<QuotaPolicy> policyFor(UUID userId, String moduleKey) {
    return cache.get(new PolicyKey(userId, moduleKey), this::load);
  }

  public void invalidateAll() {
    cache.invalidateAll();
    LOGGER.debug("Quota policy cache invalidated");
  }

  private Optional<QuotaPolicy> load(PolicyKey key) {
    Optional<UserUsageGroup> assignment = assignments.findById(key.userId());
    if (assignment.isEmpty()) {
      return Optional.empty();
    }

    Optional<UsageGroup> group = groups.findById(assignment.get().getGroupId());
    if (group.isEmpty()) {
      LOGGER.warn(
          "User {} is assigned to missing usage group {}",
          key.userId(),
          assignment.get().getGroupId());
      return Optional.empty();
    }

    QuotaPolicy.UnitLimit unitLimit =
        limits
            .findByGroupIdAndModuleKey(group.get().getId(), key.moduleKey())
            .map(l -> new QuotaPolicy.UnitLimit(l.getUnitLimit(), l.getUnitWindowDays()))
            .orElse(null);

    return Optional.of(
        new QuotaPolicy(
            group.get().getId(), group.get().getName(), group.get().getTokenBudget(), unitLimit));
  }

  private record PolicyKey(UUID userId, String moduleKey) {}
}
