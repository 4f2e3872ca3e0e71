package com.scholary.docjobs.usage;

import com.scholary.docjobs.module.ModuleRegistry;
import java.time.Clock;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Administrator operations on usage groups, their limits and user assignments. */
@Service
public class QuotaAdminService {

  private static final Logger LOGGER = LoggerFactory.getLogger(QuotaAdminService.class);

  private final UsageGroupRepository groups;
  private final UsageGroupLimitRepository limits;
  private final UserUsageGroupRepository assignments;
  private final QuotaPolicyService policies;
  private final UsageLedger ledger;
  private final ModuleRegistry modules;
  private final Clock clock;

  public QuotaAdminService(
      UsageGroupRepository groups,
      UsageGroupLimitRepository limits,
      UserUsageGroupRepository assignments,
      QuotaPolicyService policies,
      UsageLedger ledger,
      ModuleRegistry modules,
      Clock clock) {
    this.groups = groups;
    this.limits = limits;
    this.assignments = assignments;
    this.policies = policies;
    this.ledger = ledger;
    this.modules = modules;
    this.clock = clock;
  }

  /** A requested per-module limit; a null {@code unitLimit} means "no cap" and is skipped. */
  public record ModuleLimitSpec(String moduleKey, Long unitLimit, Integer unitWindowDays) {}

  @Transactional
  public UsageGroup createGroup(String name, String description, Long tokenBudget) {
    if (name == null || name.isBlank()) {
      throw new InvalidQuotaConfigurationException("Usage group name must not be blank");
    }
    requireNonNegative("token budget", tokenBudget);
    if (groups.findByName(name.trim()).isPresent()) {
      throw new InvalidQuotaConfigurationException("Usage group already exists: " + name.trim());
    }
    UsageGroup group =
        groups.save(new UsageGroup(name.trim(), description, tokenBudget, clock.instant()));
    policies.invalidateAll();
    LOGGER.info("Created usage group: id={}, name={}", group.getId(), group.getName());
    return group;
  }

  @Transactional
  public UsageGroup setTokenBudget(Long groupId, Long tokenBudget) {
    requireNonNegative("token budget", tokenBudget);
    UsageGroup group =
        groups.findById(groupId).orElseThrow(() -> new UsageGroupNotFoundException(groupId));
    group.setTokenBudget(tokenBudget);
    policies.invalidateAll();
    LOGGER.info("Updated token budget: group={}, budget={}", groupId, tokenBudget);
    return group;
  }

  /**
   * Replaces every per-module limit of the group in one transaction. Entries without a limit are
   * dropped, so the group ends up with no cap for that module.
   */
  @Transactional
  public List<UsageGroupLimit> replaceLimits(Long groupId, List<ModuleLimitSpec> specs) {
    if (!groups.existsById(groupId)) {
      throw new UsageGroupNotFoundException(groupId);
    }

    Set<String> seen = new HashSet<>();
    for (ModuleLimitSpec spec : specs) {
      if (modules.find(spec.moduleKey()).isEmpty()) {
        throw new InvalidQuotaConfigurationException("Unknown module: " + spec.moduleKey());
      }
      if (!seen.add(spec.moduleKey())) {
        throw new InvalidQuotaConfigurationException("Duplicate module: " + spec.moduleKey());
      }
      requireNonNegative("unit limit", spec.unitLimit());
      if (spec.unitWindowDays() != null && spec.unitWindowDays() <= 0) {
        throw new InvalidQuotaConfigurationException(
            "Unit window must be a positive number of days: " + spec.unitWindowDays());
      }
    }

    limits.deleteByGroupId(groupId);
    List<UsageGroupLimit> saved =
        limits.saveAll(
            specs.stream()
                .filter(spec -> spec.unitLimit() != null)
                .map(
                    spec ->
                        new UsageGroupLimit(
                            groupId, spec.moduleKey(), spec.unitLimit(), spec.unitWindowDays()))
                .toList());
    policies.invalidateAll();
    LOGGER.info("Replaced module limits: group={}, limits={}", groupId, saved.size());
    return saved;
  }

  @Transactional
  public void assignUser(UUID userId, Long groupId) {
    if (!groups.existsById(groupId)) {
      throw new UsageGroupNotFoundException(groupId);
    }
    UserUsageGroup assignment =
        assignments
            .findById(userId)
            .orElseGet(() -> new UserUsageGroup(userId, groupId, clock.instant()));
    assignment.setGroupId(groupId);
    assignment.setAssignedAt(clock.instant());
    assignments.save(assignment);
    policies.invalidateAll();
    LOGGER.info("Assigned user {} to usage group {}", userId, groupId);
  }

  @Transactional(readOnly = true)
  public List<UsageGroupLimit> limitsOf(Long groupId) {
    if (!groups.existsById(groupId)) {
      throw new UsageGroupNotFoundException(groupId);
    }
    return limits.findByGroupIdOrderByModuleKeyAsc(groupId);
  }

  public Map<UUID, UsageSnapshot> usageForUsers(Collection<UUID> userIds) {
    return ledger.usageForUsers(userIds);
  }

  private static void requireNonNegative(String what, Long value) {
    if (value != null && value < 0) {
      throw new InvalidQuotaConfigurationException(what + " must not be negative: " + value);
    }
  }
}
