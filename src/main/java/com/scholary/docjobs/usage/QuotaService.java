package com.scholary.docjobs.usage;

import com.scholary.docjobs.config.JobsProperties;
import com.scholary.docjobs.module.ModuleDefinition;
import com.scholary.docjobs.module.ModuleRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Admission-time quota check.
 *
 * <p>A point-in-time check without reservation: two concurrent submissions can both pass and
 * together overshoot the budget slightly.
 */
@Service
public class QuotaService {

  private static final Logger LOGGER = LoggerFactory.getLogger(QuotaService.class);

  private final QuotaPolicyService policies;
  private final UsageLedger ledger;
  private final ModuleRegistry modules;
  private final Clock clock;
  private final Duration tokenWindow;

  public QuotaService(
      QuotaPolicyService policies,
      UsageLedger ledger,
      ModuleRegistry modules,
      Clock clock,
      JobsProperties properties) {
    this.policies = policies;
    this.ledger = ledger;
    this.modules = modules;
    this.clock = clock;
    this.tokenWindow = properties.quota().tokenWindow();
  }

  public QuotaDecision checkQuota(UUID userId, String moduleKey, long projectedUnits) {
    ModuleDefinition module = modules.require(moduleKey);

    Optional<QuotaPolicy> found = policies.policyFor(userId, moduleKey);
    if (found.isEmpty()) {
      LOGGER.info("Rejecting submission: user={} has no usage group", userId);
      return QuotaDecision.reject(
          QuotaDecision.RejectionKind.NO_USAGE_GROUP,
          "No usage group assigned to this account; contact an administrator");
    }
    QuotaPolicy policy = found.get();

    Instant now = clock.instant();
    long tokens = 0;
    if (policy.tokenBudget() != null) {
      tokens = ledger.tokensSince(userId, now.minus(tokenWindow));
    }

    long units = 0;
    QuotaPolicy.UnitLimit limit = policy.unitLimit();
    if (limit != null) {
      Instant since =
          limit.windowDays() == null ? null : now.minus(Duration.ofDays(limit.windowDays()));
      units = ledger.unitsSince(userId, moduleKey, since);
    }

    QuotaDecision decision =
        QuotaChecker.check(
            policy, tokens, units, projectedUnits, module.policy().estimatedTokensPerUnit());

    if (!decision.admitted()) {
      LOGGER.info(
          "Rejecting submission: user={}, module={}, kind={}, reason={}",
          userId,
          moduleKey,
          decision.kind(),
          decision.reason());
    }
    return decision;
  }
}
