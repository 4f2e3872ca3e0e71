package com.scholary.docjobs.usage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.docjobs.config.TestJobsProperties;
import com.scholary.docjobs.job.SuccessThreshold;
import com.scholary.docjobs.module.ModuleDefinition;
import com.scholary.docjobs.module.ModulePolicy;
import com.scholary.docjobs.module.ModuleProcessor;
import com.scholary.docjobs.module.ModuleRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QuotaServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final UUID USER = UUID.randomUUID();

  @Mock private QuotaPolicyService policies;
  @Mock private UsageLedger ledger;
  @Mock private ModuleRegistry modules;

  private QuotaService service;

  @BeforeEach
  void setUp() {
    service =
        new QuotaService(
            policies,
            ledger,
            modules,
            Clock.fixed(NOW, ZoneOffset.UTC),
            TestJobsProperties.defaults());

    ModulePolicy policy =
        new ModulePolicy(3, 2, Duration.ZERO, Duration.ZERO, SuccessThreshold.all(), null, 100);
    when(modules.require("summarizer"))
        .thenReturn(new ModuleDefinition(mock(ModuleProcessor.class), policy));
  }

  @Test
  void checkQuota_shouldRejectUsersWithoutGroup() {
    when(policies.policyFor(USER, "summarizer")).thenReturn(Optional.empty());

    QuotaDecision decision = service.checkQuota(USER, "summarizer", 1);

    assertThat(decision.admitted()).isFalse();
    assertThat(decision.kind()).isEqualTo(QuotaDecision.RejectionKind.NO_USAGE_GROUP);
    verify(ledger, never()).tokensSince(any(), any());
  }

  @Test
  void checkQuota_shouldReadTokensOverRollingWindow() {
    when(policies.policyFor(USER, "summarizer"))
        .thenReturn(Optional.of(new QuotaPolicy(1L, "standard", 1000L, null)));
    when(ledger.tokensSince(USER, NOW.minus(Duration.ofDays(7)))).thenReturn(950L);

    QuotaDecision decision = service.checkQuota(USER, "summarizer", 1);

    assertThat(decision.admitted()).isFalse();
    assertThat(decision.kind()).isEqualTo(QuotaDecision.RejectionKind.TOKEN_BUDGET);
  }

  @Test
  void checkQuota_shouldUseLifetimeUnitsWhenLimitHasNoWindow() {
    when(policies.policyFor(USER, "summarizer"))
        .thenReturn(
            Optional.of(new QuotaPolicy(1L, "trial", null, new QuotaPolicy.UnitLimit(5, null))));
    when(ledger.unitsSince(USER, "summarizer", null)).thenReturn(2L);

    QuotaDecision decision = service.checkQuota(USER, "summarizer", 3);

    assertThat(decision.admitted()).isTrue();
    verify(ledger, never()).tokensSince(any(), any());
  }

  @Test
  void checkQuota_shouldBoundUnitsByLimitWindow() {
    when(policies.policyFor(USER, "summarizer"))
        .thenReturn(
            Optional.of(new QuotaPolicy(1L, "trial", null, new QuotaPolicy.UnitLimit(5, 7))));
    when(ledger.unitsSince(USER, "summarizer", NOW.minus(Duration.ofDays(7)))).thenReturn(5L);

    QuotaDecision decision = service.checkQuota(USER, "summarizer", 1);

    assertThat(decision.kind()).isEqualTo(QuotaDecision.RejectionKind.UNIT_LIMIT);
  }
}
