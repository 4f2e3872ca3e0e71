package com.scholary.docjobs.usage;

/**
 * Pure admit/reject decision from a policy and current consumption.
 *
 * <p>Token usage is fungible across modules; unit usage is capped per module.
 */
public final class QuotaChecker {

  private QuotaChecker() {}

  /**
   * @param tokensInWindow tokens the user consumed across all modules in the rolling window
   * @param unitsInWindow units the user consumed in this module within the unit limit's window
   * @param projectedUnits units the submission is expected to consume
   * @param estimatedTokensPerUnit the module's token estimate for one unit
   */
  public static QuotaDecision check(
      QuotaPolicy policy,
      long tokensInWindow,
      long unitsInWindow,
      long projectedUnits,
      long estimatedTokensPerUnit) {
    long units = Math.max(0, projectedUnits);
    long projectedTokens = saturatedMultiply(units, Math.max(0, estimatedTokensPerUnit));

    Long budget = policy.tokenBudget();
    if (budget != null && saturatedAdd(tokensInWindow, projectedTokens) > budget) {
      return QuotaDecision.reject(
          QuotaDecision.RejectionKind.TOKEN_BUDGET,
          String.format(
              "Token budget exceeded: used %d of %d tokens, this job needs about %d more",
              tokensInWindow, budget, projectedTokens));
    }

    QuotaPolicy.UnitLimit limit = policy.unitLimit();
    if (limit != null && saturatedAdd(unitsInWindow, units) > limit.limit()) {
      String window =
          limit.windowDays() == null ? "in total" : "in the last " + limit.windowDays() + " days";
      return QuotaDecision.reject(
          QuotaDecision.RejectionKind.UNIT_LIMIT,
          String.format(
              "Usage limit reached: %d of %d units used %s, this job needs %d",
              unitsInWindow, limit.limit(), window, units));
    }

    return QuotaDecision.admit();
  }

  private static long saturatedAdd(long a, long b) {
    try {
      return Math.addExact(a, b);
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }

  private static long saturatedMultiply(long a, long b) {
    try {
      return Math.multiplyExact(a, b);
    } catch (ArithmeticException e) {
      return Long.MAX_VALUE;
    }
  }
}
