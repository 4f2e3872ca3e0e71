package com.scholary.docjobs.usage;

/** Outcome of a quota check. */
public record QuotaDecision(boolean admitted, RejectionKind kind, String reason) {

  public enum RejectionKind {
    TOKEN_BUDGET,
    UNIT_LIMIT,
    NO_USAGE_GROUP
  }

  private static final QuotaDecision ADMIT = new QuotaDecision(true, null, null);

  public static QuotaDecision admit() {
    return ADMIT;
  }

  public static QuotaDecision reject(RejectionKind kind, String reason) {
    return new QuotaDecision(false, kind, reason);
  }
}
