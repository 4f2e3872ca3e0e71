package com.scholary.docjobs.service;

import com.scholary.docjobs.usage.QuotaDecision;

public class QuotaExceededException extends AdmissionException {

  private final QuotaDecision.RejectionKind kind;

  public QuotaExceededException(QuotaDecision decision) {
    super(decision.reason());
    this.kind = decision.kind();
  }

  public QuotaDecision.RejectionKind getKind() {
    return kind;
  }
}
