package com.scholary.docjobs.service;

import java.util.List;

/** The payload or the module named in a submission is not acceptable. */
public class ValidationFailedException extends AdmissionException {

  private final List<String> violations;

  public ValidationFailedException(String message) {
    this(message, List.of());
  }

  public ValidationFailedException(String message, List<String> violations) {
    super(message);
    this.violations = List.copyOf(violations);
  }

  public List<String> getViolations() {
    return violations;
  }
}
