package com.scholary.docjobs.usage;

/** Thrown by admin operations that reference a usage group that does not exist. */
public class UsageGroupNotFoundException extends RuntimeException {

  public UsageGroupNotFoundException(Long groupId) {
    super("Usage group not found: " + groupId);
  }
}
