package com.scholary.docjobs.usage;

/** Thrown when an admin submits a quota configuration that cannot be applied. */
public class InvalidQuotaConfigurationException extends RuntimeException {

  public InvalidQuotaConfigurationException(String message) {
    super(message);
  }
}
