package com.scholary.docjobs.service;

/** A submission was refused before any job was created. Never retried. */
public abstract class AdmissionException extends RuntimeException {

  protected AdmissionException(String message) {
    super(message);
  }
}
