package com.scholary.docjobs.module;

/** Thrown by a processor when a payload passes bean validation but breaks a module rule. */
public class InvalidPayloadException extends RuntimeException {

  public InvalidPayloadException(String message) {
    super(message);
  }
}
