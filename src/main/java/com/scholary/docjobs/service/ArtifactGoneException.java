package com.scholary.docjobs.service;

/** The output existed but was deleted by the retention sweeper. */
public class ArtifactGoneException extends RuntimeException {

  public ArtifactGoneException(String message) {
    super(message);
  }
}
