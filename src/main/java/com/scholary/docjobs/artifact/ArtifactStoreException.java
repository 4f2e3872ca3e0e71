package com.scholary.docjobs.artifact;

/**
 * Exception thrown when storing, reading or deleting job outputs fails.
 *
 * <p>Fatal to a running job; the retention sweeper logs it and retries on its next run.
 */
public class ArtifactStoreException extends RuntimeException {

  public ArtifactStoreException(String message) {
    super(message);
  }

  public ArtifactStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
