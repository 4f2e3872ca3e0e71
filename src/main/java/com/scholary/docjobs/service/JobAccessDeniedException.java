package com.scholary.docjobs.service;

import java.util.UUID;

public class JobAccessDeniedException extends RuntimeException {

  public JobAccessDeniedException(UUID jobId) {
    super("Not allowed to access job: " + jobId);
  }
}
