package com.scholary.docjobs.api;

public class AdminAccessDeniedException extends RuntimeException {

  public AdminAccessDeniedException() {
    super("Administrator access required");
  }
}
