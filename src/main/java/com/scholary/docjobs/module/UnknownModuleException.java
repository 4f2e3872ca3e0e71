package com.scholary.docjobs.module;

public class UnknownModuleException extends RuntimeException {

  private final String moduleKey;

  public UnknownModuleException(String moduleKey) {
    super("Unknown module: " + moduleKey);
    this.moduleKey = moduleKey;
  }

  public String getModuleKey() {
    return moduleKey;
  }
}
