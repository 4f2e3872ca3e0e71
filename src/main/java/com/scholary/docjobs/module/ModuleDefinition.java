package com.scholary.docjobs.module;

/** A registered processor together with its effective policy. */
public record ModuleDefinition(ModuleProcessor<?> processor, ModulePolicy policy) {

  public String key() {
    return processor.key();
  }
}
