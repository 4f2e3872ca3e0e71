package com.scholary.docjobs.module.reviewer;

public enum ReviewLanguage {
  ENGLISH,
  CHINESE;

  /** Prompt name for this language: {@code base} for English, {@code base_zh} for Chinese. */
  String promptName(String base) {
    return this == CHINESE ? base + "_zh" : base;
  }
}
