package com.scholary.docjobs.module.translation;

public enum TranslationDirection {
  EN_TO_CN,
  CN_TO_EN
}
