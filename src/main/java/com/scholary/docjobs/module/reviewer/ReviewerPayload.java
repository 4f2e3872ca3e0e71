package com.scholary.docjobs.module.reviewer;

import com.scholary.docjobs.module.SourceDocument;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record ReviewerPayload(@Valid @NotNull SourceDocument manuscript, ReviewLanguage language) {

  public ReviewerPayload {
    language = language == null ? ReviewLanguage.ENGLISH : language;
  }
}
