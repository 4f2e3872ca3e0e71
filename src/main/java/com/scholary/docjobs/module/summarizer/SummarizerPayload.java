package com.scholary.docjobs.module.summarizer;

import com.scholary.docjobs.module.GlossaryTerm;
import com.scholary.docjobs.module.SourceDocument;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * Summarizer submission.
 *
 * @param documentType {@code research} (default) or {@code other}
 * @param translate whether to also translate each summary into Chinese; defaults to true
 */
public record SummarizerPayload(
    @NotEmpty @Size(max = 100) List<@Valid SourceDocument> documents,
    DocumentType documentType,
    Boolean translate,
    List<@Valid GlossaryTerm> glossary) {

  public SummarizerPayload {
    documentType = documentType == null ? DocumentType.RESEARCH : documentType;
    glossary = glossary == null ? List.of() : List.copyOf(glossary);
  }

  public boolean translationEnabled() {
    return translate == null || translate;
  }

  public enum DocumentType {
    RESEARCH,
    OTHER
  }
}
