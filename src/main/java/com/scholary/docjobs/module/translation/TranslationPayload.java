package com.scholary.docjobs.module.translation;

import com.scholary.docjobs.module.GlossaryTerm;
import com.scholary.docjobs.module.SourceDocument;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * Document translation submission. Each line of a document's text is one paragraph.
 *
 * @param glossary terms as {@code source} (English) and {@code target} (Chinese), whatever the
 *     direction
 */
public record TranslationPayload(
    @NotEmpty @Size(max = 20) List<@Valid SourceDocument> documents,
    @NotNull TranslationDirection direction,
    List<@Valid GlossaryTerm> glossary) {

  public TranslationPayload {
    glossary = glossary == null ? List.of() : List.copyOf(glossary);
  }
}
