package com.scholary.docjobs.module.extract;

import com.scholary.docjobs.module.SourceDocument;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * Structured extraction submission.
 *
 * @param guidance free-form output requirements added to every request
 */
public record ExtractionPayload(
    @NotEmpty @Size(max = ExtractionProcessor.MAX_DOCUMENTS) List<@Valid SourceDocument> documents,
    @NotEmpty List<@Valid ExtractionField> fields,
    @Size(max = 4000) String guidance) {}
