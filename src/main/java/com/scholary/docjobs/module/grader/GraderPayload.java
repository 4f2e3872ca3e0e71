package com.scholary.docjobs.module.grader;

import com.scholary.docjobs.module.SourceDocument;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record GraderPayload(@Valid @NotNull SourceDocument manuscript) {}
