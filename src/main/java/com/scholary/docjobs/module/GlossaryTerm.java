package com.scholary.docjobs.module;

import jakarta.validation.constraints.NotBlank;

/** An English term and its Chinese rendering. */
public record GlossaryTerm(@NotBlank String source, @NotBlank String target) {}
