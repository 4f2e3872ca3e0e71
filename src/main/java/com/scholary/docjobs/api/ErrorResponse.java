package com.scholary.docjobs.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;

/** Body of every error answer; {@code details} lists individual violations when there are any. */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
    String error, String message, Instant timestamp, List<String> details) {}
