package com.scholary.docjobs.module;

/** An aggregate output produced by a processor once a job succeeds. */
public record ArtifactContent(String name, String contentType, byte[] bytes) {}
