package com.scholary.docjobs.artifact;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Maps "artifacts.local.*": the directory outputs are written under. */
@ConfigurationProperties(prefix = "artifacts.local")
@Validated
public record LocalArtifactProperties(@NotBlank String root) {}
