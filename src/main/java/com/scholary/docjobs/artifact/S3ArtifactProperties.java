package com.scholary.docjobs.artifact;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the S3 artifact backend.
 *
 * <p>These map to the "artifacts.s3.*" keys in application.yml and are only bound when {@code
 * artifacts.backend=s3}.
 */
@ConfigurationProperties(prefix = "artifacts.s3")
@Validated
public record S3ArtifactProperties(
    @NotBlank String endpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess,
    String keyPrefix) {

  public String normalizedPrefix() {
    if (keyPrefix == null || keyPrefix.isBlank()) {
      return "";
    }
    return keyPrefix.endsWith("/") ? keyPrefix : keyPrefix + "/";
  }
}
