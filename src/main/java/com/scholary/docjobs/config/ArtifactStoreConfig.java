package com.scholary.docjobs.config;

import com.scholary.docjobs.artifact.ArtifactStore;
import com.scholary.docjobs.artifact.LocalArtifactProperties;
import com.scholary.docjobs.artifact.LocalArtifactStore;
import com.scholary.docjobs.artifact.S3ArtifactProperties;
import com.scholary.docjobs.artifact.S3ArtifactStore;
import java.nio.file.Paths;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for artifact storage.
 *
 * <p>{@code artifacts.backend} selects the local filesystem (default) or S3-compatible object
 * storage. Only the selected backend's properties are bound.
 */
@Configuration
public class ArtifactStoreConfig {

  @Configuration
  @ConditionalOnProperty(name = "artifacts.backend", havingValue = "local", matchIfMissing = true)
  @EnableConfigurationProperties(LocalArtifactProperties.class)
  static class LocalBackend {

    @Bean
    public ArtifactStore artifactStore(LocalArtifactProperties properties) {
      return new LocalArtifactStore(Paths.get(properties.root()));
    }
  }

  @Configuration
  @ConditionalOnProperty(name = "artifacts.backend", havingValue = "s3")
  @EnableConfigurationProperties(S3ArtifactProperties.class)
  static class S3Backend {

    @Bean(destroyMethod = "close")
    public S3ArtifactStore artifactStore(S3ArtifactProperties properties) {
      return new S3ArtifactStore(properties);
    }
  }
}
