package com.scholary.docjobs.artifact;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Stores outputs as files under a root directory, one sub-directory per job. */
public class LocalArtifactStore implements ArtifactStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalArtifactStore.class);

  private final Path root;

  public LocalArtifactStore(Path root) {
    this.root = root.toAbsolutePath().normalize();
    try {
      Files.createDirectories(this.root);
    } catch (IOException e) {
      throw new ArtifactStoreException("Failed to create artifact directory: " + this.root, e);
    }
    LOGGER.info("Local artifact store at {}", this.root);
  }

  @Override
  public String write(UUID jobId, String name, byte[] content, String contentType) {
    String key = ArtifactKeys.key(jobId, name);
    Path target = resolve(key);
    try {
      Files.createDirectories(target.getParent());
      Files.write(target, content);
      LOGGER.debug("Wrote artifact: key={}, bytes={}", key, content.length);
      return key;
    } catch (IOException e) {
      throw new ArtifactStoreException("Failed to write artifact: " + key, e);
    }
  }

  @Override
  public InputStream open(String location) {
    Path path = resolve(location);
    try {
      return Files.newInputStream(path);
    } catch (NoSuchFileException e) {
      throw new ArtifactStoreException("Artifact not found: " + location, e);
    } catch (IOException e) {
      throw new ArtifactStoreException("Failed to read artifact: " + location, e);
    }
  }

  @Override
  public void deleteJob(UUID jobId) {
    Path dir = resolve(ArtifactKeys.jobPrefix(jobId));
    if (!Files.exists(dir)) {
      return;
    }
    List<Path> paths;
    try (Stream<Path> walk = Files.walk(dir)) {
      paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
    } catch (IOException e) {
      throw new ArtifactStoreException("Failed to list artifacts of job " + jobId, e);
    }
    for (Path path : paths) {
      try {
        Files.deleteIfExists(path);
      } catch (IOException e) {
        throw new ArtifactStoreException("Failed to delete " + path, e);
      }
    }
    LOGGER.debug("Deleted {} artifact paths of job {}", paths.size(), jobId);
  }

  private Path resolve(String location) {
    Path path;
    try {
      path = root.resolve(location).normalize();
    } catch (InvalidPathException e) {
      throw new ArtifactStoreException("Invalid artifact location: " + location, e);
    }
    if (!path.startsWith(root)) {
      throw new ArtifactStoreException("Artifact location escapes the store: " + location);
    }
    return path;
  }
}
