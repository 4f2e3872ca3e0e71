package com.scholary.docjobs.artifact;

import java.io.InputStream;
import java.util.UUID;

/**
 * Where job outputs live.
 *
 * <p>Locations returned by {@link #write} are opaque strings stored on job items and artifacts;
 * only the store that produced them can open them. Everything a job writes is grouped under the
 * job id so the retention sweeper can drop it in one call.
 */
public interface ArtifactStore {

  /**
   * Store one output of a job.
   *
   * @return the location to persist and later pass to {@link #open}
   * @throws ArtifactStoreException if the write fails
   */
  String write(UUID jobId, String name, byte[] content, String contentType);

  /**
   * Open a stored output. The caller closes the stream.
   *
   * @throws ArtifactStoreException if the output is missing or cannot be read
   */
  InputStream open(String location);

  /**
   * Delete every output of a job. Deleting a job with no outputs is not an error.
   *
   * @throws ArtifactStoreException if anything could not be deleted
   */
  void deleteJob(UUID jobId);
}
