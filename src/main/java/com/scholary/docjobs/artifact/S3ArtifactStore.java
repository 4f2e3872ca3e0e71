package com.scholary.docjobs.artifact;

import java.io.InputStream;
import java.net.URI;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * S3/MinIO implementation of ArtifactStore.
 *
 * <p>Uses AWS SDK v2, which works with both real S3 and S3-compatible services like MinIO. The SDK
 * retries transient failures itself; 404 and 403 fail fast.
 */
public class S3ArtifactStore implements ArtifactStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ArtifactStore.class);

  private final S3Client s3Client;
  private final String bucket;
  private final String prefix;

  public S3ArtifactStore(S3ArtifactProperties properties) {
    this(buildClient(properties), properties.bucket(), properties.normalizedPrefix());
  }

  S3ArtifactStore(S3Client s3Client, String bucket, String prefix) {
    this.s3Client = s3Client;
    this.bucket = bucket;
    this.prefix = prefix;
  }

  private static S3Client buildClient(S3ArtifactProperties properties) {
    LOGGER.info(
        "Initializing S3 artifact store: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    AwsBasicCredentials credentials =
        AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());

    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;

    return S3Client.builder()
        .region(region)
        .credentialsProvider(StaticCredentialsProvider.create(credentials))
        .endpointOverride(URI.create(properties.endpoint()))
        .forcePathStyle(properties.pathStyleAccess()) // Required for MinIO
        .build();
  }

  @Override
  public String write(UUID jobId, String name, byte[] content, String contentType) {
    String key = prefix + ArtifactKeys.key(jobId, name);
    LOGGER.debug("Uploading artifact: bucket={}, key={}, bytes={}", bucket, key, content.length);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .contentLength((long) content.length)
              .build();
      s3Client.putObject(request, RequestBody.fromBytes(content));
      return key;

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to upload artifact: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ArtifactStoreException(message, e);

    } catch (Exception e) {
      String message =
          String.format("Unexpected error uploading artifact: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message, e);
      throw new ArtifactStoreException(message, e);
    }
  }

  @Override
  public InputStream open(String location) {
    try {
      GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(location).build();
      return s3Client.getObject(request);

    } catch (NoSuchKeyException e) {
      String message = String.format("Artifact not found: bucket=%s, key=%s", bucket, location);
      LOGGER.error(message);
      throw new ArtifactStoreException(message, e);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to retrieve artifact: bucket=%s, key=%s, statusCode=%s",
              bucket, location, e.statusCode());
      LOGGER.error(message, e);
      throw new ArtifactStoreException(message, e);

    } catch (Exception e) {
      String message =
          String.format(
              "Unexpected error retrieving artifact: bucket=%s, key=%s", bucket, location);
      LOGGER.error(message, e);
      throw new ArtifactStoreException(message, e);
    }
  }

  @Override
  public void deleteJob(UUID jobId) {
    String jobPrefix = prefix + ArtifactKeys.jobPrefix(jobId);
    int deleted = 0;

    try {
      ListObjectsV2Request list =
          ListObjectsV2Request.builder().bucket(bucket).prefix(jobPrefix).build();
      for (S3Object object : s3Client.listObjectsV2Paginator(list).contents()) {
        s3Client.deleteObject(
            DeleteObjectRequest.builder().bucket(bucket).key(object.key()).build());
        deleted++;
      }
      LOGGER.debug("Deleted {} artifacts under {}", deleted, jobPrefix);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to delete artifacts: bucket=%s, prefix=%s, deleted=%d, statusCode=%s",
              bucket, jobPrefix, deleted, e.statusCode());
      LOGGER.error(message, e);
      throw new ArtifactStoreException(message, e);

    } catch (Exception e) {
      String message =
          String.format(
              "Unexpected error deleting artifacts: bucket=%s, prefix=%s, deleted=%d",
              bucket, jobPrefix, deleted);
      LOGGER.error(message, e);
      throw new ArtifactStoreException(message, e);
    }
  }

  /** Release connections when the application shuts down. */
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }
}
