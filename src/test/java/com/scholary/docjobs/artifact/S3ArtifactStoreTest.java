package com.scholary.docjobs.artifact;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.pagination.sync.SdkIterable;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.paginators.ListObjectsV2Iterable;

class S3ArtifactStoreTest {

  private S3Client s3Client;
  private S3ArtifactStore store;

  @BeforeEach
  void setUp() {
    s3Client = mock(S3Client.class);
    store = new S3ArtifactStore(s3Client, "jobs-bucket", "docjobs/");
  }

  @Test
  void write_shouldPutUnderPrefixedJobKey() {
    UUID jobId = UUID.randomUUID();

    String location = store.write(jobId, "report.csv", new byte[] {1, 2, 3}, "text/csv");

    ArgumentCaptor<PutObjectRequest> captor = ArgumentCaptor.forClass(PutObjectRequest.class);
    verify(s3Client).putObject(captor.capture(), any(RequestBody.class));
    assertThat(location).isEqualTo("docjobs/" + jobId + "/report.csv");
    assertThat(captor.getValue().bucket()).isEqualTo("jobs-bucket");
    assertThat(captor.getValue().key()).isEqualTo(location);
    assertThat(captor.getValue().contentLength()).isEqualTo(3L);
  }

  @Test
  void write_shouldWrapS3Failures() {
    when(s3Client.putObject(any(PutObjectRequest.class), any(RequestBody.class)))
        .thenThrow(S3Exception.builder().statusCode(500).message("internal").build());

    assertThatThrownBy(() -> store.write(UUID.randomUUID(), "a.txt", new byte[0], "text/plain"))
        .isInstanceOf(ArtifactStoreException.class)
        .hasMessageContaining("statusCode=500");
  }

  @Test
  void open_shouldReportMissingObjects() {
    when(s3Client.getObject(any(GetObjectRequest.class)))
        .thenThrow(NoSuchKeyException.builder().message("no such key").build());

    assertThatThrownBy(() -> store.open("docjobs/x/a.txt"))
        .isInstanceOf(ArtifactStoreException.class)
        .hasMessageContaining("Artifact not found");
  }

  @Test
  void deleteJob_shouldDeleteEveryObjectUnderJobPrefix() {
    UUID jobId = UUID.randomUUID();
    String jobPrefix = "docjobs/" + jobId + "/";
    List<S3Object> objects =
        List.of(
            S3Object.builder().key(jobPrefix + "a.txt").build(),
            S3Object.builder().key(jobPrefix + "b.txt").build());
    SdkIterable<S3Object> contents = objects::iterator;
    ListObjectsV2Iterable pages = mock(ListObjectsV2Iterable.class);
    when(pages.contents()).thenReturn(contents);
    when(s3Client.listObjectsV2Paginator(any(ListObjectsV2Request.class))).thenReturn(pages);

    store.deleteJob(jobId);

    ArgumentCaptor<ListObjectsV2Request> list = ArgumentCaptor.forClass(ListObjectsV2Request.class);
    verify(s3Client).listObjectsV2Paginator(list.capture());
    assertThat(list.getValue().prefix()).isEqualTo(jobPrefix);
    ArgumentCaptor<DeleteObjectRequest> deletes =
        ArgumentCaptor.forClass(DeleteObjectRequest.class);
    verify(s3Client, times(2)).deleteObject(deletes.capture());
    assertThat(deletes.getAllValues())
        .extracting(DeleteObjectRequest::key)
        .containsExactly(jobPrefix + "a.txt", jobPrefix + "b.txt");
  }

  @Test
  void deleteJob_shouldWrapTransportFailures() {
    when(s3Client.listObjectsV2Paginator(any(ListObjectsV2Request.class)))
        .thenThrow(SdkClientException.create("Unable to execute HTTP request: Connection refused"));

    assertThatThrownBy(() -> store.deleteJob(UUID.randomUUID()))
        .isInstanceOf(ArtifactStoreException.class)
        .hasMessageContaining("Unexpected error deleting artifacts")
        .hasCauseInstanceOf(SdkClientException.class);
  }

  @Test
  void open_shouldWrapTransportFailures() {
    when(s3Client.getObject(any(GetObjectRequest.class)))
        .thenThrow(SdkClientException.create("Read timed out"));

    assertThatThrownBy(() -> store.open("docjobs/x/a.txt"))
        .isInstanceOf(ArtifactStoreException.class)
        .hasCauseInstanceOf(SdkClientException.class);
  }

  @Test
  void properties_shouldNormalizeKeyPrefix() {
    assertThat(props("jobs").normalizedPrefix()).isEqualTo("jobs/");
    assertThat(props("jobs/").normalizedPrefix()).isEqualTo("jobs/");
    assertThat(props(" ").normalizedPrefix()).isEmpty();
    assertThat(props(null).normalizedPrefix()).isEmpty();
  }

  private static S3ArtifactProperties props(String keyPrefix) {
    return new S3ArtifactProperties(
        "http://localhost:9000", "admin", "admin123", "bucket", "us-east-1", true, keyPrefix);
  }
}
