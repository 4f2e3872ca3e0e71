package com.scholary.docjobs.job;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * One user submission to a module.
 *
 * <p>Rows are created {@link JobStatus#PENDING} at admission and never deleted. After the retention
 * window the sweeper sets {@code filesPurgedAt}; from then on every output path is invalid.
 */
@Entity
@Table(name = "jobs")
public class Job {

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "module_key", nullable = false, length = 64)
  private String moduleKey;

  @Column(name = "payload_json", columnDefinition = "text")
  private String payloadJson;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 16)
  private JobStatus status;

  @Column(name = "status_detail", length = 500)
  private String statusDetail;

  @Column(name = "error_message", length = 2000)
  private String errorMessage;

  @Column(name = "usage_delta", nullable = false)
  private long usageDelta;

  @Column(name = "tokens_used", nullable = false)
  private long tokensUsed;

  @Column(name = "files_purged_at")
  private Instant filesPurgedAt;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Job() {}

  public Job(UUID id, UUID userId, String moduleKey, String payloadJson, Instant createdAt) {
    this.id = id;
    this.userId = userId;
    this.moduleKey = moduleKey;
    this.payloadJson = payloadJson;
    this.status = JobStatus.PENDING;
    this.statusDetail = "Queued";
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  public UUID getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public String getModuleKey() {
    return moduleKey;
  }

  public String getPayloadJson() {
    return payloadJson;
  }

  public void setPayloadJson(String payloadJson) {
    this.payloadJson = payloadJson;
  }

  public JobStatus getStatus() {
    return status;
  }

  public void setStatus(JobStatus status) {
    this.status = status;
  }

  public String getStatusDetail() {
    return statusDetail;
  }

  public void setStatusDetail(String statusDetail) {
    this.statusDetail = statusDetail;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public void setErrorMessage(String errorMessage) {
    this.errorMessage = errorMessage;
  }

  public long getUsageDelta() {
    return usageDelta;
  }

  public void setUsageDelta(long usageDelta) {
    this.usageDelta = usageDelta;
  }

  public long getTokensUsed() {
    return tokensUsed;
  }

  public void setTokensUsed(long tokensUsed) {
    this.tokensUsed = tokensUsed;
  }

  public Instant getFilesPurgedAt() {
    return filesPurgedAt;
  }

  public void setFilesPurgedAt(Instant filesPurgedAt) {
    this.filesPurgedAt = filesPurgedAt;
  }

  public boolean isPurged() {
    return filesPurgedAt != null;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }
}
