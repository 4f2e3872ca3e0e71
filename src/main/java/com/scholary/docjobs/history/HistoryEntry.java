package com.scholary.docjobs.history;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

/**
 * Pointer from a user to a job they started. Holds no status: that is always read from the job.
 */
@Entity
@Table(
    name = "user_job_history",
    uniqueConstraints = @UniqueConstraint(columnNames = {"module_key", "job_key"}))
public class HistoryEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "module_key", nullable = false, updatable = false, length = 64)
  private String moduleKey;

  @Column(name = "job_key", nullable = false, updatable = false, length = 64)
  private String jobKey;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected HistoryEntry() {}

  public HistoryEntry(UUID userId, String moduleKey, String jobKey, Instant createdAt) {
    this.userId = userId;
    this.moduleKey = moduleKey;
    this.jobKey = jobKey;
    this.createdAt = createdAt;
  }

  public Long getId() {
    return id;
  }

  public UUID getUserId() {
    return userId;
  }

  public String getModuleKey() {
    return moduleKey;
  }

  public String getJobKey() {
    return jobKey;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
