package com.scholary.docjobs.job;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

/**
 * One independently processable unit of a job: a document, a chunk, a review slot.
 *
 * <p>Addressed by {@code (jobId, round, itemIndex)}.
 */
@Entity
@Table(
    name = "job_items",
    uniqueConstraints = @UniqueConstraint(columnNames = {"job_id", "round", "item_index"}))
public class JobItem {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "job_id", nullable = false)
  private UUID jobId;

  @Column(name = "round", nullable = false)
  private int round;

  @Column(name = "item_index", nullable = false)
  private int itemIndex;

  @Column(name = "label", length = 255)
  private String label;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 16)
  private JobItemStatus status;

  @Column(name = "attempt_count", nullable = false)
  private int attemptCount;

  @Column(name = "units", nullable = false)
  private long units;

  @Column(name = "tokens_used", nullable = false)
  private long tokensUsed;

  @Column(name = "output_text", columnDefinition = "text")
  private String outputText;

  @Column(name = "output_path", length = 1024)
  private String outputPath;

  @Column(name = "error_message", length = 2000)
  private String errorMessage;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected JobItem() {}

  public JobItem(UUID jobId, int round, int itemIndex, String label, Instant createdAt) {
    this.jobId = jobId;
    this.round = round;
    this.itemIndex = itemIndex;
    this.label = label;
    this.status = JobItemStatus.PENDING;
    this.updatedAt = createdAt;
  }

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public UUID getJobId() {
    return jobId;
  }

  public int getRound() {
    return round;
  }

  public int getItemIndex() {
    return itemIndex;
  }

  public String getLabel() {
    return label;
  }

  public JobItemStatus getStatus() {
    return status;
  }

  public void setStatus(JobItemStatus status) {
    this.status = status;
  }

  public int getAttemptCount() {
    return attemptCount;
  }

  public void setAttemptCount(int attemptCount) {
    this.attemptCount = attemptCount;
  }

  public long getUnits() {
    return units;
  }

  public void setUnits(long units) {
    this.units = units;
  }

  public long getTokensUsed() {
    return tokensUsed;
  }

  public void setTokensUsed(long tokensUsed) {
    this.tokensUsed = tokensUsed;
  }

  public String getOutputText() {
    return outputText;
  }

  public void setOutputText(String outputText) {
    this.outputText = outputText;
  }

  public String getOutputPath() {
    return outputPath;
  }

  public void setOutputPath(String outputPath) {
    this.outputPath = outputPath;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public void setErrorMessage(String errorMessage) {
    this.errorMessage = errorMessage;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }
}
