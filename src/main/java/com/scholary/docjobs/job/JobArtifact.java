package com.scholary.docjobs.job;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.util.UUID;

/** An aggregate output of a job, e.g. a combined summary or a spreadsheet. */
@Entity
@Table(
    name = "job_artifacts",
    uniqueConstraints = @UniqueConstraint(columnNames = {"job_id", "name"}))
public class JobArtifact {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "job_id", nullable = false)
  private UUID jobId;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "content_type", nullable = false, length = 128)
  private String contentType;

  @Column(name = "path", length = 1024)
  private String path;

  protected JobArtifact() {}

  public JobArtifact(UUID jobId, String name, String contentType, String path) {
    this.jobId = jobId;
    this.name = name;
    this.contentType = contentType;
    this.path = path;
  }

  public Long getId() {
    return id;
  }

  public UUID getJobId() {
    return jobId;
  }

  public String getName() {
    return name;
  }

  public String getContentType() {
    return contentType;
  }

  public String getPath() {
    return path;
  }

  public void setPath(String path) {
    this.path = path;
  }
}
