package com.scholary.docjobs.usage;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Assignment of a user to exactly one usage group. */
@Entity
@Table(name = "user_usage_groups")
public class UserUsageGroup {

  @Id
  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "group_id", nullable = false)
  private Long groupId;

  @Column(name = "assigned_at", nullable = false)
  private Instant assignedAt;

  protected UserUsageGroup() {}

  public UserUsageGroup(UUID userId, Long groupId, Instant assignedAt) {
    this.userId = userId;
    this.groupId = groupId;
    this.assignedAt = assignedAt;
  }

  public UUID getUserId() {
    return userId;
  }

  public Long getGroupId() {
    return groupId;
  }

  public void setGroupId(Long groupId) {
    this.groupId = groupId;
  }

  public Instant getAssignedAt() {
    return assignedAt;
  }

  public void setAssignedAt(Instant assignedAt) {
    this.assignedAt = assignedAt;
  }
}
