package com.scholary.docjobs.usage;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * A set of users sharing one quota policy.
 *
 * <p>A null {@code tokenBudget} means the rolling token window is unlimited.
 */
@Entity
@Table(name = "usage_groups")
public class UsageGroup {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "name", nullable = false, unique = true, length = 128)
  private String name;

  @Column(name = "description", length = 500)
  private String description;

  @Column(name = "token_budget")
  private Long tokenBudget;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected UsageGroup() {}

  public UsageGroup(String name, String description, Long tokenBudget, Instant createdAt) {
    this.name = name;
    this.description = description;
    this.tokenBudget = tokenBudget;
    this.createdAt = createdAt;
  }

  public Long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public Long getTokenBudget() {
    return tokenBudget;
  }

  public void setTokenBudget(Long tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
