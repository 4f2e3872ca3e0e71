package com.scholary.docjobs.usage;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Immutable consumption fact. Rows are only ever inserted. */
@Entity
@Table(name = "usage_events")
public class UsageEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "user_id", nullable = false, updatable = false)
  private UUID userId;

  @Column(name = "module_key", nullable = false, updatable = false, length = 64)
  private String moduleKey;

  @Column(name = "tokens", nullable = false, updatable = false)
  private long tokens;

  @Column(name = "units", nullable = false, updatable = false)
  private long units;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  protected UsageEvent() {}

  public UsageEvent(UUID userId, String moduleKey, long tokens, long units, Instant occurredAt) {
    this.userId = userId;
    this.moduleKey = moduleKey;
    this.tokens = tokens;
    this.units = units;
    this.occurredAt = occurredAt;
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

  public long getTokens() {
    return tokens;
  }

  public long getUnits() {
    return units;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }
}
