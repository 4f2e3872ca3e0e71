package com.scholary.docjobs.usage;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * Per-module unit cap of a usage group.
 *
 * <p>{@code unitWindowDays == null} counts units over the user's whole lifetime.
 */
@Entity
@Table(
    name = "usage_group_limits",
    uniqueConstraints = @UniqueConstraint(columnNames = {"group_id", "module_key"}))
public class UsageGroupLimit {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "group_id", nullable = false)
  private Long groupId;

  @Column(name = "module_key", nullable = false, length = 64)
  private String moduleKey;

  @Column(name = "unit_limit", nullable = false)
  private long unitLimit;

  @Column(name = "unit_window_days")
  private Integer unitWindowDays;

  protected UsageGroupLimit() {}

  public UsageGroupLimit(Long groupId, String moduleKey, long unitLimit, Integer unitWindowDays) {
    this.groupId = groupId;
    this.moduleKey = moduleKey;
    this.unitLimit = unitLimit;
    this.unitWindowDays = unitWindowDays;
  }

  public Long getId() {
    return id;
  }

  public Long getGroupId() {
    return groupId;
  }

  public String getModuleKey() {
    return moduleKey;
  }

  public long getUnitLimit() {
    return unitLimit;
  }

  public Integer getUnitWindowDays() {
    return unitWindowDays;
  }
}
