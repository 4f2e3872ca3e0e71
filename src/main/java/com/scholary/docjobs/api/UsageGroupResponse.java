package com.scholary.docjobs.api;

import com.scholary.docjobs.usage.UsageGroup;
import com.scholary.docjobs.usage.UsageGroupLimit;
import java.time.Instant;
import java.util.List;

public record UsageGroupResponse(
    Long id,
    String name,
    String description,
    Long tokenBudget,
    Instant createdAt,
    List<LimitResponse> limits) {

  public record LimitResponse(String moduleKey, long unitLimit, Integer unitWindowDays) {}

  static UsageGroupResponse from(UsageGroup group, List<UsageGroupLimit> limits) {
    return new UsageGroupResponse(
        group.getId(),
        group.getName(),
        group.getDescription(),
        group.getTokenBudget(),
        group.getCreatedAt(),
        limits.stream()
            .map(
                l -> new LimitResponse(l.getModuleKey(), l.getUnitLimit(), l.getUnitWindowDays()))
            .toList());
  }
}
