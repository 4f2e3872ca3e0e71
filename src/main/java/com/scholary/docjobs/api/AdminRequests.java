package com.scholary.docjobs.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;

/** Request bodies of the admin API. */
public final class AdminRequests {

  private AdminRequests() {}

  /**
   * @param tokenBudget rolling-window token budget shared by all modules; null for none
   */
  public record CreateUsageGroup(
      @NotBlank @Size(max = 100) String name,
      @Size(max = 500) String description,
      @PositiveOrZero Long tokenBudget) {}

  public record TokenBudget(@PositiveOrZero Long tokenBudget) {}

  /**
   * @param unitLimit null removes the limit for the module
   * @param unitWindowDays null counts lifetime usage
   */
  public record ModuleLimit(
      @NotBlank String moduleKey,
      @PositiveOrZero Long unitLimit,
      @Positive Integer unitWindowDays) {}

  public record ReplaceLimits(@NotNull List<@Valid ModuleLimit> limits) {}

  public record AssignUsageGroup(@NotNull Long groupId) {}

  /** Model and prompt overrides; a null map clears that part of the stored overrides. */
  public record ModuleConfigUpdate(Map<String, String> models, Map<String, String> prompts) {}
}
