package com.scholary.docjobs.usage;

/**
 * The limits that apply to one user in one module.
 *
 * @param tokenBudget rolling-window token budget across all modules, null for unlimited
 * @param unitLimit the module's unit cap, null when the group sets none
 */
public record QuotaPolicy(Long groupId, String groupName, Long tokenBudget, UnitLimit unitLimit) {

  /**
   * @param windowDays length of the unit window, null for lifetime
   */
  public record UnitLimit(long limit, Integer windowDays) {}
}
