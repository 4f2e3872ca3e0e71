package com.scholary.docjobs.api;

import com.scholary.docjobs.module.ModuleConfigService;
import com.scholary.docjobs.module.ModuleSettings;
import com.scholary.docjobs.usage.QuotaAdminService;
import com.scholary.docjobs.usage.QuotaAdminService.ModuleLimitSpec;
import com.scholary.docjobs.usage.UsageGroup;
import com.scholary.docjobs.usage.UsageGroupLimit;
import com.scholary.docjobs.usage.UsageSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Administration of usage groups, quota limits and module configuration.
 *
 * <p>Every endpoint requires the {@code X-User-Admin: true} header.
 */
@RestController
@RequestMapping("/api/admin")
@Tag(name = "Admin", description = "Usage groups, quotas and module configuration")
public class AdminController {

  private static final Logger LOGGER = LoggerFactory.getLogger(AdminController.class);

  private final QuotaAdminService quotaAdminService;
  private final ModuleConfigService moduleConfigService;

  public AdminController(
      QuotaAdminService quotaAdminService, ModuleConfigService moduleConfigService) {
    this.quotaAdminService = quotaAdminService;
    this.moduleConfigService = moduleConfigService;
  }

  @PostMapping("/usage-groups")
  @Operation(summary = "Create usage group")
  public ResponseEntity<UsageGroupResponse> createGroup(
      @RequestHeader(JobController.USER_HEADER) UUID userId,
      @RequestHeader(value = JobController.ADMIN_HEADER, defaultValue = "false") boolean admin,
      @Valid @RequestBody AdminRequests.CreateUsageGroup request) {
    requireAdmin(admin);
    UsageGroup group =
        quotaAdminService.createGroup(
            request.name(), request.description(), request.tokenBudget());
    LOGGER.info(
        "Usage group created by {}: id={}, name={}", userId, group.getId(), group.getName());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(UsageGroupResponse.from(group, List.of()));
  }

  @PutMapping("/usage-groups/{id}/token-budget")
  @Operation(summary = "Set token budget", description = "A null budget removes the limit")
  public UsageGroupResponse setTokenBudget(
      @RequestHeader(JobController.USER_HEADER) UUID userId,
      @RequestHeader(value = JobController.ADMIN_HEADER, defaultValue = "false") boolean admin,
      @PathVariable("id") Long id,
      @Valid @RequestBody AdminRequests.TokenBudget request) {
    requireAdmin(admin);
    UsageGroup group = quotaAdminService.setTokenBudget(id, request.tokenBudget());
    return UsageGroupResponse.from(group, quotaAdminService.limitsOf(id));
  }

  @PutMapping("/usage-groups/{id}/limits")
  @Operation(
      summary = "Replace module limits",
      description = "Replaces all per-module unit limits of the group at once")
  public List<UsageGroupResponse.LimitResponse> replaceLimits(
      @RequestHeader(JobController.USER_HEADER) UUID userId,
      @RequestHeader(value = JobController.ADMIN_HEADER, defaultValue = "false") boolean admin,
      @PathVariable("id") Long id,
      @Valid @RequestBody AdminRequests.ReplaceLimits request) {
    requireAdmin(admin);
    List<ModuleLimitSpec> specs =
        request.limits().stream()
            .map(l -> new ModuleLimitSpec(l.moduleKey(), l.unitLimit(), l.unitWindowDays()))
            .toList();
    List<UsageGroupLimit> limits = quotaAdminService.replaceLimits(id, specs);
    return limits.stream()
        .map(
            l ->
                new UsageGroupResponse.LimitResponse(
                    l.getModuleKey(), l.getUnitLimit(), l.getUnitWindowDays()))
        .toList();
  }

  @PutMapping("/users/{userId}/usage-group")
  @Operation(summary = "Assign usage group", description = "Moves a user into a usage group")
  public ResponseEntity<Void> assignUsageGroup(
      @RequestHeader(JobController.USER_HEADER) UUID callerId,
      @RequestHeader(value = JobController.ADMIN_HEADER, defaultValue = "false") boolean admin,
      @PathVariable("userId") UUID userId,
      @Valid @RequestBody AdminRequests.AssignUsageGroup request) {
    requireAdmin(admin);
    quotaAdminService.assignUser(userId, request.groupId());
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/usage")
  @Operation(summary = "Usage snapshots", description = "Token and unit usage per user and module")
  public Map<UUID, UsageSnapshot> usage(
      @RequestHeader(JobController.USER_HEADER) UUID callerId,
      @RequestHeader(value = JobController.ADMIN_HEADER, defaultValue = "false") boolean admin,
      @RequestParam("userIds") List<UUID> userIds) {
    requireAdmin(admin);
    return quotaAdminService.usageForUsers(userIds);
  }

  @PutMapping("/modules/{module}/config")
  @Operation(
      summary = "Update module configuration",
      description = "Replaces the model and prompt overrides of a module")
  public ModuleSettings updateModuleConfig(
      @RequestHeader(JobController.USER_HEADER) UUID callerId,
      @RequestHeader(value = JobController.ADMIN_HEADER, defaultValue = "false") boolean admin,
      @PathVariable("module") String module,
      @RequestBody AdminRequests.ModuleConfigUpdate request) {
    requireAdmin(admin);
    return moduleConfigService.updateOverrides(module, request.models(), request.prompts());
  }

  private static void requireAdmin(boolean admin) {
    if (!admin) {
      throw new AdminAccessDeniedException();
    }
  }
}
