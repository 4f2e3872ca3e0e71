package com.scholary.docjobs.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.docjobs.module.ModuleConfigService;
import com.scholary.docjobs.module.ModuleSettings;
import com.scholary.docjobs.usage.InvalidQuotaConfigurationException;
import com.scholary.docjobs.usage.QuotaAdminService;
import com.scholary.docjobs.usage.UsageGroup;
import com.scholary.docjobs.usage.UsageGroupNotFoundException;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AdminController.class)
class AdminControllerTest {

  private static final String ADMIN = UUID.randomUUID().toString();

  @Autowired private MockMvc mockMvc;

  @MockBean private QuotaAdminService quotaAdminService;
  @MockBean private ModuleConfigService moduleConfigService;

  @Test
  void createGroup_shouldRequireAdmin() throws Exception {
    mockMvc
        .perform(
            post("/api/admin/usage-groups")
                .header("X-User-Id", ADMIN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"staff\",\"tokenBudget\":1000}"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.error").value("forbidden"));

    verifyNoInteractions(quotaAdminService);
  }

  @Test
  void createGroup_shouldReturnCreatedGroup() throws Exception {
    when(quotaAdminService.createGroup("staff", null, 1000L))
        .thenReturn(new UsageGroup("staff", null, 1000L, Instant.parse("2026-01-01T00:00:00Z")));

    mockMvc
        .perform(
            post("/api/admin/usage-groups")
                .header("X-User-Id", ADMIN)
                .header("X-User-Admin", "true")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"staff\",\"tokenBudget\":1000}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.name").value("staff"))
        .andExpect(jsonPath("$.tokenBudget").value(1000));
  }

  @Test
  void createGroup_shouldValidateBody() throws Exception {
    mockMvc
        .perform(
            post("/api/admin/usage-groups")
                .header("X-User-Id", ADMIN)
                .header("X-User-Admin", "true")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"\",\"tokenBudget\":-1}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("validation_failed"))
        .andExpect(jsonPath("$.details.length()").value(2));
  }

  @Test
  void setTokenBudget_shouldReportUnknownGroup() throws Exception {
    when(quotaAdminService.setTokenBudget(eq(42L), any()))
        .thenThrow(new UsageGroupNotFoundException(42L));

    mockMvc
        .perform(
            put("/api/admin/usage-groups/42/token-budget")
                .header("X-User-Id", ADMIN)
                .header("X-User-Admin", "true")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tokenBudget\":null}"))
        .andExpect(status().isNotFound());
  }

  @Test
  void replaceLimits_shouldRejectInvalidConfiguration() throws Exception {
    when(quotaAdminService.replaceLimits(anyLong(), any()))
        .thenThrow(new InvalidQuotaConfigurationException("Duplicate module: grader"));

    mockMvc
        .perform(
            put("/api/admin/usage-groups/1/limits")
                .header("X-User-Id", ADMIN)
                .header("X-User-Admin", "true")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"limits\":[{\"moduleKey\":\"grader\",\"unitLimit\":5},"
                        + "{\"moduleKey\":\"grader\",\"unitLimit\":6}]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Duplicate module: grader"));
  }

  @Test
  void assignUsageGroup_shouldReturnNoContent() throws Exception {
    UUID user = UUID.randomUUID();

    mockMvc
        .perform(
            put("/api/admin/users/" + user + "/usage-group")
                .header("X-User-Id", ADMIN)
                .header("X-User-Admin", "true")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"groupId\":7}"))
        .andExpect(status().isNoContent());

    verify(quotaAdminService).assignUser(user, 7L);
  }

  @Test
  void updateModuleConfig_shouldReturnMergedSettings() throws Exception {
    when(moduleConfigService.updateOverrides(
            "summarizer", Map.of("summary", "openrouter/anthropic/claude"), null))
        .thenReturn(
            new ModuleSettings(
                Map.of("summary", "openrouter/anthropic/claude"), Map.of("summary", "Summarize")));

    mockMvc
        .perform(
            put("/api/admin/modules/summarizer/config")
                .header("X-User-Id", ADMIN)
                .header("X-User-Admin", "true")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"models\":{\"summary\":\"openrouter/anthropic/claude\"}}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.models.summary").value("openrouter/anthropic/claude"));
  }
}
