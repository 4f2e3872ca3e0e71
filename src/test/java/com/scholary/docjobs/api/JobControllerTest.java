package com.scholary.docjobs.api;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.docjobs.job.JobStatus;
import com.scholary.docjobs.service.ArtifactGoneException;
import com.scholary.docjobs.service.JobAccessDeniedException;
import com.scholary.docjobs.service.JobNotFoundException;
import com.scholary.docjobs.service.JobQueryService;
import com.scholary.docjobs.service.JobSubmission;
import com.scholary.docjobs.service.JobSubmissionService;
import com.scholary.docjobs.service.QuotaExceededException;
import com.scholary.docjobs.service.Requester;
import com.scholary.docjobs.service.StoredOutput;
import com.scholary.docjobs.service.ValidationFailedException;
import com.scholary.docjobs.usage.QuotaDecision;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(JobController.class)
class JobControllerTest {

  private static final UUID USER = UUID.fromString("00000000-0000-0000-0000-000000000001");
  private static final String SUMMARY_PAYLOAD =
      "{\"documents\":[{\"filename\":\"a.txt\",\"text\":\"hello\"}]}";

  @Autowired private MockMvc mockMvc;

  @MockBean private JobSubmissionService submissionService;
  @MockBean private JobQueryService queryService;

  @Test
  void submit_shouldAcceptAndPointToStatus() throws Exception {
    UUID jobId = UUID.randomUUID();
    when(submissionService.submit(eq(new Requester(USER, false)), eq("summarizer"), any()))
        .thenReturn(new JobSubmission(jobId, "summarizer", JobStatus.PENDING));

    mockMvc
        .perform(
            post("/api/modules/summarizer/jobs")
                .header("X-User-Id", USER.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(SUMMARY_PAYLOAD))
        .andExpect(status().isAccepted())
        .andExpect(header().string("Location", "/api/jobs/" + jobId))
        .andExpect(jsonPath("$.jobId").value(jobId.toString()))
        .andExpect(jsonPath("$.status").value("PENDING"))
        .andExpect(jsonPath("$.statusUrl").value("/api/jobs/" + jobId));
  }

  @Test
  void submit_shouldRequireCallerIdentity() throws Exception {
    mockMvc
        .perform(
            post("/api/modules/summarizer/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(SUMMARY_PAYLOAD))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("unauthorized"));

    verifyNoInteractions(submissionService);
  }

  @Test
  void submit_shouldReportViolations() throws Exception {
    when(submissionService.submit(any(), any(), any()))
        .thenThrow(
            new ValidationFailedException(
                "Invalid payload", List.of("documents must not be empty")));

    mockMvc
        .perform(
            post("/api/modules/summarizer/jobs")
                .header("X-User-Id", USER.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"documents\":[]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("validation_failed"))
        .andExpect(jsonPath("$.details[0]").value("documents must not be empty"));
  }

  @Test
  void submit_shouldRejectOverQuota() throws Exception {
    when(submissionService.submit(any(), any(), any()))
        .thenThrow(
            new QuotaExceededException(
                QuotaDecision.reject(
                    QuotaDecision.RejectionKind.TOKEN_BUDGET, "Token budget exceeded")));

    mockMvc
        .perform(
            post("/api/modules/summarizer/jobs")
                .header("X-User-Id", USER.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(SUMMARY_PAYLOAD))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.error").value("quota_exceeded"))
        .andExpect(jsonPath("$.message").value("Token budget exceeded"));
  }

  @Test
  void submit_shouldRejectUnknownModule() throws Exception {
    when(submissionService.submit(any(), eq("nope"), any()))
        .thenThrow(new ValidationFailedException("Unknown module: nope"));

    mockMvc
        .perform(
            post("/api/modules/nope/jobs")
                .header("X-User-Id", USER.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Unknown module: nope"));
  }

  @Test
  void getJobStatus_shouldMapAccessErrors() throws Exception {
    UUID foreign = UUID.randomUUID();
    UUID missing = UUID.randomUUID();
    when(queryService.getStatus(new Requester(USER, false), foreign))
        .thenThrow(new JobAccessDeniedException(foreign));
    when(queryService.getStatus(new Requester(USER, false), missing))
        .thenThrow(new JobNotFoundException(missing));

    mockMvc
        .perform(get("/api/jobs/" + foreign).header("X-User-Id", USER.toString()))
        .andExpect(status().isForbidden());
    mockMvc
        .perform(get("/api/jobs/" + missing).header("X-User-Id", USER.toString()))
        .andExpect(status().isNotFound());
    mockMvc
        .perform(get("/api/jobs/not-a-uuid").header("X-User-Id", USER.toString()))
        .andExpect(status().isBadRequest());
  }

  @Test
  void downloadArtifact_shouldStreamWithContentDisposition() throws Exception {
    UUID jobId = UUID.randomUUID();
    when(queryService.openArtifact(new Requester(USER, true), jobId, "combined.md"))
        .thenReturn(
            new StoredOutput(
                "combined.md",
                "text/markdown; charset=utf-8",
                new ByteArrayInputStream("# Hi".getBytes(StandardCharsets.UTF_8))));

    mockMvc
        .perform(
            get("/api/jobs/" + jobId + "/artifacts/combined.md")
                .header("X-User-Id", USER.toString())
                .header("X-User-Admin", "true"))
        .andExpect(status().isOk())
        .andExpect(header().string("Content-Disposition", containsString("combined.md")))
        .andExpect(content().string("# Hi"));
  }

  @Test
  void downloadItemOutput_shouldAnswerGoneAfterPurge() throws Exception {
    UUID jobId = UUID.randomUUID();
    when(queryService.openItemOutput(new Requester(USER, false), jobId, 1, 0))
        .thenThrow(new ArtifactGoneException("Job outputs were purged"));

    mockMvc
        .perform(
            get("/api/jobs/" + jobId + "/items/1/0/output").header("X-User-Id", USER.toString()))
        .andExpect(status().isGone())
        .andExpect(jsonPath("$.error").value("gone"));
  }

  @Test
  void history_shouldPassFilterAndLimit() throws Exception {
    when(queryService.listHistory(new Requester(USER, false), "grader", 5)).thenReturn(List.of());

    mockMvc
        .perform(
            get("/api/history")
                .param("module", "grader")
                .param("limit", "5")
                .header("X-User-Id", USER.toString()))
        .andExpect(status().isOk())
        .andExpect(content().json("[]"));

    verify(queryService).listHistory(new Requester(USER, false), "grader", 5);
  }
}
