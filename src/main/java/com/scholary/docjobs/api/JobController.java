package com.scholary.docjobs.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.docjobs.history.HistoryView;
import com.scholary.docjobs.service.JobQueryService;
import com.scholary.docjobs.service.JobStatusView;
import com.scholary.docjobs.service.JobSubmission;
import com.scholary.docjobs.service.JobSubmissionService;
import com.scholary.docjobs.service.ModuleInfo;
import com.scholary.docjobs.service.Requester;
import com.scholary.docjobs.service.StoredOutput;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.InputStreamResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for document jobs.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Submitting a job to a module (returns the job ID immediately)
 *   <li>Job status polling
 *   <li>Downloading aggregate and per-item outputs
 *   <li>Recent job history and the module list
 * </ul>
 *
 * <p>The caller is identified by the {@code X-User-Id} header set by the fronting auth layer.
 */
@RestController
@Tag(name = "Jobs", description = "Document job submission, status and downloads")
public class JobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobController.class);

  static final String USER_HEADER = "X-User-Id";
  static final String ADMIN_HEADER = "X-User-Admin";

  private final JobSubmissionService submissionService;
  private final JobQueryService queryService;

  public JobController(JobSubmissionService submissionService, JobQueryService queryService) {
    this.submissionService = submissionService;
    this.queryService = queryService;
  }

  /** Submit a job; processing continues in the background. */
  @PostMapping("/api/modules/{module}/jobs")
  @Operation(
      summary = "Submit job",
      description = "Validate the payload, check the quota and queue the job for processing")
  public ResponseEntity<SubmitJobResponse> submit(
      @RequestHeader(USER_HEADER) UUID userId,
      @RequestHeader(value = ADMIN_HEADER, defaultValue = "false") boolean admin,
      @PathVariable("module") String module,
      @RequestBody JsonNode payload) {
    LOGGER.info("Job submission: module={}, user={}", module, userId);
    JobSubmission submission =
        submissionService.submit(new Requester(userId, admin), module, payload);
    String statusUrl = "/api/jobs/" + submission.jobId();
    return ResponseEntity.accepted()
        .header(HttpHeaders.LOCATION, statusUrl)
        .body(
            new SubmitJobResponse(
                submission.jobId(), submission.moduleKey(), submission.status(), statusUrl));
  }

  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Status, progress and outputs of a job")
  public JobStatusView getJobStatus(
      @RequestHeader(USER_HEADER) UUID userId,
      @RequestHeader(value = ADMIN_HEADER, defaultValue = "false") boolean admin,
      @PathVariable("id") UUID id) {
    return queryService.getStatus(new Requester(userId, admin), id);
  }

  @GetMapping("/api/jobs/{id}/artifacts/{name}")
  @Operation(summary = "Download artifact", description = "Download an aggregate job output")
  public ResponseEntity<InputStreamResource> downloadArtifact(
      @RequestHeader(USER_HEADER) UUID userId,
      @RequestHeader(value = ADMIN_HEADER, defaultValue = "false") boolean admin,
      @PathVariable("id") UUID id,
      @PathVariable("name") String name) {
    return download(queryService.openArtifact(new Requester(userId, admin), id, name));
  }

  @GetMapping("/api/jobs/{id}/items/{round}/{index}/output")
  @Operation(summary = "Download item output", description = "Download the output of one item")
  public ResponseEntity<InputStreamResource> downloadItemOutput(
      @RequestHeader(USER_HEADER) UUID userId,
      @RequestHeader(value = ADMIN_HEADER, defaultValue = "false") boolean admin,
      @PathVariable("id") UUID id,
      @PathVariable("round") int round,
      @PathVariable("index") int index) {
    return download(queryService.openItemOutput(new Requester(userId, admin), id, round, index));
  }

  @GetMapping("/api/history")
  @Operation(summary = "Recent jobs", description = "The caller's jobs of the last 24 hours")
  public List<HistoryView> history(
      @RequestHeader(USER_HEADER) UUID userId,
      @RequestHeader(value = ADMIN_HEADER, defaultValue = "false") boolean admin,
      @RequestParam(value = "module", required = false) String module,
      @RequestParam(value = "limit", defaultValue = "20") int limit) {
    return queryService.listHistory(new Requester(userId, admin), module, limit);
  }

  @GetMapping("/api/modules")
  @Operation(summary = "List modules", description = "Modules this instance can run")
  public List<ModuleInfo> modules() {
    return queryService.listModules();
  }

  private static ResponseEntity<InputStreamResource> download(StoredOutput output) {
    return ResponseEntity.ok()
        .contentType(MediaType.parseMediaType(output.contentType()))
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment()
                .filename(output.filename(), StandardCharsets.UTF_8)
                .build()
                .toString())
        .body(new InputStreamResource(output.content()));
  }
}
