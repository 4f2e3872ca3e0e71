package com.scholary.docjobs.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.docjobs.artifact.ReportWriter;
import com.scholary.docjobs.job.Job;
import com.scholary.docjobs.job.JobStatus;
import com.scholary.docjobs.job.JobStore;
import com.scholary.docjobs.module.ModuleRegistry;
import com.scholary.docjobs.module.summarizer.SummarizerProcessor;
import com.scholary.docjobs.usage.QuotaDecision;
import com.scholary.docjobs.worker.JobDispatcher;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;

@ExtendWith(MockitoExtension.class)
class JobSubmissionServiceTest {

  private static final Requester REQUESTER = new Requester(UUID.randomUUID(), false);

  @Mock private JobAdmissionService admissionService;
  @Mock private JobDispatcher dispatcher;
  @Mock private JobStore jobStore;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private JobSubmissionService service;

  @BeforeEach
  void setUp() {
    SummarizerProcessor summarizer = new SummarizerProcessor(new ReportWriter(objectMapper));
    ModuleRegistry registry = new ModuleRegistry(List.of(summarizer), Map.of());
    Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
    service =
        new JobSubmissionService(
            registry, objectMapper, validator, admissionService, dispatcher, jobStore);
  }

  private JsonNode twoDocuments() throws Exception {
    return objectMapper.readTree(
        "{\"documents\":["
            + "{\"filename\":\"a.pdf\",\"text\":\"alpha\"},"
            + "{\"filename\":\"b.pdf\",\"text\":\"beta\"}],"
            + "\"translate\":false}");
  }

  private Job pendingJob() {
    return new Job(UUID.randomUUID(), REQUESTER.userId(), "summarizer", "{}", Instant.now());
  }

  @Test
  void submit_shouldAdmitAndDispatchValidPayload() throws Exception {
    Job job = pendingJob();
    when(admissionService.admit(eq(REQUESTER.userId()), eq("summarizer"), eq(2L), anyString()))
        .thenReturn(job);

    JobSubmission submission = service.submit(REQUESTER, "summarizer", twoDocuments());

    assertThat(submission.jobId()).isEqualTo(job.getId());
    assertThat(submission.status()).isEqualTo(JobStatus.PENDING);
    verify(dispatcher).dispatch(job.getId());
  }

  @Test
  void submit_shouldRejectUnknownModule() throws Exception {
    assertThatThrownBy(() -> service.submit(REQUESTER, "nonexistent", twoDocuments()))
        .isInstanceOf(ValidationFailedException.class)
        .hasMessageContaining("Unknown module");

    verifyNoInteractions(admissionService, dispatcher);
  }

  @Test
  void submit_shouldRejectPayloadFailingBeanValidation() throws Exception {
    JsonNode empty = objectMapper.readTree("{\"documents\":[]}");

    assertThatThrownBy(() -> service.submit(REQUESTER, "summarizer", empty))
        .isInstanceOf(ValidationFailedException.class)
        .satisfies(
            e ->
                assertThat(((ValidationFailedException) e).getViolations())
                    .anyMatch(v -> v.startsWith("documents")));

    verifyNoInteractions(admissionService, dispatcher);
  }

  @Test
  void submit_shouldRejectNonObjectPayload() throws Exception {
    assertThatThrownBy(
            () -> service.submit(REQUESTER, "summarizer", objectMapper.readTree("[1,2]")))
        .isInstanceOf(ValidationFailedException.class);
  }

  @Test
  void submit_shouldRejectMalformedPayload() throws Exception {
    JsonNode wrongType = objectMapper.readTree("{\"documents\":\"not a list\"}");

    assertThatThrownBy(() -> service.submit(REQUESTER, "summarizer", wrongType))
        .isInstanceOf(ValidationFailedException.class)
        .hasMessageStartingWith("Malformed payload");
  }

  @Test
  void submit_shouldNotDispatchWhenOverQuota() throws Exception {
    when(admissionService.admit(any(), anyString(), anyLong(), anyString()))
        .thenThrow(
            new QuotaExceededException(
                QuotaDecision.reject(QuotaDecision.RejectionKind.TOKEN_BUDGET, "over budget")));

    assertThatThrownBy(() -> service.submit(REQUESTER, "summarizer", twoDocuments()))
        .isInstanceOf(QuotaExceededException.class);

    verify(dispatcher, never()).dispatch(any());
  }

  @Test
  void submit_shouldFailJobWhenExecutorRejectsIt() throws Exception {
    Job job = pendingJob();
    when(admissionService.admit(any(), anyString(), anyLong(), anyString())).thenReturn(job);
    doThrow(new TaskRejectedException("queue full")).when(dispatcher).dispatch(job.getId());

    service.submit(REQUESTER, "summarizer", twoDocuments());

    verify(jobStore).fail(eq(job.getId()), anyString());
  }
}
