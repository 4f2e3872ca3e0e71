package com.scholary.docjobs.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.docjobs.job.Job;
import com.scholary.docjobs.job.JobStore;
import com.scholary.docjobs.module.InvalidPayloadException;
import com.scholary.docjobs.module.ModuleDefinition;
import com.scholary.docjobs.module.ModuleProcessor;
import com.scholary.docjobs.module.ModuleRegistry;
import com.scholary.docjobs.worker.JobDispatcher;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Entry point for new jobs.
 *
 * <p>Validation runs first and creates nothing. Admission (quota, job row, history) commits
 * before the job is handed to the executor, so the worker always finds its row.
 */
@Service
public class JobSubmissionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobSubmissionService.class);

  private final ModuleRegistry registry;
  private final ObjectMapper objectMapper;
  private final Validator validator;
  private final JobAdmissionService admissionService;
  private final JobDispatcher dispatcher;
  private final JobStore jobStore;

  public JobSubmissionService(
      ModuleRegistry registry,
      ObjectMapper objectMapper,
      Validator validator,
      JobAdmissionService admissionService,
      JobDispatcher dispatcher,
      JobStore jobStore) {
    this.registry = registry;
    this.objectMapper = objectMapper;
    this.validator = validator;
    this.admissionService = admissionService;
    this.dispatcher = dispatcher;
    this.jobStore = jobStore;
  }

  /**
   * Submit a job.
   *
   * @throws ValidationFailedException for an unknown module or an invalid payload
   * @throws QuotaExceededException if the submission is over quota
   */
  public JobSubmission submit(Requester requester, String moduleKey, JsonNode payload) {
    Optional<ModuleDefinition> module = registry.find(moduleKey);
    if (module.isEmpty()) {
      throw new ValidationFailedException("Unknown module: " + moduleKey);
    }
    return submit(requester, module.get().processor(), payload);
  }

  private <P> JobSubmission submit(
      Requester requester, ModuleProcessor<P> processor, JsonNode payload) {
    P decoded = decode(processor, payload);

    Job job =
        admissionService.admit(
            requester.userId(),
            processor.key(),
            processor.projectedUnits(decoded),
            canonicalJson(decoded));
    LOGGER.info(
        "Accepted job: jobId={}, module={}, user={}",
        job.getId(),
        processor.key(),
        requester.userId());

    dispatch(job.getId());
    return new JobSubmission(job.getId(), processor.key(), job.getStatus());
  }

  private <P> P decode(ModuleProcessor<P> processor, JsonNode payload) {
    if (payload == null || payload.isNull() || !payload.isObject()) {
      throw new ValidationFailedException("Payload must be a JSON object");
    }
    P decoded;
    try {
      decoded = objectMapper.treeToValue(payload, processor.payloadType());
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new ValidationFailedException("Malformed payload: " + e.getMessage());
    }

    Set<ConstraintViolation<P>> violations = validator.validate(decoded);
    if (!violations.isEmpty()) {
      List<String> messages =
          violations.stream()
              .map(v -> v.getPropertyPath() + " " + v.getMessage())
              .sorted()
              .toList();
      throw new ValidationFailedException("Invalid payload", messages);
    }

    try {
      processor.validate(decoded);
    } catch (InvalidPayloadException e) {
      throw new ValidationFailedException(e.getMessage());
    }
    return decoded;
  }

  private String canonicalJson(Object payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize payload", e);
    }
  }

  private void dispatch(UUID jobId) {
    try {
      dispatcher.dispatch(jobId);
    } catch (TaskRejectedException e) {
      LOGGER.warn("Job executor saturated, failing job: jobId={}", jobId);
      jobStore.fail(jobId, "The server is busy; please submit the job again later");
    }
  }
}
