package com.scholary.docjobs.api;

import com.scholary.docjobs.artifact.ArtifactStoreException;
import com.scholary.docjobs.module.UnknownModuleException;
import com.scholary.docjobs.service.ArtifactGoneException;
import com.scholary.docjobs.service.ArtifactNotFoundException;
import com.scholary.docjobs.service.JobAccessDeniedException;
import com.scholary.docjobs.service.JobNotFoundException;
import com.scholary.docjobs.service.QuotaExceededException;
import com.scholary.docjobs.service.ValidationFailedException;
import com.scholary.docjobs.usage.InvalidQuotaConfigurationException;
import com.scholary.docjobs.usage.UsageGroupNotFoundException;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Maps exceptions to HTTP answers with an {@link ErrorResponse} body. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ValidationFailedException.class)
  public ResponseEntity<ErrorResponse> validationFailed(ValidationFailedException e) {
    return respond(HttpStatus.BAD_REQUEST, "validation_failed", e.getMessage(), e.getViolations());
  }

  @ExceptionHandler(QuotaExceededException.class)
  public ResponseEntity<ErrorResponse> quotaExceeded(QuotaExceededException e) {
    return respond(HttpStatus.FORBIDDEN, "quota_exceeded", e.getMessage(), List.of());
  }

  @ExceptionHandler({JobAccessDeniedException.class, AdminAccessDeniedException.class})
  public ResponseEntity<ErrorResponse> forbidden(RuntimeException e) {
    return respond(HttpStatus.FORBIDDEN, "forbidden", e.getMessage(), List.of());
  }

  @ExceptionHandler({
    JobNotFoundException.class,
    ArtifactNotFoundException.class,
    UsageGroupNotFoundException.class,
    UnknownModuleException.class
  })
  public ResponseEntity<ErrorResponse> notFound(RuntimeException e) {
    return respond(HttpStatus.NOT_FOUND, "not_found", e.getMessage(), List.of());
  }

  @ExceptionHandler(ArtifactGoneException.class)
  public ResponseEntity<ErrorResponse> gone(ArtifactGoneException e) {
    return respond(HttpStatus.GONE, "gone", e.getMessage(), List.of());
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ErrorResponse> missingHeader(MissingRequestHeaderException e) {
    if (JobController.USER_HEADER.equalsIgnoreCase(e.getHeaderName())) {
      return respond(
          HttpStatus.UNAUTHORIZED, "unauthorized", "Missing caller identity", List.of());
    }
    return respond(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage(), List.of());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> invalidBody(MethodArgumentNotValidException e) {
    List<String> details =
        e.getBindingResult().getFieldErrors().stream()
            .map(f -> f.getField() + " " + f.getDefaultMessage())
            .sorted()
            .toList();
    return respond(HttpStatus.BAD_REQUEST, "validation_failed", "Invalid request", details);
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class,
    InvalidQuotaConfigurationException.class
  })
  public ResponseEntity<ErrorResponse> badRequest(Exception e) {
    return respond(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage(), List.of());
  }

  @ExceptionHandler(ArtifactStoreException.class)
  public ResponseEntity<ErrorResponse> storageFailure(ArtifactStoreException e) {
    LOGGER.error("Artifact storage failure", e);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR, "storage_error", "Could not read job output", List.of());
  }

  private static ResponseEntity<ErrorResponse> respond(
      HttpStatus status, String error, String message, List<String> details) {
    return ResponseEntity.status(status)
        .body(new ErrorResponse(error, message, Instant.now(), details));
  }
}
