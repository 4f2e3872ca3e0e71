package com.scholary.docjobs.logging;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Job context ({@code jobId}, {@code module}, {@code userId}) stays on the thread for the whole
 * job; event fields are set for a single line and removed afterwards. With the JSON log profile
 * every MDC entry becomes a queryable field.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log item started event. */
  public void logItemStarted(int round, int itemIndex, String label) {
    try {
      MDC.put("event_type", "item_started");
      MDC.put("round", String.valueOf(round));
      MDC.put("item_index", String.valueOf(itemIndex));

      logger.debug("Item started: round={}, index={}, label={}", round, itemIndex, label);
    } finally {
      clearEventFields();
    }
  }

  /** Log item retry event. */
  public void logItemRetry(
      int round, int itemIndex, int attempt, int maxAttempts, String errorType, String message) {
    try {
      MDC.put("event_type", "item_retry");
      MDC.put("round", String.valueOf(round));
      MDC.put("item_index", String.valueOf(itemIndex));
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("errorType", errorType);

      logger.warn(
          "Item retry: round={}, index={}, attempt={}/{}, error={}, message={}",
          round,
          itemIndex,
          attempt,
          maxAttempts,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log item failure event. */
  public void logItemFailed(int round, int itemIndex, int attempts, String message) {
    try {
      MDC.put("event_type", "item_failed");
      MDC.put("round", String.valueOf(round));
      MDC.put("item_index", String.valueOf(itemIndex));
      MDC.put("attempt", String.valueOf(attempts));

      logger.error(
          "Item failed: round={}, index={}, attempts={}, message={}",
          round,
          itemIndex,
          attempts,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log item completed event. */
  public void logItemCompleted(
      int round, int itemIndex, int attempts, long tokensUsed, long elapsedMs) {
    try {
      MDC.put("event_type", "item_completed");
      MDC.put("round", String.valueOf(round));
      MDC.put("item_index", String.valueOf(itemIndex));
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("tokensUsed", String.valueOf(tokensUsed));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.debug(
          "Item completed: round={}, index={}, attempts={}, tokens={}, elapsed={}ms",
          round,
          itemIndex,
          attempts,
          tokensUsed,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(int round, int itemsDone, int totalItems, String phase) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("round", String.valueOf(round));
      MDC.put("itemsDone", String.valueOf(itemsDone));
      MDC.put("totalItems", String.valueOf(totalItems));
      MDC.put("phase", phase);

      logger.info(
          "Job progress: phase={}, round={}, items={}/{}", phase, round, itemsDone, totalItems);
    } finally {
      clearEventFields();
    }
  }

  /** Log job finished event. */
  public void logJobFinished(String status, String summary, long elapsedMs) {
    try {
      MDC.put("event_type", "job_finished");
      MDC.put("status", status);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info("Job finished: status={}, elapsed={}ms, summary={}", status, elapsedMs, summary);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(UUID jobId, String moduleKey, String userId) {
    MDC.put("jobId", String.valueOf(jobId));
    MDC.put("module", moduleKey);
    MDC.put("userId", userId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("module");
    MDC.remove("userId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("round");
    MDC.remove("item_index");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("errorType");
    MDC.remove("tokensUsed");
    MDC.remove("elapsedMs");
    MDC.remove("itemsDone");
    MDC.remove("totalItems");
    MDC.remove("phase");
    MDC.remove("status");
  }
}
