package com.scholary.docshare.preview.logging;

import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each preview job lifecycle event is logged with an {@code event_type} and its job fields in
 * the MDC so the events can be filtered and aggregated downstream.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a newly admitted job whose wake-up hint was accepted. */
  public void logJobEnqueued(UUID jobId, UUID fileId) {
    try {
      MDC.put("event_type", "preview_job_enqueued");
      putJob(jobId, fileId);

      logger.info("Preview job enqueued: jobId={}, fileId={}", jobId, fileId);
    } finally {
      clearEventFields();
    }
  }

  /**
   * Log a dropped wake-up hint.
   *
   * @param eventType one of {@code preview_queue_full}, {@code preview_queue_full_on_retry}, {@code
   *     preview_queue_full_on_recovery}
   */
  public void logQueueFull(String eventType, UUID jobId, UUID fileId) {
    try {
      MDC.put("event_type", eventType);
      putJob(jobId, fileId);

      logger.warn(
          "Preview queue full, hint dropped ({}): jobId={}, fileId={}", eventType, jobId, fileId);
    } finally {
      clearEventFields();
    }
  }

  /** Log a successful conversion. */
  public void logJobCompleted(UUID jobId, UUID fileId, int attempts, long convertMs) {
    try {
      MDC.put("event_type", "preview_job_completed");
      putJob(jobId, fileId);
      MDC.put("attempts", String.valueOf(attempts));
      MDC.put("convertMs", String.valueOf(convertMs));

      logger.info(
          "Preview job completed: jobId={}, fileId={}, failedAttempts={}, convert={}ms",
          jobId,
          fileId,
          attempts,
          convertMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a failed attempt that will be retried. */
  public void logRetryScheduled(
      UUID jobId, UUID fileId, int attempts, int maxAttempts, Instant nextRetryAt, String error) {
    try {
      MDC.put("event_type", "preview_job_retry_scheduled");
      putJob(jobId, fileId);
      MDC.put("attempts", String.valueOf(attempts));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("nextRetryAt", String.valueOf(nextRetryAt));

      logger.warn(
          "Preview job retry scheduled: jobId={}, fileId={}, attempt={}/{}, nextRetryAt={}, error={}",
          jobId,
          fileId,
          attempts,
          maxAttempts,
          nextRetryAt,
          error);
    } finally {
      clearEventFields();
    }
  }

  /** Log a failed attempt that exhausted the attempt ceiling. */
  public void logFinalFailure(UUID jobId, UUID fileId, int attempts, String error) {
    try {
      MDC.put("event_type", "preview_job_final_failure");
      putJob(jobId, fileId);
      MDC.put("attempts", String.valueOf(attempts));

      logger.error(
          "Preview job failed permanently: jobId={}, fileId={}, attempts={}, error={}",
          jobId,
          fileId,
          attempts,
          error);
    } finally {
      clearEventFields();
    }
  }

  /** Log a processing job reset by the stale-job sweep. */
  public void logStaleRecovered(UUID jobId, UUID fileId, Instant lastUpdatedAt) {
    try {
      MDC.put("event_type", "preview_job_stale_recovered");
      putJob(jobId, fileId);
      MDC.put("lastUpdatedAt", String.valueOf(lastUpdatedAt));

      logger.info(
          "Stale preview job reset to pending: jobId={}, fileId={}, lastUpdatedAt={}",
          jobId,
          fileId,
          lastUpdatedAt);
    } finally {
      clearEventFields();
    }
  }

  /** Log a conversion outcome thrown away because the row changed underneath the worker. */
  public void logOutcomeDiscarded(UUID jobId, UUID fileId, String outcome, String currentStatus) {
    try {
      MDC.put("event_type", "preview_job_outcome_discarded");
      putJob(jobId, fileId);

      logger.warn(
          "Discarding {} outcome, job changed while converting: jobId={}, fileId={}, status={}",
          outcome,
          jobId,
          fileId,
          currentStatus);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(UUID jobId, UUID fileId) {
    MDC.put("jobId", String.valueOf(jobId));
    MDC.put("fileId", String.valueOf(fileId));
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("fileId");
  }

  private static void putJob(UUID jobId, UUID fileId) {
    MDC.put("job_id", String.valueOf(jobId));
    MDC.put("file_id", String.valueOf(fileId));
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("job_id");
    MDC.remove("file_id");
    MDC.remove("attempts");
    MDC.remove("maxAttempts");
    MDC.remove("nextRetryAt");
    MDC.remove("convertMs");
    MDC.remove("lastUpdatedAt");
  }
}
