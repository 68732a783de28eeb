package com.scholary.video.composer.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method logs one lifecycle event and exposes its fields as MDC entries so log search can
 * filter on them.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log scene submitted to the prediction service. */
  public void logSceneDispatched(
      String jobId, int sceneOrder, int sceneCount, String predictionId) {
    try {
      MDC.put("event_type", "scene_dispatched");
      MDC.put("sceneOrder", String.valueOf(sceneOrder));
      MDC.put("sceneCount", String.valueOf(sceneCount));
      MDC.put("predictionId", predictionId);

      logger.info(
          "Scene dispatched: jobId={}, scene={}/{}, predictionId={}",
          jobId,
          sceneOrder + 1,
          sceneCount,
          predictionId);
    } finally {
      clearEventFields();
    }
  }

  /** Log scene media received. */
  public void logSceneCompleted(
      String jobId, int sceneOrder, int sceneCount, String predictionId, String source) {
    try {
      MDC.put("event_type", "scene_completed");
      MDC.put("sceneOrder", String.valueOf(sceneOrder));
      MDC.put("sceneCount", String.valueOf(sceneCount));
      MDC.put("predictionId", predictionId);
      MDC.put("source", source);

      logger.info(
          "Scene completed: jobId={}, scene={}/{}, predictionId={}, via={}",
          jobId,
          sceneOrder + 1,
          sceneCount,
          predictionId,
          source);
    } finally {
      clearEventFields();
    }
  }

  /** Log an event that lost the race for a job transition. */
  public void logTransitionSkipped(
      String jobId, String predictionId, String event, String source) {
    try {
      MDC.put("event_type", "transition_skipped");
      MDC.put("predictionId", predictionId);
      MDC.put("transition", event);
      MDC.put("source", source);

      logger.debug(
          "Transition skipped: jobId={}, event={}, predictionId={}, via={}",
          jobId,
          event,
          predictionId,
          source);
    } finally {
      clearEventFields();
    }
  }

  /** Log retry scheduled event. */
  public void logRetry(
      String operation,
      int attempt,
      int maxRetries,
      long delayMs,
      String errorType,
      String message) {
    try {
      MDC.put("event_type", "retry_scheduled");
      MDC.put("operation", operation);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxRetries", String.valueOf(maxRetries));
      MDC.put("delayMs", String.valueOf(delayMs));
      MDC.put("errorType", errorType);

      logger.warn(
          "Retrying {}: attempt={}/{}, delay={}ms, error={}, message={}",
          operation,
          attempt,
          maxRetries,
          delayMs,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log job reaching a terminal state. */
  public void logJobFinished(String jobId, String status, String failureKind, String message) {
    try {
      MDC.put("event_type", "job_finished");
      MDC.put("status", status);
      if (failureKind != null) {
        MDC.put("failureKind", failureKind);
      }

      if (failureKind == null) {
        logger.info("Job finished: jobId={}, status={}", jobId, status);
      } else {
        logger.warn(
            "Job finished: jobId={}, status={}, failureKind={}, error={}",
            jobId,
            status,
            failureKind,
            message);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(String jobId, String stage, int percentComplete, String message) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("stage", stage);
      MDC.put("percentComplete", String.valueOf(percentComplete));

      logger.debug(
          "Job progress: jobId={}, stage={}, progress={}%, {}",
          jobId,
          stage,
          percentComplete,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId) {
    MDC.put("jobId", jobId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
  }

  /** Clear event-specific fields from MDC. Leaves any job context set by the caller in place. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("sceneOrder");
    MDC.remove("sceneCount");
    MDC.remove("predictionId");
    MDC.remove("source");
    MDC.remove("transition");
    MDC.remove("operation");
    MDC.remove("attempt");
    MDC.remove("maxRetries");
    MDC.remove("delayMs");
    MDC.remove("errorType");
    MDC.remove("status");
    MDC.remove("failureKind");
    MDC.remove("stage");
    MDC.remove("percentComplete");
  }
}
