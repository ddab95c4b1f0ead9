package com.evedmv.analysis.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Structured logging for worker pool events using MDC (Mapped Diagnostic Context).
 *
 * <p>Each method puts its fields into the MDC for exactly one log call, so they can be queried by
 * {@code event_type} in the log store without leaking into unrelated lines.
 */
public class PoolEventLogger {

  private final Logger logger;

  public PoolEventLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a job handed to a worker. */
  public void logJobStarted(long jobId, String kind, String subjectId, long workerId, long waitMs) {
    try {
      MDC.put("event_type", "job_started");
      putJob(jobId, kind, subjectId);
      MDC.put("worker_id", String.valueOf(workerId));
      MDC.put("queue_wait_ms", String.valueOf(waitMs));

      logger.debug(
          "Starting analysis job {}:{} (id={}) on worker {} after {}ms in queue",
          kind,
          subjectId,
          jobId,
          workerId,
          waitMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a job waiting for a worker. */
  public void logJobQueued(long jobId, String kind, String subjectId, String priority, int depth) {
    try {
      MDC.put("event_type", "job_queued");
      putJob(jobId, kind, subjectId);
      MDC.put("priority", priority);
      MDC.put("queue_length", String.valueOf(depth));

      logger.debug(
          "Queued analysis job {}:{} (id={}, priority={}), queue length {}",
          kind,
          subjectId,
          jobId,
          priority,
          depth);
    } finally {
      clearEventFields();
    }
  }

  /** Log a successful job. */
  public void logJobCompleted(long jobId, String kind, String subjectId, long durationMs) {
    try {
      MDC.put("event_type", "job_completed");
      putJob(jobId, kind, subjectId);
      MDC.put("duration_ms", String.valueOf(durationMs));

      logger.debug("Completed analysis job {}:{} in {}ms", kind, subjectId, durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a job whose work threw. */
  public void logJobFailed(
      long jobId, String kind, String subjectId, long durationMs, Throwable error) {
    try {
      MDC.put("event_type", "job_failed");
      putJob(jobId, kind, subjectId);
      MDC.put("duration_ms", String.valueOf(durationMs));
      MDC.put("error_type", error.getClass().getSimpleName());

      logger.error(
          "Analysis job {}:{} failed after {}ms: {}",
          kind,
          subjectId,
          durationMs,
          describe(error));
    } finally {
      clearEventFields();
    }
  }

  /** Log a job that ran past its deadline. */
  public void logJobTimedOut(long jobId, String kind, String subjectId, long workerId, long ms) {
    try {
      MDC.put("event_type", "job_timeout");
      putJob(jobId, kind, subjectId);
      MDC.put("worker_id", String.valueOf(workerId));
      MDC.put("deadline_ms", String.valueOf(ms));

      logger.warn(
          "Analysis job {}:{} exceeded its {}ms deadline, replacing worker {}",
          kind,
          subjectId,
          ms,
          workerId);
    } finally {
      clearEventFields();
    }
  }

  /** Log a worker that terminated abnormally, with the job it was running if any. */
  public void logWorkerCrashed(long workerId, String jobLabel, Throwable reason) {
    try {
      MDC.put("event_type", "worker_crashed");
      MDC.put("worker_id", String.valueOf(workerId));
      MDC.put("error_type", reason.getClass().getSimpleName());

      if (jobLabel == null) {
        logger.warn("Analysis worker {} died while idle: {}", workerId, describe(reason));
      } else {
        logger.error(
            "Analysis worker {} died, lost job {}: {}", workerId, jobLabel, describe(reason));
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log a job rejected or dropped because the queue is at its limit. */
  public void logQueueFull(long jobId, String kind, String subjectId, boolean dropped, int limit) {
    try {
      MDC.put("event_type", "queue_full");
      putJob(jobId, kind, subjectId);
      MDC.put("queue_limit", String.valueOf(limit));

      if (dropped) {
        logger.warn("Analysis job queue full, dropping async job {}:{}", kind, subjectId);
      } else {
        logger.warn("Analysis job queue full, rejecting job {}:{}", kind, subjectId);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log a change of the pool's target size. */
  public void logScaled(int fromSize, int toSize, String trigger, int queueLength, int idle) {
    try {
      MDC.put("event_type", "pool_scaled");
      MDC.put("from_size", String.valueOf(fromSize));
      MDC.put("to_size", String.valueOf(toSize));
      MDC.put("trigger", trigger);
      MDC.put("queue_length", String.valueOf(queueLength));
      MDC.put("idle", String.valueOf(idle));

      logger.info(
          "Scaled analysis worker pool from {} to {} workers ({}, queue: {}, idle: {})",
          fromSize,
          toSize,
          trigger,
          queueLength,
          idle);
    } finally {
      clearEventFields();
    }
  }

  /** Log a failure to start a worker thread. */
  public void logSpawnFailed(long workerId, String trigger, Throwable error) {
    try {
      MDC.put("event_type", "worker_spawn_failed");
      MDC.put("worker_id", String.valueOf(workerId));
      MDC.put("trigger", trigger);

      logger.error("Failed to start analysis worker {} ({})", workerId, trigger, error);
    } finally {
      clearEventFields();
    }
  }

  /** Log an emergency queue reset. */
  public void logQueueCleared(int dropped) {
    try {
      MDC.put("event_type", "queue_cleared");
      MDC.put("dropped", String.valueOf(dropped));

      logger.warn("Clearing analysis job queue ({} jobs discarded)", dropped);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC for the thread running the job. */
  public static void setJobContext(long jobId, String kind, String subjectId) {
    MDC.put("job_id", String.valueOf(jobId));
    MDC.put("job_kind", kind);
    MDC.put("subject_id", subjectId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("job_id");
    MDC.remove("job_kind");
    MDC.remove("subject_id");
  }

  // The throwable comes from analysis code, so its toString() may itself throw.
  private static String describe(Throwable error) {
    try {
      return String.valueOf(error);
    } catch (RuntimeException e) {
      return error.getClass().getName() + " (message unavailable)";
    }
  }

  private static void putJob(long jobId, String kind, String subjectId) {
    MDC.put("event_job_id", String.valueOf(jobId));
    MDC.put("event_job_kind", kind);
    MDC.put("event_subject_id", subjectId);
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("event_job_id");
    MDC.remove("event_job_kind");
    MDC.remove("event_subject_id");
    MDC.remove("worker_id");
    MDC.remove("queue_wait_ms");
    MDC.remove("priority");
    MDC.remove("queue_length");
    MDC.remove("duration_ms");
    MDC.remove("error_type");
    MDC.remove("deadline_ms");
    MDC.remove("queue_limit");
    MDC.remove("from_size");
    MDC.remove("to_size");
    MDC.remove("trigger");
    MDC.remove("idle");
    MDC.remove("dropped");
  }
}
