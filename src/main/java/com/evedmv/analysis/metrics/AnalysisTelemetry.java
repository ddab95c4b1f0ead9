package com.evedmv.analysis.metrics;

import java.time.Duration;
import java.util.Map;

/**
 * Sink for job timing events emitted by the worker pool.
 *
 * <p>The pool does not depend on delivery. Implementations may drop events.
 */
public interface AnalysisTelemetry {

  String JOB_COMPLETED = "job_completed";
  String JOB_FAILED = "job_failed";

  /**
   * Record one event.
   *
   * @param eventName e.g. {@link #JOB_COMPLETED}
   * @param duration how long the job ran
   * @param tags grouping tags such as kind and priority
   */
  void record(String eventName, Duration duration, Map<String, String> tags);
}
