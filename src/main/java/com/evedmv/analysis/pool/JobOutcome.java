package com.evedmv.analysis.pool;

/**
 * What a worker observed when running a job: either a value or the exception the work threw.
 *
 * @param value the result, meaningful only when {@code failure} is null
 * @param failure the exception thrown by the work, or null on success
 * @param durationNanos how long the work ran
 */
record JobOutcome(Object value, Exception failure, long durationNanos) {

  static JobOutcome success(Object value, long durationNanos) {
    return new JobOutcome(value, null, durationNanos);
  }

  static JobOutcome failure(Exception failure, long durationNanos) {
    return new JobOutcome(null, failure, durationNanos);
  }

  boolean isSuccess() {
    return failure == null;
  }
}
