package com.evedmv.analysis.pool;

/**
 * Base class for failures raised by the pool itself rather than by the analysis being run.
 *
 * <p>None of these are retried by the pool. A caller that wants a retry submits a fresh job.
 */
public abstract class AnalysisPoolException extends RuntimeException {

  protected AnalysisPoolException(String message) {
    super(message);
  }

  protected AnalysisPoolException(String message, Throwable cause) {
    super(message, cause);
  }
}
