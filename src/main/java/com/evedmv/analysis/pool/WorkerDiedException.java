package com.evedmv.analysis.pool;

/** The worker running a job terminated abnormally before the job completed. */
public class WorkerDiedException extends AnalysisPoolException {

  public WorkerDiedException(String message, Throwable cause) {
    super(message, cause);
  }
}
