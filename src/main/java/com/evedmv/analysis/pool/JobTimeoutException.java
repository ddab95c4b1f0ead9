package com.evedmv.analysis.pool;

/** A job did not complete within its deadline. */
public class JobTimeoutException extends AnalysisPoolException {

  public JobTimeoutException(String message) {
    super(message);
  }
}
