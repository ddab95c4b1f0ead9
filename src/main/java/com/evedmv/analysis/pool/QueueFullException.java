package com.evedmv.analysis.pool;

/** Thrown at admission when every worker is busy and the job queue is at its limit. */
public class QueueFullException extends AnalysisPoolException {

  public QueueFullException(int queueLimit) {
    super("Analysis job queue is full (limit " + queueLimit + ")");
  }
}
