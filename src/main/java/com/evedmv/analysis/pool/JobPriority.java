package com.evedmv.analysis.pool;

/** Scheduling priority of an analysis job. */
public enum JobPriority {
  HIGH,
  NORMAL,
  LOW
}
