package com.evedmv.analysis.pool;

public enum WorkerStatus {
  IDLE,
  BUSY
}
