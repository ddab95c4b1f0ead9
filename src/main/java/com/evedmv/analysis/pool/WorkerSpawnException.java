package com.evedmv.analysis.pool;

/** A worker thread could not be created or started, usually from resource exhaustion. */
class WorkerSpawnException extends RuntimeException {

  WorkerSpawnException(String message, Throwable cause) {
    super(message, cause);
  }
}
