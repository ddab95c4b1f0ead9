package com.evedmv.analysis.api;

import com.evedmv.analysis.pool.AnalysisFailedException;
import com.evedmv.analysis.pool.InvalidPoolSizeException;
import com.evedmv.analysis.pool.JobTimeoutException;
import com.evedmv.analysis.pool.QueueFullException;
import com.evedmv.analysis.pool.WorkerDiedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps worker pool failures to HTTP responses. */
@RestControllerAdvice
public class PoolExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(PoolExceptionHandler.class);

  @ExceptionHandler(InvalidPoolSizeException.class)
  public ResponseEntity<ErrorResponse> invalidSize(InvalidPoolSizeException e) {
    return respond(HttpStatus.BAD_REQUEST, "invalid_size", e);
  }

  @ExceptionHandler(QueueFullException.class)
  public ResponseEntity<ErrorResponse> queueFull(QueueFullException e) {
    return respond(HttpStatus.SERVICE_UNAVAILABLE, "queue_full", e);
  }

  @ExceptionHandler(JobTimeoutException.class)
  public ResponseEntity<ErrorResponse> timeout(JobTimeoutException e) {
    return respond(HttpStatus.GATEWAY_TIMEOUT, "timeout", e);
  }

  @ExceptionHandler(WorkerDiedException.class)
  public ResponseEntity<ErrorResponse> workerDied(WorkerDiedException e) {
    return respond(HttpStatus.BAD_GATEWAY, "worker_died", e);
  }

  @ExceptionHandler(AnalysisFailedException.class)
  public ResponseEntity<ErrorResponse> analysisFailed(AnalysisFailedException e) {
    LOGGER.error("Analysis {}:{} failed", e.getKind(), e.getSubjectId(), e.getCause());
    return respond(HttpStatus.BAD_GATEWAY, "analysis_failed", e);
  }

  private static ResponseEntity<ErrorResponse> respond(
      HttpStatus status, String error, RuntimeException e) {
    LOGGER.warn("Pool request failed: {} ({})", error, e.getMessage());
    return ResponseEntity.status(status).body(new ErrorResponse(error, e.getMessage()));
  }
}
