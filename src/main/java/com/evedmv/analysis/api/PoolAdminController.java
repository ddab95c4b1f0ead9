package com.evedmv.analysis.api;

import com.evedmv.analysis.pool.AnalysisWorkerPool;
import com.evedmv.analysis.pool.PoolStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operational endpoints for the analysis worker pool.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Pool occupancy and queue depth
 *   <li>Manual resizing within the configured bounds
 *   <li>Emergency queue reset
 * </ul>
 */
@RestController
@RequestMapping("/pool")
@Tag(name = "Analysis pool", description = "Analysis worker pool administration")
public class PoolAdminController {

  private static final Logger LOGGER = LoggerFactory.getLogger(PoolAdminController.class);

  private final AnalysisWorkerPool pool;

  public PoolAdminController(AnalysisWorkerPool pool) {
    this.pool = pool;
  }

  @GetMapping("/stats")
  @Operation(summary = "Pool statistics", description = "Current pool size, occupancy and queue")
  public ResponseEntity<PoolStats> stats() {
    return ResponseEntity.ok(pool.stats());
  }

  @PutMapping("/size")
  @Operation(
      summary = "Resize the pool",
      description = "Set the worker count. Sizes outside the configured bounds are rejected.")
  public ResponseEntity<PoolStats> scale(@Valid @RequestBody ScaleRequest request) {
    LOGGER.info("Manual resize request: size={}", request.size());
    return ResponseEntity.ok(pool.scaleTo(request.size()));
  }

  @DeleteMapping("/queue")
  @Operation(
      summary = "Clear the job queue",
      description = "Discard every queued job. Waiting callers are not answered and time out.")
  public ResponseEntity<ClearQueueResponse> clearQueue() {
    int dropped = pool.clearQueue();
    return ResponseEntity.ok(new ClearQueueResponse(dropped));
  }
}
