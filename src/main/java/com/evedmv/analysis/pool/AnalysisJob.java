package com.evedmv.analysis.pool;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * One analysis request admitted to the pool.
 *
 * <p>Jobs are created by the dispatcher at admission time, which is where the id is assigned. The
 * {@code caller} reply is present only for synchronous submissions and is completed exactly once
 * with the job's outcome.
 */
public record AnalysisJob(
    long id,
    String kind,
    String subjectId,
    AnalysisWork<?> work,
    JobPriority priority,
    long requestedAt,
    Optional<JobReply<?>> caller,
    Duration deadline,
    String cacheKey) {

  public AnalysisJob {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(work, "work must not be null");
    Objects.requireNonNull(priority, "priority must not be null");
    Objects.requireNonNull(caller, "caller must not be null");
    Objects.requireNonNull(deadline, "deadline must not be null");
    if (deadline.isNegative() || deadline.isZero()) {
      throw new IllegalArgumentException("deadline must be positive");
    }
  }

  public boolean hasCaller() {
    return caller.isPresent();
  }

  public boolean hasCacheKey() {
    return cacheKey != null && !cacheKey.isEmpty();
  }

  /** Short label used in log lines, e.g. {@code character_score:90001234#17}. */
  public String label() {
    return kind + ":" + subjectId + "#" + id;
  }
}
