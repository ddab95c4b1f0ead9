package com.evedmv.analysis.pool;

import java.time.Duration;

/**
 * Per-submission options.
 *
 * <p>A {@code null} deadline means the pool's configured default deadline. A {@code null} cache key
 * disables both the cache lookup on synchronous submission and the cache write on success.
 */
public record SubmitOptions(JobPriority priority, Duration deadline, String cacheKey) {

  public SubmitOptions {
    if (priority == null) {
      priority = JobPriority.NORMAL;
    }
  }

  public static SubmitOptions defaults() {
    return new SubmitOptions(JobPriority.NORMAL, null, null);
  }

  public static SubmitOptions priority(JobPriority priority) {
    return new SubmitOptions(priority, null, null);
  }

  public SubmitOptions withDeadline(Duration deadline) {
    return new SubmitOptions(priority, deadline, cacheKey);
  }

  public SubmitOptions withCacheKey(String cacheKey) {
    return new SubmitOptions(priority, deadline, cacheKey);
  }
}
