package com.evedmv.analysis.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the analysis worker pool.
 *
 * <p>Sizes bound the worker count, {@code queueLimit} bounds how many jobs may wait, and the
 * thresholds drive the autoscaler.
 */
@ConfigurationProperties(prefix = "analysis.pool")
@Validated
public record AnalysisPoolProperties(
    @Positive int defaultSize,
    @Positive int minSize,
    @Positive int maxSize,
    @PositiveOrZero int queueLimit,
    @NotNull Duration defaultDeadline,
    @NotNull Duration submissionOverhead,
    @PositiveOrZero int scaleUpQueueThreshold,
    @PositiveOrZero int scaleDownIdleThreshold,
    @NotNull Duration autoscalePeriod,
    @Valid @NotNull CacheProperties cache) {

  public AnalysisPoolProperties {
    if (minSize > maxSize) {
      throw new IllegalArgumentException(
          "analysis.pool.minSize (" + minSize + ") must not exceed maxSize (" + maxSize + ")");
    }
    if (defaultSize < minSize || defaultSize > maxSize) {
      throw new IllegalArgumentException(
          "analysis.pool.defaultSize ("
              + defaultSize
              + ") must be between minSize and maxSize");
    }
  }

  public record CacheProperties(
      @NotBlank String namespace, @NotNull Duration ttl, @Positive long maxSize) {}

  /** Settings used when nothing is configured: 3 workers in [1, 8], 100 queued, 5 minute jobs. */
  public static AnalysisPoolProperties defaults() {
    return new AnalysisPoolProperties(
        3,
        1,
        8,
        100,
        Duration.ofMinutes(5),
        Duration.ofSeconds(5),
        2,
        2,
        Duration.ofSeconds(30),
        new CacheProperties("analysis", Duration.ofHours(1), 10_000));
  }
}
