package com.evedmv.analysis.metrics;

import com.evedmv.analysis.pool.PoolStats;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Micrometer-backed telemetry.
 *
 * <p>Each event name becomes a timer under {@code analysis.worker.*}, tagged with whatever tags the
 * pool supplies.
 */
public class MicrometerAnalysisTelemetry implements AnalysisTelemetry {

  static final String PREFIX = "analysis.worker.";

  private final MeterRegistry meterRegistry;

  public MicrometerAnalysisTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void record(String eventName, Duration duration, Map<String, String> tags) {
    Timer.Builder builder = Timer.builder(PREFIX + eventName).description("Analysis job duration");
    tags.forEach(builder::tag);
    builder.register(meterRegistry).record(duration);
  }

  /**
   * Expose queue depth and pool occupancy as gauges.
   *
   * @param stats supplier of the current pool snapshot
   */
  public void bindPoolGauges(Supplier<PoolStats> stats) {
    Gauge.builder("analysis.pool.size", () -> stats.get().poolSize())
        .description("Live analysis workers")
        .register(meterRegistry);
    Gauge.builder("analysis.pool.busy", () -> stats.get().busy())
        .description("Analysis workers running a job")
        .register(meterRegistry);
    Gauge.builder("analysis.pool.queue_length", () -> stats.get().queueLength())
        .description("Analysis jobs waiting for a worker")
        .register(meterRegistry);
  }
}
