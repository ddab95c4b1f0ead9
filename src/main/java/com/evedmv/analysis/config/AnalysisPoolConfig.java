package com.evedmv.analysis.config;

import com.evedmv.analysis.cache.AnalysisCache;
import com.evedmv.analysis.cache.InMemoryAnalysisCache;
import com.evedmv.analysis.metrics.MicrometerAnalysisTelemetry;
import com.evedmv.analysis.pool.AnalysisWorkerPool;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Configuration for the analysis worker pool.
 *
 * <p>Binds {@link AnalysisPoolProperties} from application.yml and wires the pool with its cache
 * and telemetry. The pool starts with the application context and is closed with it.
 */
@Configuration
@EnableConfigurationProperties(AnalysisPoolProperties.class)
public class AnalysisPoolConfig {

  @Bean
  public AnalysisCache analysisCache(AnalysisPoolProperties properties) {
    return new InMemoryAnalysisCache(properties.cache().maxSize());
  }

  @Bean
  public MicrometerAnalysisTelemetry analysisTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerAnalysisTelemetry(meterRegistry);
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  public AnalysisWorkerPool analysisWorkerPool(
      AnalysisPoolProperties properties,
      AnalysisCache analysisCache,
      MicrometerAnalysisTelemetry analysisTelemetry) {

    CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("analysis-worker-");
    threadFactory.setDaemon(true);

    AnalysisWorkerPool pool =
        new AnalysisWorkerPool(properties, analysisCache, analysisTelemetry, threadFactory);
    analysisTelemetry.bindPoolGauges(pool::stats);
    return pool;
  }
}
