package com.evedmv.analysis.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.evedmv.analysis.config.AnalysisPoolProperties.CacheProperties;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class AnalysisPoolPropertiesTest {

  private static AnalysisPoolProperties withSizes(int defaultSize, int minSize, int maxSize) {
    return new AnalysisPoolProperties(
        defaultSize,
        minSize,
        maxSize,
        100,
        Duration.ofMinutes(5),
        Duration.ofSeconds(5),
        2,
        2,
        Duration.ofSeconds(30),
        new CacheProperties("analysis", Duration.ofHours(1), 1000));
  }

  @Test
  void defaults_shouldMatchDocumentedValues() {
    AnalysisPoolProperties defaults = AnalysisPoolProperties.defaults();

    assertThat(defaults.defaultSize()).isEqualTo(3);
    assertThat(defaults.minSize()).isEqualTo(1);
    assertThat(defaults.maxSize()).isEqualTo(8);
    assertThat(defaults.queueLimit()).isEqualTo(100);
    assertThat(defaults.defaultDeadline()).isEqualTo(Duration.ofMinutes(5));
    assertThat(defaults.autoscalePeriod()).isEqualTo(Duration.ofSeconds(30));
  }

  @Test
  void constructor_shouldRejectMinAboveMax() {
    assertThatThrownBy(() -> withSizes(3, 5, 4))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("must not exceed maxSize");
  }

  @Test
  void constructor_shouldRejectDefaultOutsideBounds() {
    assertThatThrownBy(() -> withSizes(9, 1, 8))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("defaultSize");
  }
}
