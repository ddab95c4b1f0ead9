package com.evedmv.analysis.pool;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AutoscalerTest {

  private final Autoscaler autoscaler = new Autoscaler(1, 4, 2, 2);

  @Test
  void evaluate_shouldScaleUpWhenQueueExceedsThreshold() {
    assertThat(autoscaler.evaluate(3, 0, 2)).isEqualTo(ScalingDecision.UP);
    assertThat(autoscaler.nextSize(ScalingDecision.UP, 2)).isEqualTo(3);
  }

  @Test
  void evaluate_shouldNotScaleUpAtThreshold() {
    assertThat(autoscaler.evaluate(2, 0, 2)).isEqualTo(ScalingDecision.NONE);
  }

  @Test
  void evaluate_shouldNotScaleUpBeyondMax() {
    assertThat(autoscaler.evaluate(50, 0, 4)).isEqualTo(ScalingDecision.NONE);
    assertThat(autoscaler.nextSize(ScalingDecision.UP, 4)).isEqualTo(4);
  }

  @Test
  void evaluate_shouldScaleDownWhenTooManyIdle() {
    assertThat(autoscaler.evaluate(0, 3, 4)).isEqualTo(ScalingDecision.DOWN);
    assertThat(autoscaler.nextSize(ScalingDecision.DOWN, 4)).isEqualTo(3);
  }

  @Test
  void evaluate_shouldNotScaleDownBelowMin() {
    Autoscaler eager = new Autoscaler(1, 4, 2, 0);

    assertThat(eager.evaluate(0, 1, 1)).isEqualTo(ScalingDecision.NONE);
    assertThat(eager.nextSize(ScalingDecision.DOWN, 1)).isEqualTo(1);
  }

  @Test
  void evaluate_shouldPreferScaleUpOverScaleDown() {
    // Queue backlog with idle workers can only happen transiently, but up wins.
    assertThat(autoscaler.evaluate(5, 3, 3)).isEqualTo(ScalingDecision.UP);
  }
}
