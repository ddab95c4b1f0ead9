package com.evedmv.analysis.pool;

/**
 * Decides whether the pool should grow or shrink by one worker.
 *
 * <p>Scale up when more than {@code scaleUpQueueThreshold} jobs are waiting and the pool is below
 * {@code maxSize}. Otherwise scale down when more than {@code scaleDownIdleThreshold} workers are
 * idle and the pool is above {@code minSize}. The two thresholds act as a hysteresis band, and the
 * one-step adjustment keeps the pool from oscillating between ticks.
 *
 * <p>This class only decides. The dispatcher applies the decision on its own thread.
 */
public class Autoscaler {

  private final int minSize;
  private final int maxSize;
  private final int scaleUpQueueThreshold;
  private final int scaleDownIdleThreshold;

  public Autoscaler(
      int minSize, int maxSize, int scaleUpQueueThreshold, int scaleDownIdleThreshold) {
    if (minSize < 0 || maxSize < minSize) {
      throw new IllegalArgumentException(
          "invalid bounds: minSize=" + minSize + ", maxSize=" + maxSize);
    }
    this.minSize = minSize;
    this.maxSize = maxSize;
    this.scaleUpQueueThreshold = scaleUpQueueThreshold;
    this.scaleDownIdleThreshold = scaleDownIdleThreshold;
  }

  /**
   * Evaluate the current load.
   *
   * @param queueLength jobs waiting
   * @param idleWorkers idle workers
   * @param targetSize current target worker count
   * @return the single-step adjustment to apply
   */
  public ScalingDecision evaluate(int queueLength, int idleWorkers, int targetSize) {
    if (queueLength > scaleUpQueueThreshold && targetSize < maxSize) {
      return ScalingDecision.UP;
    }
    if (idleWorkers > scaleDownIdleThreshold && targetSize > minSize) {
      return ScalingDecision.DOWN;
    }
    return ScalingDecision.NONE;
  }

  public int nextSize(ScalingDecision decision, int targetSize) {
    switch (decision) {
      case UP:
        return Math.min(maxSize, targetSize + 1);
      case DOWN:
        return Math.max(minSize, targetSize - 1);
      default:
        return targetSize;
    }
  }
}
