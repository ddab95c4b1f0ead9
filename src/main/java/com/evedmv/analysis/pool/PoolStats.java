package com.evedmv.analysis.pool;

/**
 * Point-in-time view of pool occupancy.
 *
 * @param poolSize live workers
 * @param targetSize desired worker count; differs from {@code poolSize} only while a shrink waits
 *     for busy workers to finish
 * @param idle workers with no job
 * @param busy workers running a job
 * @param queueLength jobs waiting for a worker
 * @param totalProcessed jobs that reached an outcome since startup
 * @param utilization {@code busy / poolSize}, 0 for an empty pool
 */
public record PoolStats(
    int poolSize,
    int targetSize,
    int idle,
    int busy,
    int queueLength,
    long totalProcessed,
    double utilization) {

  static PoolStats of(int poolSize, int targetSize, int idle, int queueLength, long processed) {
    int busy = poolSize - idle;
    double utilization = poolSize == 0 ? 0.0 : (double) busy / poolSize;
    return new PoolStats(poolSize, targetSize, idle, busy, queueLength, processed, utilization);
  }
}
