package com.evedmv.analysis.pool;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Bounded, priority-aware waiting list for jobs that arrived while every worker was busy.
 *
 * <p>HIGH jobs form their own FIFO run at the head of the queue: a new HIGH job goes ahead of all
 * NORMAL and LOW jobs but behind HIGH jobs already waiting. NORMAL and LOW jobs share the tail in
 * plain submission order.
 *
 * <p>Not thread-safe. Only the dispatcher thread touches it.
 */
public class JobQueue {

  private final int limit;
  private final Deque<AnalysisJob> high = new ArrayDeque<>();
  private final Deque<AnalysisJob> rest = new ArrayDeque<>();

  public JobQueue(int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("queue limit must not be negative");
    }
    this.limit = limit;
  }

  /**
   * Add a job to the queue.
   *
   * @param job the job to wait for a worker
   * @throws QueueFullException if the queue already holds {@code limit} jobs
   */
  public void enqueue(AnalysisJob job) {
    if (size() >= limit) {
      throw new QueueFullException(limit);
    }
    if (job.priority() == JobPriority.HIGH) {
      high.addLast(job);
    } else {
      rest.addLast(job);
    }
  }

  /**
   * Remove the job at the head of the queue.
   *
   * @return the next job, or empty if nothing is waiting
   */
  public Optional<AnalysisJob> dequeue() {
    AnalysisJob next = high.pollFirst();
    if (next == null) {
      next = rest.pollFirst();
    }
    return Optional.ofNullable(next);
  }

  public int size() {
    return high.size() + rest.size();
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  public int getLimit() {
    return limit;
  }

  /**
   * Drop every waiting job.
   *
   * @return how many jobs were dropped
   */
  public int clear() {
    int dropped = size();
    high.clear();
    rest.clear();
    return dropped;
  }
}
