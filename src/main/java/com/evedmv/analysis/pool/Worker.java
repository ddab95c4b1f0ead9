package com.evedmv.analysis.pool;

import com.evedmv.analysis.logging.PoolEventLogger;
import java.time.Instant;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A long-lived execution slot backed by one thread.
 *
 * <p>The dispatcher hands the worker one job at a time through {@link #assign(AnalysisJob)}. The
 * worker thread runs it and posts a {@link PoolEvent.JobFinished} back. An exception thrown by the
 * work is a normal job failure. Anything else escaping the work (an {@link Error}) kills the
 * thread, and the uncaught exception handler posts {@link PoolEvent.WorkerCrashed} so the
 * dispatcher can replace it.
 *
 * <p>{@code status} and {@code currentJob} belong to the dispatcher thread.
 */
class Worker {

  private static final Logger LOGGER = LoggerFactory.getLogger(Worker.class);

  private final long id;
  private final Instant startedAt;
  private final BlockingQueue<AnalysisJob> inbox = new LinkedBlockingQueue<>(1);
  private final Consumer<PoolEvent> events;
  private final Thread thread;

  private volatile boolean retired;
  private WorkerStatus status = WorkerStatus.IDLE;
  private AnalysisJob currentJob;

  /**
   * Create and start a worker.
   *
   * @throws WorkerSpawnException if the thread factory cannot provide or start a thread
   */
  Worker(long id, ThreadFactory threadFactory, Consumer<PoolEvent> events) {
    this.id = id;
    this.events = events;
    this.startedAt = Instant.now();

    Thread created;
    try {
      created = threadFactory.newThread(this::runLoop);
    } catch (RuntimeException | OutOfMemoryError e) {
      throw new WorkerSpawnException("Could not create thread for worker " + id, e);
    }
    if (created == null) {
      throw new WorkerSpawnException("Thread factory refused to create worker " + id, null);
    }
    this.thread = created;
    this.thread.setName("analysis-worker-" + id);
    this.thread.setDaemon(true);
    this.thread.setUncaughtExceptionHandler(
        (t, e) -> events.accept(new PoolEvent.WorkerCrashed(id, e)));
    try {
      this.thread.start();
    } catch (RuntimeException | OutOfMemoryError e) {
      throw new WorkerSpawnException("Could not start thread for worker " + id, e);
    }
  }

  private void runLoop() {
    while (!retired) {
      AnalysisJob job;
      try {
        job = inbox.take();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }

      long start = System.nanoTime();
      JobOutcome outcome;
      PoolEventLogger.setJobContext(job.id(), job.kind(), job.subjectId());
      try {
        Object value = job.work().execute();
        outcome = JobOutcome.success(value, System.nanoTime() - start);
      } catch (Exception e) {
        outcome = JobOutcome.failure(e, System.nanoTime() - start);
      } finally {
        PoolEventLogger.clearJobContext();
      }
      events.accept(new PoolEvent.JobFinished(id, job.id(), outcome));
    }
    LOGGER.debug("Analysis worker {} shutting down", id);
  }

  void assign(AnalysisJob job) {
    if (status != WorkerStatus.IDLE) {
      throw new IllegalStateException("Worker " + id + " is already running a job");
    }
    status = WorkerStatus.BUSY;
    currentJob = job;
    if (!inbox.offer(job)) {
      throw new IllegalStateException("Worker " + id + " inbox unexpectedly full");
    }
  }

  /** Detach the current job and mark the worker idle. */
  AnalysisJob release() {
    AnalysisJob job = currentJob;
    currentJob = null;
    status = WorkerStatus.IDLE;
    return job;
  }

  /** Stop the worker thread. A job still running is interrupted and its result is discarded. */
  void retire() {
    retired = true;
    thread.interrupt();
  }

  long getId() {
    return id;
  }

  Instant getStartedAt() {
    return startedAt;
  }

  boolean isIdle() {
    return status == WorkerStatus.IDLE;
  }

  AnalysisJob getCurrentJob() {
    return currentJob;
  }
}
