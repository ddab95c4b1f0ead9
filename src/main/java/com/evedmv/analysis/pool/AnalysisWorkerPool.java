package com.evedmv.analysis.pool;

import com.evedmv.analysis.cache.AnalysisCache;
import com.evedmv.analysis.config.AnalysisPoolProperties;
import com.evedmv.analysis.logging.PoolEventLogger;
import com.evedmv.analysis.metrics.AnalysisTelemetry;
import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded pool of workers for character, corporation and fleet analysis.
 *
 * <p>Runs at most {@code targetSize} analyses at once. Requests that arrive while every worker is
 * busy wait in a bounded {@link JobQueue}, HIGH priority first. An {@link Autoscaler} adds or
 * removes one worker per period depending on queue depth and idle workers. Crashed or timed-out
 * workers are replaced.
 *
 * <p>All pool state is owned by a single dispatcher thread that handles one {@link PoolEvent} at a
 * time, so none of it needs locking. Public methods only post events and, where they return
 * something, wait for the dispatcher's reply.
 *
 * <p>Every synchronous submission gets exactly one outcome: the result, or one of {@link
 * QueueFullException}, {@link WorkerDiedException}, {@link JobTimeoutException} and {@link
 * AnalysisFailedException}. The only exception is {@link #clearQueue()}, whose dropped callers
 * time out on their own. Callers still waiting when the pool is closed fail with {@link
 * IllegalStateException}.
 */
public class AnalysisWorkerPool implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisWorkerPool.class);
  private final PoolEventLogger eventLogger = new PoolEventLogger(LOGGER);

  private static final Duration STATS_TIMEOUT = Duration.ofSeconds(5);
  private static final Duration ADMIN_TIMEOUT = Duration.ofSeconds(10);

  private final AnalysisPoolProperties properties;
  private final AnalysisCache cache;
  private final AnalysisTelemetry telemetry;
  private final ThreadFactory workerThreadFactory;
  private final Autoscaler autoscaler;

  private final BlockingQueue<PoolEvent> mailbox = new LinkedBlockingQueue<>();
  private final ScheduledThreadPoolExecutor timer;
  private final Thread dispatcher;
  private volatile boolean running;

  // Dispatcher-owned state
  private final Map<Long, Worker> workers = new LinkedHashMap<>();
  private final Map<Long, ScheduledFuture<?>> deadlines = new HashMap<>();
  private final JobQueue jobQueue;
  private int targetSize;
  private long nextJobId;
  private long nextWorkerId;
  // Written by the dispatcher only; read by stats() once the pool is stopped.
  private volatile long totalProcessed;

  public AnalysisWorkerPool(
      AnalysisPoolProperties properties,
      AnalysisCache cache,
      AnalysisTelemetry telemetry,
      ThreadFactory workerThreadFactory) {
    this.properties = properties;
    this.cache = cache;
    this.telemetry = telemetry;
    this.workerThreadFactory = workerThreadFactory;
    this.autoscaler =
        new Autoscaler(
            properties.minSize(),
            properties.maxSize(),
            properties.scaleUpQueueThreshold(),
            properties.scaleDownIdleThreshold());
    this.jobQueue = new JobQueue(properties.queueLimit());
    this.targetSize = properties.defaultSize();
    this.timer =
        new ScheduledThreadPoolExecutor(
            1,
            r -> {
              Thread t = new Thread(r, "analysis-pool-timer");
              t.setDaemon(true);
              return t;
            });
    // Deadlines are cancelled far more often than they fire.
    this.timer.setRemoveOnCancelPolicy(true);
    this.dispatcher = new Thread(this::dispatchLoop, "analysis-pool-dispatcher");
    this.dispatcher.setDaemon(true);
  }

  /** Spawn the initial workers and start the dispatcher and the autoscaler schedule. */
  public synchronized void start() {
    if (running) {
      return;
    }
    LOGGER.info("Starting analysis worker pool with {} workers", targetSize);
    for (int i = 0; i < targetSize; i++) {
      spawnWorker("startup");
    }
    running = true;
    dispatcher.start();

    long periodMs = properties.autoscalePeriod().toMillis();
    timer.scheduleAtFixedRate(
        () -> offer(new PoolEvent.AutoscaleTick()), periodMs, periodMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Run an analysis and wait for its result.
   *
   * <p>With a cache key, a cached result is returned without running anything. Otherwise the job
   * starts on an idle worker or waits in the queue. The caller blocks for at most the job's
   * deadline plus the configured submission overhead.
   *
   * @param kind analysis type, used for logs and metrics
   * @param subjectId the character, corporation or fleet being analysed
   * @param resultType type of the analysis result
   * @param work the analysis
   * @param options priority, deadline and cache key
   * @return the analysis result
   * @throws QueueFullException if every worker is busy and the queue is full
   * @throws WorkerDiedException if the worker crashed while running the job
   * @throws JobTimeoutException if the job missed its deadline
   * @throws AnalysisFailedException if the analysis itself threw
   */
  public <T> T submit(
      String kind,
      String subjectId,
      Class<T> resultType,
      AnalysisWork<T> work,
      SubmitOptions options) {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(resultType, "resultType must not be null");
    Objects.requireNonNull(work, "work must not be null");
    SubmitOptions resolved = resolve(options);

    if (resolved.cacheKey() != null) {
      Optional<T> cached = lookupCache(resolved.cacheKey(), resultType);
      if (cached.isPresent()) {
        LOGGER.debug("Analysis cache hit for {}:{}", kind, subjectId);
        return cached.get();
      }
    }

    JobReply<T> reply = new JobReply<>(resultType);
    post(new PoolEvent.Submit(kind, subjectId, work, resolved, reply));

    Duration wait = resolved.deadline().plus(properties.submissionOverhead());
    try {
      return reply.future().get(wait.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      JobTimeoutException timeout =
          new JobTimeoutException(
              "No result for analysis " + kind + ":" + subjectId + " within " + wait);
      // Whatever the dispatcher delivers later is discarded.
      reply.fail(timeout);
      throw timeout;
    } catch (ExecutionException e) {
      throw asRuntime(e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      reply.future().cancel(false);
      throw new IllegalStateException("Interrupted while waiting for analysis " + kind, e);
    }
  }

  /**
   * Submit an analysis without waiting for it.
   *
   * <p>If every worker is busy and the queue is full the job is dropped and a warning is logged.
   * A successful result is still written to the cache when a cache key is given.
   */
  public void submitAsync(
      String kind, String subjectId, AnalysisWork<?> work, SubmitOptions options) {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(work, "work must not be null");
    post(new PoolEvent.Submit(kind, subjectId, work, resolve(options), null));
  }

  /**
   * Snapshot of the pool, computed by the dispatcher from live state.
   *
   * <p>While the pool is not running this is an empty pool that only carries the processed count.
   */
  public PoolStats stats() {
    CompletableFuture<PoolStats> reply = new CompletableFuture<>();
    if (!offer(new PoolEvent.StatsRequest(reply))) {
      return PoolStats.of(0, 0, 0, 0, totalProcessed);
    }
    return await(reply, STATS_TIMEOUT);
  }

  /**
   * Resize the pool.
   *
   * <p>Growing spawns workers immediately. Shrinking retires idle workers first; busy workers over
   * the new size are retired as soon as their current job finishes.
   *
   * @param size the new target size
   * @return the pool snapshot after resizing
   * @throws InvalidPoolSizeException if {@code size} is outside {@code [minSize, maxSize]}
   */
  public PoolStats scaleTo(int size) {
    if (size < properties.minSize() || size > properties.maxSize()) {
      throw new InvalidPoolSizeException(size, properties.minSize(), properties.maxSize());
    }
    CompletableFuture<PoolStats> reply = new CompletableFuture<>();
    post(new PoolEvent.Resize(size, reply));
    return await(reply, ADMIN_TIMEOUT);
  }

  /**
   * Discard every queued job.
   *
   * <p>Callers waiting on discarded jobs are not answered and run into their own timeout. Meant as
   * an emergency reset.
   *
   * @return number of jobs dropped
   */
  public int clearQueue() {
    CompletableFuture<Integer> reply = new CompletableFuture<>();
    post(new PoolEvent.ClearQueue(reply));
    return await(reply, ADMIN_TIMEOUT);
  }

  /** Run one autoscaler evaluation now instead of waiting for the next period. */
  void triggerAutoscale() {
    post(new PoolEvent.AutoscaleTick());
  }

  /** Tasks waiting in the timer: the autoscaler schedule plus one deadline per running job. */
  int pendingTimers() {
    return timer.getQueue().size();
  }

  @Override
  public void close() {
    synchronized (this) {
      if (!running) {
        return;
      }
      running = false;
      mailbox.add(new PoolEvent.Shutdown());
    }
    try {
      dispatcher.join(ADMIN_TIMEOUT.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      timer.shutdownNow();
    }
    LOGGER.info("Analysis worker pool stopped");
  }

  private void post(PoolEvent event) {
    if (!offer(event)) {
      throw new IllegalStateException("Analysis worker pool is not running");
    }
  }

  // Shares the lock with close() so that no request lands in the mailbox behind Shutdown.
  private synchronized boolean offer(PoolEvent event) {
    if (!running) {
      return false;
    }
    mailbox.add(event);
    return true;
  }

  private SubmitOptions resolve(SubmitOptions options) {
    SubmitOptions effective = options == null ? SubmitOptions.defaults() : options;
    if (effective.deadline() == null) {
      effective = effective.withDeadline(properties.defaultDeadline());
    }
    if (effective.deadline().isNegative() || effective.deadline().isZero()) {
      throw new IllegalArgumentException("deadline must be positive: " + effective.deadline());
    }
    return effective;
  }

  private <T> Optional<T> lookupCache(String key, Class<T> resultType) {
    Optional<Object> cached;
    try {
      cached = cache.get(properties.cache().namespace(), key);
    } catch (RuntimeException e) {
      LOGGER.warn("Analysis cache lookup failed for key {}, running the job instead", key, e);
      return Optional.empty();
    }
    if (cached.isPresent() && !resultType.isInstance(cached.get())) {
      LOGGER.warn(
          "Cached value under {} is a {}, not a {}, running the job instead",
          key,
          cached.get().getClass().getName(),
          resultType.getName());
      return Optional.empty();
    }
    return cached.map(resultType::cast);
  }

  private static <T> T await(CompletableFuture<T> reply, Duration timeout) {
    try {
      return reply.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      throw new IllegalStateException("Analysis worker pool did not answer within " + timeout, e);
    } catch (ExecutionException e) {
      throw asRuntime(e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for the analysis pool", e);
    }
  }

  private static RuntimeException asRuntime(Throwable cause) {
    if (cause instanceof RuntimeException) {
      return (RuntimeException) cause;
    }
    return new IllegalStateException(cause);
  }

  // ---------------------------------------------------------------------------------------------
  // Dispatcher thread
  // ---------------------------------------------------------------------------------------------

  private void dispatchLoop() {
    while (true) {
      PoolEvent event;
      try {
        event = mailbox.take();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
      if (event instanceof PoolEvent.Shutdown) {
        break;
      }
      try {
        handle(event);
      } catch (RuntimeException e) {
        LOGGER.error(
            "Analysis pool failed to handle {}", event.getClass().getSimpleName(), e);
        failWaiting(
            event,
            new IllegalStateException(
                "Analysis pool failed to handle " + event.getClass().getSimpleName(), e));
      }
    }
    shutdownWorkers();
  }

  /** Answer whoever is blocked on {@code event} with {@code error}. */
  private static void failWaiting(PoolEvent event, RuntimeException error) {
    if (event instanceof PoolEvent.Submit submit) {
      if (submit.caller() != null) {
        submit.caller().fail(error);
      }
    } else if (event instanceof PoolEvent.Resize resize) {
      resize.reply().completeExceptionally(error);
    } else if (event instanceof PoolEvent.StatsRequest request) {
      request.reply().completeExceptionally(error);
    } else if (event instanceof PoolEvent.ClearQueue clear) {
      clear.reply().completeExceptionally(error);
    }
  }

  private void handle(PoolEvent event) {
    if (event instanceof PoolEvent.Submit submit) {
      handleSubmit(submit);
    } else if (event instanceof PoolEvent.JobFinished finished) {
      handleJobFinished(finished);
    } else if (event instanceof PoolEvent.WorkerCrashed crashed) {
      handleWorkerCrashed(crashed);
    } else if (event instanceof PoolEvent.JobTimedOut timedOut) {
      handleJobTimedOut(timedOut);
    } else if (event instanceof PoolEvent.Resize resize) {
      handleResize(resize);
    } else if (event instanceof PoolEvent.StatsRequest request) {
      request.reply().complete(snapshot());
    } else if (event instanceof PoolEvent.ClearQueue clear) {
      int dropped = jobQueue.clear();
      eventLogger.logQueueCleared(dropped);
      clear.reply().complete(dropped);
    } else if (event instanceof PoolEvent.AutoscaleTick) {
      handleAutoscaleTick();
    } else {
      LOGGER.warn("Unhandled pool event {}", event);
    }
  }

  private void handleSubmit(PoolEvent.Submit submit) {
    SubmitOptions options = submit.options();
    AnalysisJob job =
        new AnalysisJob(
            ++nextJobId,
            submit.kind(),
            submit.subjectId(),
            submit.work(),
            options.priority(),
            System.nanoTime(),
            Optional.ofNullable(submit.caller()),
            options.deadline(),
            options.cacheKey());

    Optional<Worker> idle = findIdleWorker();
    if (idle.isPresent()) {
      startJob(idle.get(), job);
      return;
    }

    try {
      jobQueue.enqueue(job);
      eventLogger.logJobQueued(
          job.id(), job.kind(), job.subjectId(), job.priority().name(), jobQueue.size());
    } catch (QueueFullException e) {
      eventLogger.logQueueFull(
          job.id(), job.kind(), job.subjectId(), !job.hasCaller(), jobQueue.getLimit());
      job.caller().ifPresent(caller -> caller.fail(e));
    }
  }

  private void startJob(Worker worker, AnalysisJob job) {
    worker.assign(job);
    long waitMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - job.requestedAt());
    eventLogger.logJobStarted(job.id(), job.kind(), job.subjectId(), worker.getId(), waitMs);

    long workerId = worker.getId();
    long jobId = job.id();
    ScheduledFuture<?> deadline =
        timer.schedule(
            () -> mailbox.add(new PoolEvent.JobTimedOut(workerId, jobId)),
            job.deadline().toMillis(),
            TimeUnit.MILLISECONDS);
    deadlines.put(jobId, deadline);
  }

  private void handleJobFinished(PoolEvent.JobFinished finished) {
    Worker worker = workers.get(finished.workerId());
    if (worker == null
        || worker.getCurrentJob() == null
        || worker.getCurrentJob().id() != finished.jobId()) {
      LOGGER.debug(
          "Ignoring result for unknown worker/job: {}/{}", finished.workerId(), finished.jobId());
      return;
    }

    AnalysisJob job = worker.release();
    cancelDeadline(job.id());
    JobOutcome outcome = finished.outcome();
    Duration duration = Duration.ofNanos(outcome.durationNanos());

    // The failure came out of analysis code. Reporting it must not keep the caller waiting or
    // leave the worker idle next to queued jobs.
    try {
      if (outcome.isSuccess()) {
        eventLogger.logJobCompleted(job.id(), job.kind(), job.subjectId(), duration.toMillis());
        emit(AnalysisTelemetry.JOB_COMPLETED, duration, job, null);
      } else {
        Exception error = outcome.failure();
        eventLogger.logJobFailed(
            job.id(), job.kind(), job.subjectId(), duration.toMillis(), error);
        emit(AnalysisTelemetry.JOB_FAILED, duration, job, error.getClass().getSimpleName());
      }
    } finally {
      try {
        if (outcome.isSuccess()) {
          deliver(job, outcome.value(), null);
          if (job.hasCacheKey() && outcome.value() != null) {
            writeCache(job, outcome.value());
          }
        } else {
          Exception error = outcome.failure();
          deliver(job, null, new AnalysisFailedException(job.kind(), job.subjectId(), error));
        }
      } finally {
        reassign(worker);
      }
    }
  }

  /** Retire a worker the pool no longer needs, or give it the next queued job. */
  private void reassign(Worker worker) {
    if (workers.size() > targetSize) {
      retireWorker(worker);
      LOGGER.info(
          "Retired analysis worker {} after its job, pool now {}/{}",
          worker.getId(),
          workers.size(),
          targetSize);
    } else {
      jobQueue.dequeue().ifPresent(next -> startJob(worker, next));
    }
  }

  private void handleWorkerCrashed(PoolEvent.WorkerCrashed crashed) {
    Worker worker = workers.remove(crashed.workerId());
    if (worker == null) {
      LOGGER.debug("Received crash report for unknown worker {}", crashed.workerId());
      return;
    }

    LOGGER.debug(
        "Analysis worker {} had been up since {}", worker.getId(), worker.getStartedAt());
    AnalysisJob job = worker.release();
    try {
      eventLogger.logWorkerCrashed(
          worker.getId(), job == null ? null : job.label(), crashed.cause());
      if (job != null) {
        emit(AnalysisTelemetry.JOB_FAILED, elapsedSince(job), job, "worker_died");
      }
    } finally {
      try {
        if (job != null) {
          cancelDeadline(job.id());
          deliver(
              job,
              null,
              new WorkerDiedException(
                  "Worker " + worker.getId() + " died while running " + job.label(),
                  crashed.cause()));
        }
      } finally {
        replaceWorker("crash replacement");
      }
    }
  }

  private void handleJobTimedOut(PoolEvent.JobTimedOut timedOut) {
    deadlines.remove(timedOut.jobId());
    Worker worker = workers.get(timedOut.workerId());
    if (worker == null
        || worker.getCurrentJob() == null
        || worker.getCurrentJob().id() != timedOut.jobId()) {
      return;
    }

    AnalysisJob job = worker.release();
    try {
      eventLogger.logJobTimedOut(
          job.id(), job.kind(), job.subjectId(), worker.getId(), job.deadline().toMillis());
      emit(AnalysisTelemetry.JOB_FAILED, job.deadline(), job, "timeout");
    } finally {
      try {
        deliver(
            job,
            null,
            new JobTimeoutException(
                "Analysis " + job.label() + " exceeded its deadline of " + job.deadline()));
      } finally {
        // The work cannot be cancelled cooperatively, so the worker goes with it.
        retireWorker(worker);
        replaceWorker("timeout replacement");
      }
    }
  }

  private void handleResize(PoolEvent.Resize resize) {
    int previous = targetSize;
    targetSize = resize.targetSize();

    while (workers.size() < targetSize) {
      if (spawnWorker("resize").isEmpty()) {
        break;
      }
    }
    retireIdleWorkers(workers.size() - targetSize);
    drainQueue();

    eventLogger.logScaled(previous, targetSize, "manual", jobQueue.size(), idleCount());
    resize.reply().complete(snapshot());
  }

  private void handleAutoscaleTick() {
    // Make up for earlier spawn failures before judging the load.
    while (workers.size() < targetSize) {
      if (spawnWorker("reconcile").isEmpty()) {
        break;
      }
    }
    drainQueue();

    int queued = jobQueue.size();
    int idle = idleCount();
    ScalingDecision decision = autoscaler.evaluate(queued, idle, targetSize);
    int next = autoscaler.nextSize(decision, targetSize);

    switch (decision) {
      case UP:
        if (spawnWorker("autoscale").isPresent()) {
          eventLogger.logScaled(targetSize, next, "autoscale up", queued, idle);
          targetSize = next;
          drainQueue();
        }
        break;
      case DOWN:
        if (retireIdleWorkers(1) == 1) {
          eventLogger.logScaled(targetSize, next, "autoscale down", queued, idle);
          targetSize = next;
        }
        break;
      default:
        break;
    }
  }

  private void replaceWorker(String trigger) {
    if (workers.size() < targetSize) {
      spawnWorker(trigger);
    }
    drainQueue();
  }

  private Optional<Worker> spawnWorker(String trigger) {
    long id = ++nextWorkerId;
    try {
      Worker worker = new Worker(id, workerThreadFactory, mailbox::add);
      workers.put(id, worker);
      LOGGER.debug("Started analysis worker {} ({})", id, trigger);
      return Optional.of(worker);
    } catch (WorkerSpawnException e) {
      eventLogger.logSpawnFailed(id, trigger, e);
      return Optional.empty();
    }
  }

  private int retireIdleWorkers(int count) {
    int retired = 0;
    Iterator<Worker> it = workers.values().iterator();
    while (retired < count && it.hasNext()) {
      Worker worker = it.next();
      if (worker.isIdle()) {
        it.remove();
        worker.retire();
        retired++;
      }
    }
    return retired;
  }

  private void retireWorker(Worker worker) {
    workers.remove(worker.getId());
    worker.retire();
  }

  private void drainQueue() {
    for (Worker worker : workers.values()) {
      if (jobQueue.isEmpty()) {
        return;
      }
      if (worker.isIdle()) {
        jobQueue.dequeue().ifPresent(job -> startJob(worker, job));
      }
    }
  }

  private void deliver(AnalysisJob job, Object value, RuntimeException error) {
    totalProcessed++;
    job.caller()
        .ifPresent(
            caller -> {
              if (error == null) {
                caller.succeed(value);
              } else {
                caller.fail(error);
              }
            });
  }

  private void writeCache(AnalysisJob job, Object value) {
    AnalysisPoolProperties.CacheProperties cacheProperties = properties.cache();
    try {
      cache.put(cacheProperties.namespace(), job.cacheKey(), value, cacheProperties.ttl());
    } catch (RuntimeException e) {
      LOGGER.warn("Failed to cache result of {} under {}", job.label(), job.cacheKey(), e);
    }
  }

  private void emit(String event, Duration duration, AnalysisJob job, String errorKind) {
    Map<String, String> tags = new LinkedHashMap<>();
    tags.put("kind", job.kind());
    tags.put("priority", job.priority().name().toLowerCase(Locale.ROOT));
    if (errorKind != null) {
      tags.put("error_kind", errorKind);
    }
    try {
      telemetry.record(event, duration, tags);
    } catch (RuntimeException e) {
      LOGGER.warn("Telemetry sink rejected {} for {}", event, job.label(), e);
    }
  }

  private void cancelDeadline(long jobId) {
    ScheduledFuture<?> deadline = deadlines.remove(jobId);
    if (deadline != null) {
      deadline.cancel(false);
    }
  }

  private static Duration elapsedSince(AnalysisJob job) {
    return Duration.ofNanos(System.nanoTime() - job.requestedAt());
  }

  private Optional<Worker> findIdleWorker() {
    return workers.values().stream().filter(Worker::isIdle).findFirst();
  }

  private int idleCount() {
    return (int) workers.values().stream().filter(Worker::isIdle).count();
  }

  private PoolStats snapshot() {
    return PoolStats.of(workers.size(), targetSize, idleCount(), jobQueue.size(), totalProcessed);
  }

  private void shutdownWorkers() {
    IllegalStateException stopped = new IllegalStateException("Analysis worker pool stopped");
    for (Worker worker : workers.values()) {
      AnalysisJob job = worker.release();
      if (job != null) {
        job.caller().ifPresent(caller -> caller.fail(stopped));
      }
      worker.retire();
    }
    workers.clear();
    deadlines.values().forEach(deadline -> deadline.cancel(false));
    deadlines.clear();

    int dropped = 0;
    for (Optional<AnalysisJob> next = jobQueue.dequeue();
        next.isPresent();
        next = jobQueue.dequeue()) {
      next.get().caller().ifPresent(caller -> caller.fail(stopped));
      dropped++;
    }
    if (dropped > 0) {
      LOGGER.warn("Discarded {} queued analysis jobs on shutdown", dropped);
    }

    // Requests are only left here if the dispatcher was interrupted before it saw Shutdown.
    for (PoolEvent left = mailbox.poll(); left != null; left = mailbox.poll()) {
      failWaiting(left, stopped);
    }
  }
}
