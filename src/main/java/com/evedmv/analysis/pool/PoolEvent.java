package com.evedmv.analysis.pool;

import java.util.concurrent.CompletableFuture;

/**
 * Messages handled one at a time by the dispatcher thread.
 *
 * <p>Every change to the worker set, the job queue and the job id counter happens while handling
 * one of these.
 */
interface PoolEvent {

  /** A new job request. {@code caller} is null for fire-and-forget submissions. */
  record Submit(
      String kind,
      String subjectId,
      AnalysisWork<?> work,
      SubmitOptions options,
      JobReply<?> caller)
      implements PoolEvent {}

  record JobFinished(long workerId, long jobId, JobOutcome outcome) implements PoolEvent {}

  record WorkerCrashed(long workerId, Throwable cause) implements PoolEvent {}

  record JobTimedOut(long workerId, long jobId) implements PoolEvent {}

  record Resize(int targetSize, CompletableFuture<PoolStats> reply) implements PoolEvent {}

  record StatsRequest(CompletableFuture<PoolStats> reply) implements PoolEvent {}

  record ClearQueue(CompletableFuture<Integer> reply) implements PoolEvent {}

  record AutoscaleTick() implements PoolEvent {}

  record Shutdown() implements PoolEvent {}
}
