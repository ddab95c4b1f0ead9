package com.evedmv.analysis.pool;

/**
 * A unit of analysis work executed by a pool worker.
 *
 * <p>Implementations are usually lambdas capturing whatever they need to score a character,
 * corporation or fleet. Throwing any {@link Exception} marks the job as failed; the pool wraps it
 * in an {@link AnalysisFailedException} for the caller.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface AnalysisWork<T> {

  T execute() throws Exception;
}
