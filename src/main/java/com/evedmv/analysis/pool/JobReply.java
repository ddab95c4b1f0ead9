package com.evedmv.analysis.pool;

import java.util.concurrent.CompletableFuture;

/**
 * The waiting side of a synchronous submission.
 *
 * <p>Holds the caller's result type so the dispatcher, which only sees results as {@code Object},
 * can complete the caller's typed future. The first completion wins; later ones are ignored.
 */
final class JobReply<T> {

  private final Class<T> resultType;
  private final CompletableFuture<T> future = new CompletableFuture<>();

  JobReply(Class<T> resultType) {
    this.resultType = resultType;
  }

  CompletableFuture<T> future() {
    return future;
  }

  void succeed(Object value) {
    if (value != null && !resultType.isInstance(value)) {
      future.completeExceptionally(
          new ClassCastException(
              "Analysis returned "
                  + value.getClass().getName()
                  + ", expected "
                  + resultType.getName()));
      return;
    }
    future.complete(resultType.cast(value));
  }

  void fail(RuntimeException error) {
    future.completeExceptionally(error);
  }
}
