package com.evedmv.analysis.pool;

/** A resize request fell outside the configured pool bounds. The pool is left unchanged. */
public class InvalidPoolSizeException extends AnalysisPoolException {

  public InvalidPoolSizeException(int requested, int minSize, int maxSize) {
    super(
        String.format(
            "Invalid pool size %d, must be between %d and %d", requested, minSize, maxSize));
  }
}
