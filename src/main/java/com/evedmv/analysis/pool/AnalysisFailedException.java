package com.evedmv.analysis.pool;

/**
 * The analysis ran and threw. The original exception is the cause.
 *
 * <p>Kept outside the {@link AnalysisPoolException} hierarchy so callers can tell "my job ran and
 * failed" apart from "the pool could not run my job".
 */
public class AnalysisFailedException extends RuntimeException {

  private final String kind;
  private final String subjectId;

  public AnalysisFailedException(String kind, String subjectId, Throwable cause) {
    super("Analysis " + kind + ":" + subjectId + " failed: " + describe(cause), cause);
    this.kind = kind;
    this.subjectId = subjectId;
  }

  public String getKind() {
    return kind;
  }

  public String getSubjectId() {
    return subjectId;
  }

  /** {@code cause.toString()}, or the class name when the cause cannot render its own message. */
  static String describe(Throwable cause) {
    try {
      return String.valueOf(cause);
    } catch (RuntimeException e) {
      return cause.getClass().getName() + " (message unavailable: " + e.getClass().getName() + ")";
    }
  }
}
