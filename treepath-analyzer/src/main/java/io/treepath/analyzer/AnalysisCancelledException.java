package io.treepath.analyzer;

/** Thrown when an analysis is cancelled; no partial result is produced. */
public final class AnalysisCancelledException extends RuntimeException {

  public AnalysisCancelledException(String message) {
    super(message);
  }

  public AnalysisCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
