package io.treepath.analyzer;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for a running analysis. The analyzer checks it before and while
 * waiting for every model lookup.
 */
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  /** A fresh token that nobody else holds. */
  public static CancellationToken none() {
    return new CancellationToken();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * @throws AnalysisCancelledException if {@link #cancel()} has been called
   */
  public void throwIfCancelled() {
    if (cancelled.get()) {
      throw new AnalysisCancelledException("Analysis cancelled");
    }
  }
}
