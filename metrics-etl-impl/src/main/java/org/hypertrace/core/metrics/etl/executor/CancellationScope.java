package org.hypertrace.core.metrics.etl.executor;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal shared between a caller and running invocations. Once cancelled
 * it stays cancelled.
 */
public class CancellationScope {
  private final CountDownLatch cancelled = new CountDownLatch(1);

  public void cancel() {
    cancelled.countDown();
  }

  public boolean isCancelled() {
    return cancelled.getCount() == 0;
  }

  /**
   * Blocks for up to {@code timeout}, returning early if the scope is cancelled.
   *
   * @return true if the scope was cancelled before the timeout elapsed
   */
  public boolean awaitCancellation(Duration timeout) throws InterruptedException {
    return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }
}
