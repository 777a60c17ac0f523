package com.mk.fx.qa.load.traffic.executors;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot stop broadcast shared by every dispatcher, worker and reporter of a run. Observers poll
 * {@link #isSignalled()} or block in {@link #await(Duration)}; nothing is interrupted.
 */
public final class ShutdownSignal {
  private final CountDownLatch latch = new CountDownLatch(1);
  private final AtomicBoolean signalled = new AtomicBoolean(false);

  /** Broadcasts the signal. Returns {@code true} only for the call that actually raised it. */
  public boolean signal() {
    boolean first = signalled.compareAndSet(false, true);
    latch.countDown();
    return first;
  }

  public boolean isSignalled() {
    return signalled.get();
  }

  /**
   * Waits until the signal is raised or the timeout elapses.
   *
   * @return true if the signal was raised
   */
  public boolean await(Duration timeout) throws InterruptedException {
    return latch.await(Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS);
  }
}
