package com.mk.fx.qa.load.traffic.executors.dispatch;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Linear warm-up of the admission probability: a tick at elapsed fraction {@code f} of the ramp
 * window is admitted with probability {@code f}, and every tick after the window is admitted.
 *
 * <p>Not thread-safe; owned by the single dispatcher thread of a workload.
 */
public final class RampUpSchedule {

  /** Decision for one tick. */
  public enum Admission {
    ADMIT,
    SKIP,
    /** First tick past the ramp window; admitted. */
    RAMP_COMPLETED
  }

  private final long startNanos;
  private final long rampNanos;
  private final Random random;
  private boolean completed;

  public RampUpSchedule(long startNanos, Duration rampUp, Random random) {
    Objects.requireNonNull(rampUp, "rampUp");
    if (rampUp.isNegative()) {
      throw new IllegalArgumentException("rampUp must not be negative");
    }
    this.startNanos = startNanos;
    this.rampNanos = rampUp.toNanos();
    this.random = Objects.requireNonNull(random, "random");
    this.completed = rampUp.isZero();
  }

  public Admission evaluate(long nowNanos) {
    if (completed) {
      return Admission.ADMIT;
    }
    long elapsed = nowNanos - startNanos;
    if (elapsed >= rampNanos) {
      completed = true;
      return Admission.RAMP_COMPLETED;
    }
    return random.nextInt(100) < percentElapsed(elapsed) ? Admission.ADMIT : Admission.SKIP;
  }

  public boolean isCompleted() {
    return completed;
  }

  /** Whole percent of the ramp window covered by {@code elapsed}, clamped to [0, 100]. */
  int percentElapsed(long elapsedNanos) {
    if (rampNanos == 0 || elapsedNanos >= rampNanos) {
      return 100;
    }
    if (elapsedNanos <= 0) {
      return 0;
    }
    // elapsed * 100 overflows a long beyond roughly 2.9 years of ramp-up
    return (int) (elapsedNanos / (double) rampNanos * 100);
  }
}
