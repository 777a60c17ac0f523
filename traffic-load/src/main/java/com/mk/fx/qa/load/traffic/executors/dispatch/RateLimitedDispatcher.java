package com.mk.fx.qa.load.traffic.executors.dispatch;

import static java.util.concurrent.Executors.newSingleThreadScheduledExecutor;

import com.mk.fx.qa.load.traffic.executors.ShutdownSignal;
import java.time.Duration;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Emits admission tokens for one workload at a fixed rate.
 *
 * <p>A single scheduler thread ticks every {@code 1s / rate}. While the ramp-up window is open a
 * tick is admitted with the probability given by {@link RampUpSchedule}. An admitted token is
 * offered to the {@link AdmissionGate} without blocking; when no executor is idle the token is
 * dropped, so throughput is capped by the pool size and nothing queues up under overload.
 */
@Slf4j
public final class RateLimitedDispatcher {

  private final String name;
  private final int ratePerSecond;
  private final Duration rampUp;
  private final AdmissionGate gate;
  private final ShutdownSignal shutdown;
  private final Random random;
  private final LongSupplier nanoClock;

  private final AtomicLong ticks = new AtomicLong();
  private final AtomicLong admitted = new AtomicLong();
  private final AtomicLong skipped = new AtomicLong();
  private final AtomicLong dropped = new AtomicLong();

  private ScheduledExecutorService scheduler;
  private RampUpSchedule schedule;

  public RateLimitedDispatcher(
      String name, int ratePerSecond, Duration rampUp, AdmissionGate gate, ShutdownSignal shutdown) {
    this(name, ratePerSecond, rampUp, gate, shutdown, new Random(), System::nanoTime);
  }

  RateLimitedDispatcher(
      String name,
      int ratePerSecond,
      Duration rampUp,
      AdmissionGate gate,
      ShutdownSignal shutdown,
      Random random,
      LongSupplier nanoClock) {
    if (ratePerSecond <= 0) {
      throw new IllegalArgumentException("ratePerSecond must be > 0");
    }
    this.name = Objects.requireNonNull(name, "name");
    this.ratePerSecond = ratePerSecond;
    this.rampUp = Objects.requireNonNull(rampUp, "rampUp");
    if (rampUp.isNegative()) {
      throw new IllegalArgumentException("rampUp must not be negative");
    }
    this.gate = Objects.requireNonNull(gate, "gate");
    this.shutdown = Objects.requireNonNull(shutdown, "shutdown");
    this.random = Objects.requireNonNull(random, "random");
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
  }

  public synchronized void start() {
    if (scheduler != null) {
      throw new IllegalStateException("Dispatcher " + name + " already started");
    }
    log.info("{}: starting load test with {} requests per second", name, ratePerSecond);

    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("dispatcher-" + name);
          thread.setDaemon(true);
          return thread;
        };
    scheduler = newSingleThreadScheduledExecutor(threadFactory);
    schedule = new RampUpSchedule(nanoClock.getAsLong(), rampUp, random);

    long periodNanos = periodNanos();
    scheduler.scheduleAtFixedRate(this::safeTick, periodNanos, periodNanos, TimeUnit.NANOSECONDS);
  }

  /** Stops ticking. Tokens already handed out are unaffected. */
  public synchronized void stop() throws InterruptedException {
    if (scheduler == null) {
      return;
    }
    scheduler.shutdownNow();
    if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
      log.warn("{}: dispatcher thread did not stop within 5s", name);
    }
  }

  long periodNanos() {
    return Math.max(1, TimeUnit.SECONDS.toNanos(1) / ratePerSecond);
  }

  private void safeTick() {
    try {
      tick();
    } catch (RuntimeException ex) {
      // an exception escaping here would silently cancel the periodic task
      log.error("{}: dispatcher tick failed: {}", name, ex.getMessage(), ex);
    }
  }

  void tick() {
    if (shutdown.isSignalled()) {
      return;
    }
    long sequence = ticks.incrementAndGet();
    long now = nanoClock.getAsLong();

    switch (schedule.evaluate(now)) {
      case SKIP -> {
        skipped.incrementAndGet();
        return;
      }
      case RAMP_COMPLETED -> log.info("{}: rampup done", name);
      case ADMIT -> {}
    }

    if (gate.tryAdmit(new AdmissionToken(sequence))) {
      admitted.incrementAndGet();
    } else {
      dropped.incrementAndGet();
    }
  }

  /** Prepares the ramp-up schedule without starting the scheduler thread. */
  void prepareSchedule(long startNanos) {
    schedule = new RampUpSchedule(startNanos, rampUp, random);
  }

  public String getName() {
    return name;
  }

  public long getTicks() {
    return ticks.get();
  }

  public long getAdmitted() {
    return admitted.get();
  }

  public long getSkipped() {
    return skipped.get();
  }

  public long getDropped() {
    return dropped.get();
  }
}
