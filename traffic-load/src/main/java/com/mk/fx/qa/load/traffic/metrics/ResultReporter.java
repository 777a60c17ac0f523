package com.mk.fx.qa.load.traffic.metrics;

import static java.util.concurrent.Executors.newSingleThreadExecutor;

import com.mk.fx.qa.load.traffic.executors.ShutdownSignal;
import com.mk.fx.qa.load.traffic.model.Outcome;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Aggregates the outcomes of one workload and publishes a {@link WindowSummary} every reporting
 * interval.
 *
 * <p>Workers hand outcomes over through a non-blocking inbox; the aggregation window itself is
 * only touched by the reporter thread. The window is cleared after every flush, whether or not it
 * held any outcome. On shutdown the reporter stops without a final flush and rejects further
 * outcomes.
 */
@Slf4j
public final class ResultReporter implements OutcomeSink {

  static final Duration IDLE_POLL = Duration.ofMillis(50);

  private final String name;
  private final Duration interval;
  private final ShutdownSignal shutdown;
  private final Consumer<WindowSummary> publisher;

  private final BlockingQueue<Outcome> inbox = new LinkedBlockingQueue<>();
  private final List<Outcome> window = new ArrayList<>();
  private final AtomicLong accepted = new AtomicLong();
  private final AtomicLong flushes = new AtomicLong();

  private volatile boolean stopped;
  private ExecutorService executor;

  public ResultReporter(String name, Duration interval, ShutdownSignal shutdown) {
    this(name, interval, shutdown, ResultReporter::logSummary);
  }

  public ResultReporter(
      String name, Duration interval, ShutdownSignal shutdown, Consumer<WindowSummary> publisher) {
    this.name = Objects.requireNonNull(name, "name");
    this.interval = Objects.requireNonNull(interval, "interval");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("Reporting interval must be positive");
    }
    this.shutdown = Objects.requireNonNull(shutdown, "shutdown");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
  }

  public synchronized void start() {
    if (executor != null) {
      throw new IllegalStateException("Reporter " + name + " already started");
    }
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("reporter-" + name);
          thread.setDaemon(true);
          return thread;
        };
    executor = newSingleThreadExecutor(threadFactory);
    executor.execute(this::runLoop);
  }

  @Override
  public boolean submit(Outcome outcome) {
    Objects.requireNonNull(outcome, "outcome");
    if (stopped || shutdown.isSignalled()) {
      return false;
    }
    inbox.offer(outcome);
    accepted.incrementAndGet();
    return true;
  }

  /** Waits for the reporter thread to observe the shutdown signal and exit. */
  public synchronized boolean awaitTermination(Duration timeout) throws InterruptedException {
    if (executor == null) {
      return true;
    }
    executor.shutdown();
    boolean terminated = executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    if (!terminated) {
      log.warn("{}: reporter did not stop within {}", name, timeout);
    }
    return terminated;
  }

  public long getAccepted() {
    return accepted.get();
  }

  public long getFlushes() {
    return flushes.get();
  }

  public boolean isStopped() {
    return stopped;
  }

  private void runLoop() {
    long intervalNanos = interval.toNanos();
    long windowStart = System.nanoTime();
    try {
      while (!shutdown.isSignalled()) {
        long now = System.nanoTime();
        long remaining = windowStart + intervalNanos - now;
        if (remaining <= 0) {
          flush(Duration.ofNanos(now - windowStart));
          windowStart = now;
          continue;
        }
        Outcome outcome =
            inbox.poll(Math.min(remaining, IDLE_POLL.toNanos()), TimeUnit.NANOSECONDS);
        if (outcome != null) {
          window.add(outcome);
          inbox.drainTo(window);
        }
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
    } finally {
      stopped = true;
      int discarded = window.size() + inbox.size();
      window.clear();
      inbox.clear();
      log.debug("{}: reporter stopped, {} unreported outcomes discarded", name, discarded);
    }
  }

  private void flush(Duration elapsed) {
    WindowSummary summary = WindowSummary.of(name, elapsed, window);
    window.clear();
    flushes.incrementAndGet();
    try {
      publisher.accept(summary);
    } catch (RuntimeException ex) {
      log.error("{}: failed to publish window summary: {}", name, ex.getMessage(), ex);
    }
  }

  static void logSummary(WindowSummary summary) {
    summary.toLogLines().forEach(log::info);
  }
}
