package com.mk.fx.qa.load.traffic.executors.pool;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.load.traffic.clients.WorkloadClient;
import com.mk.fx.qa.load.traffic.executors.ShutdownSignal;
import com.mk.fx.qa.load.traffic.executors.dispatch.AdmissionGate;
import com.mk.fx.qa.load.traffic.executors.dispatch.AdmissionToken;
import com.mk.fx.qa.load.traffic.metrics.OutcomeSink;
import com.mk.fx.qa.load.traffic.model.Outcome;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixed set of worker threads of one workload.
 *
 * <p>Each worker waits for an admission token or the shutdown signal. A token is handed over
 * through a {@link SynchronousQueue}, so {@link #tryAdmit(AdmissionToken)} only succeeds while a
 * worker is idle and waiting. On a token the worker runs the client once and forwards the outcome.
 * Shutdown is cooperative: a request that has already started runs to completion, idle workers
 * exit within {@link #IDLE_POLL}.
 */
@Slf4j
public final class WorkerPool implements AdmissionGate {

  public static final Duration IDLE_POLL = Duration.ofMillis(50);

  private final String name;
  private final int size;
  private final WorkloadClient client;
  private final OutcomeSink sink;
  private final ShutdownSignal shutdown;

  private final SynchronousQueue<AdmissionToken> handoff = new SynchronousQueue<>();
  private final AtomicInteger runningWorkers = new AtomicInteger();
  private final AtomicInteger busyWorkers = new AtomicInteger();
  private final AtomicLong completed = new AtomicLong();
  private final AtomicLong forwarded = new AtomicLong();

  private ExecutorService executor;

  public WorkerPool(
      String name, int size, WorkloadClient client, OutcomeSink sink, ShutdownSignal shutdown) {
    this.name = Objects.requireNonNull(name, "name");
    this.size = Math.max(1, size);
    this.client = Objects.requireNonNull(client, "client");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.shutdown = Objects.requireNonNull(shutdown, "shutdown");
  }

  public synchronized void start() {
    if (executor != null) {
      throw new IllegalStateException("Worker pool " + name + " already started");
    }
    AtomicInteger index = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("worker-" + name + "-" + index.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    executor = newFixedThreadPool(size, threadFactory);
    for (int i = 0; i < size; i++) {
      executor.execute(this::runWorker);
    }
    log.debug("{}: started {} workers", name, size);
  }

  @Override
  public boolean tryAdmit(AdmissionToken token) {
    if (shutdown.isSignalled()) {
      return false;
    }
    return handoff.offer(token);
  }

  /**
   * Waits for every worker to exit after the shutdown signal. In-flight requests are not
   * interrupted; they end on their own or through the transport timeout.
   *
   * @return true if all workers exited within the timeout
   */
  public synchronized boolean awaitTermination(Duration timeout) throws InterruptedException {
    if (executor == null) {
      return true;
    }
    executor.shutdown();
    boolean terminated = executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    if (!terminated) {
      log.warn("{}: {} workers still busy after {}", name, busyWorkers.get(), timeout);
    }
    return terminated;
  }

  public int getRunningWorkers() {
    return runningWorkers.get();
  }

  public int getBusyWorkers() {
    return busyWorkers.get();
  }

  public long getCompleted() {
    return completed.get();
  }

  public long getForwarded() {
    return forwarded.get();
  }

  private void runWorker() {
    runningWorkers.incrementAndGet();
    try {
      while (!shutdown.isSignalled()) {
        AdmissionToken token = handoff.poll(IDLE_POLL.toNanos(), TimeUnit.NANOSECONDS);
        if (token == null) {
          continue;
        }
        busyWorkers.incrementAndGet();
        try {
          Outcome outcome = client.execute();
          completed.incrementAndGet();
          if (sink.submit(outcome)) {
            forwarded.incrementAndGet();
          }
        } catch (RuntimeException ex) {
          log.error("{}: worker {} failed to run request {}: {}",
              name, Thread.currentThread().getName(), token.sequence(), ex.getMessage(), ex);
        } finally {
          busyWorkers.decrementAndGet();
        }
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.debug("{}: worker {} interrupted", name, Thread.currentThread().getName());
    } finally {
      runningWorkers.decrementAndGet();
    }
  }
}
