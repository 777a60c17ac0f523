package com.mk.fx.qa.load.traffic.service;

import com.mk.fx.qa.load.traffic.clients.WorkloadClient;
import com.mk.fx.qa.load.traffic.executors.ShutdownSignal;
import com.mk.fx.qa.load.traffic.executors.dispatch.RateLimitedDispatcher;
import com.mk.fx.qa.load.traffic.executors.pool.WorkerPool;
import com.mk.fx.qa.load.traffic.metrics.ResultReporter;
import com.mk.fx.qa.load.traffic.model.WorkloadRunResult;
import com.mk.fx.qa.load.traffic.model.WorkloadType;
import java.time.Duration;
import java.util.Objects;

/** Reporter, worker pool and dispatcher of one workload, started and stopped together. */
final class WorkloadRun {

  private final WorkloadType type;
  private final ResultReporter reporter;
  private final WorkerPool pool;
  private final RateLimitedDispatcher dispatcher;

  WorkloadRun(
      WorkloadClient client,
      int ratePerSecond,
      Duration rampUp,
      int workers,
      Duration reportInterval,
      ShutdownSignal shutdown) {
    Objects.requireNonNull(client, "client");
    this.type = client.type();
    String name = type.label();
    this.reporter = new ResultReporter(name, reportInterval, shutdown);
    this.pool = new WorkerPool(name, workers, client, reporter, shutdown);
    this.dispatcher = new RateLimitedDispatcher(name, ratePerSecond, rampUp, pool, shutdown);
  }

  WorkloadType type() {
    return type;
  }

  /** Starts consumers before the producer so the first tokens find idle workers. */
  void start() {
    reporter.start();
    pool.start();
    dispatcher.start();
  }

  /**
   * Stops the workload after the shutdown signal has been raised.
   *
   * @param grace how long to wait for in-flight requests
   */
  WorkloadRunResult stop(Duration grace) throws InterruptedException {
    dispatcher.stop();
    pool.awaitTermination(grace);
    reporter.awaitTermination(grace);
    return new WorkloadRunResult(
        type,
        dispatcher.getTicks(),
        dispatcher.getAdmitted(),
        dispatcher.getSkipped(),
        dispatcher.getDropped(),
        pool.getCompleted(),
        reporter.getAccepted());
  }
}
