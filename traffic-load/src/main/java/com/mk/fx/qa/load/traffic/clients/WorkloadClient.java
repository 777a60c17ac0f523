package com.mk.fx.qa.load.traffic.clients;

import com.mk.fx.qa.load.traffic.model.Outcome;
import com.mk.fx.qa.load.traffic.model.WorkloadType;
import java.time.Duration;

/**
 * One kind of request exchange against the target host. Implementations are called concurrently
 * from every worker of their workload and must be thread-safe.
 */
public interface WorkloadClient {

  WorkloadType type();

  /**
   * Performs one request and validates the response, blocking the calling worker.
   *
   * @throws Exception any transport, status or content failure
   */
  void makeRequest() throws Exception;

  /** Runs {@link #makeRequest()} and captures its elapsed time and failure, if any. */
  default Outcome execute() {
    long start = System.nanoTime();
    try {
      makeRequest();
      return Outcome.success(Duration.ofNanos(System.nanoTime() - start));
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      return Outcome.failure(Duration.ofNanos(System.nanoTime() - start), interrupted);
    } catch (Exception ex) {
      return Outcome.failure(Duration.ofNanos(System.nanoTime() - start), ex);
    }
  }
}
