package com.mk.fx.qa.load.traffic.executors.pool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import com.mk.fx.qa.load.traffic.clients.WorkloadClient;
import com.mk.fx.qa.load.traffic.executors.ShutdownSignal;
import com.mk.fx.qa.load.traffic.executors.dispatch.AdmissionToken;
import com.mk.fx.qa.load.traffic.model.Outcome;
import com.mk.fx.qa.load.traffic.model.WorkloadType;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class WorkerPoolTest {

  /** Client whose requests block until released. */
  private static final class GatedClient implements WorkloadClient {
    final CountDownLatch release = new CountDownLatch(1);
    final AtomicInteger calls = new AtomicInteger();
    final boolean fail;

    GatedClient(boolean fail) {
      this.fail = fail;
    }

    @Override
    public WorkloadType type() {
      return WorkloadType.BROWSE;
    }

    @Override
    public void makeRequest() throws Exception {
      calls.incrementAndGet();
      if (!release.await(5, TimeUnit.SECONDS)) {
        throw new IllegalStateException("not released");
      }
      if (fail) {
        throw new IllegalStateException("boom");
      }
    }
  }

  private static AdmissionToken token(long seq) {
    return new AdmissionToken(seq);
  }

  @Test
  void shutdown_releasesIdleWorkersPromptly_andReportsNothingAfterwards() throws Exception {
    var shutdown = new ShutdownSignal();
    List<Outcome> reported = new CopyOnWriteArrayList<>();
    var client = new GatedClient(false);
    var pool =
        new WorkerPool(
            "idle", 5, client, outcome -> !shutdown.isSignalled() && reported.add(outcome), shutdown);
    pool.start();
    await().atMost(Duration.ofSeconds(2)).until(() -> pool.getRunningWorkers() == 5);

    shutdown.signal();

    await()
        .atMost(Duration.ofMillis(500))
        .until(() -> pool.getRunningWorkers() == 0);
    assertThat(pool.awaitTermination(Duration.ofSeconds(1))).isTrue();
    assertThat(pool.tryAdmit(token(1))).isFalse();
    assertThat(reported).isEmpty();
    assertThat(client.calls.get()).isZero();
  }

  @Test
  void admittedToken_runsClientOnce_andForwardsOutcome() throws Exception {
    var shutdown = new ShutdownSignal();
    List<Outcome> reported = new CopyOnWriteArrayList<>();
    var client = new GatedClient(true);
    client.release.countDown();
    var pool = new WorkerPool("run", 2, client, reported::add, shutdown);
    pool.start();
    await().atMost(Duration.ofSeconds(2)).until(() -> pool.getRunningWorkers() == 2);

    await().atMost(Duration.ofSeconds(2)).until(() -> pool.tryAdmit(token(1)));

    await().atMost(Duration.ofSeconds(2)).until(() -> reported.size() == 1);
    assertThat(reported.get(0).errorMessage()).isEqualTo("boom");
    assertThat(pool.getCompleted()).isEqualTo(1);
    assertThat(pool.getForwarded()).isEqualTo(1);
    assertThat(client.calls.get()).isEqualTo(1);

    shutdown.signal();
    assertThat(pool.awaitTermination(Duration.ofSeconds(2))).isTrue();
  }

  @Test
  void allWorkersBusy_tokenIsRefused() throws Exception {
    var shutdown = new ShutdownSignal();
    var client = new GatedClient(false);
    var pool = new WorkerPool("busy", 1, client, outcome -> true, shutdown);
    pool.start();

    await().atMost(Duration.ofSeconds(2)).until(() -> pool.tryAdmit(token(1)));
    await().atMost(Duration.ofSeconds(2)).until(() -> pool.getBusyWorkers() == 1);

    assertThat(pool.tryAdmit(token(2))).isFalse();

    client.release.countDown();
    shutdown.signal();
    assertThat(pool.awaitTermination(Duration.ofSeconds(2))).isTrue();
    assertThat(client.calls.get()).isEqualTo(1);
  }

  @Test
  void inFlightRequest_finishesAfterShutdown() throws Exception {
    var shutdown = new ShutdownSignal();
    var client = new GatedClient(false);
    var pool = new WorkerPool("inflight", 1, client, outcome -> true, shutdown);
    pool.start();
    await().atMost(Duration.ofSeconds(2)).until(() -> pool.tryAdmit(token(1)));
    await().atMost(Duration.ofSeconds(2)).until(() -> pool.getBusyWorkers() == 1);

    shutdown.signal();
    assertThat(pool.awaitTermination(Duration.ofMillis(200))).isFalse();

    client.release.countDown();
    assertThat(pool.awaitTermination(Duration.ofSeconds(2))).isTrue();
    assertThat(pool.getCompleted()).isEqualTo(1);
  }
}
