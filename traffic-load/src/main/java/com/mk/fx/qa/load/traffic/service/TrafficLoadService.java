package com.mk.fx.qa.load.traffic.service;

import com.mk.fx.qa.load.traffic.catalog.FixtureCatalog;
import com.mk.fx.qa.load.traffic.catalog.NoFixturesFoundException;
import com.mk.fx.qa.load.traffic.cfg.TrafficLoadCfg;
import com.mk.fx.qa.load.traffic.clients.BrowseClient;
import com.mk.fx.qa.load.traffic.clients.DiscoveredIdRing;
import com.mk.fx.qa.load.traffic.clients.DownloadClient;
import com.mk.fx.qa.load.traffic.clients.SearchClient;
import com.mk.fx.qa.load.traffic.clients.UploadClient;
import com.mk.fx.qa.load.traffic.clients.UserIdentityGenerator;
import com.mk.fx.qa.load.traffic.clients.WorkloadClient;
import com.mk.fx.qa.load.traffic.exceptions.LivenessCheckFailedException;
import com.mk.fx.qa.load.traffic.executors.ShutdownSignal;
import com.mk.fx.qa.load.traffic.model.WorkloadRunResult;
import com.mk.fx.qa.load.traffic.model.WorkloadType;
import com.mk.fx.qa.load.traffic.rest.LoadHttpClient;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the synthetic traffic test.
 *
 * <p>Lifecycle of {@link #run()}:
 * - loads the fixture catalog and probes the target host; both failures are fatal and happen
 *   before any traffic is sent.
 * - starts one reporter, worker pool and dispatcher per workload with a positive rate. All
 *   workloads share a single {@link ShutdownSignal} and the ring of discovered download paths.
 * - waits for {@code rampup_time + test_duration}, or until {@link #stop()} is called, then
 *   broadcasts shutdown and waits for in-flight requests to return.
 */
@Slf4j
@Service
public class TrafficLoadService {

  /** Extra wait on top of the request timeout before giving up on in-flight requests. */
  private static final Duration STOP_MARGIN = Duration.ofSeconds(5);

  private final TrafficLoadCfg cfg;
  private final LoadHttpClient http;
  private final ShutdownSignal shutdown = new ShutdownSignal();

  public TrafficLoadService(TrafficLoadCfg cfg, LoadHttpClient http) {
    this.cfg = Objects.requireNonNull(cfg, "cfg");
    this.http = Objects.requireNonNull(http, "http");
  }

  /**
   * Executes the whole run.
   *
   * @return counters of every started workload, in start order
   * @throws IOException if the fixture corpus cannot be read
   * @throws NoFixturesFoundException if the corpus holds no image
   * @throws LivenessCheckFailedException if the target host fails the probe
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public List<WorkloadRunResult> run() throws IOException, InterruptedException {
    FixtureCatalog catalog = FixtureCatalog.load(Path.of(cfg.getImagesPath()));
    log.info("loaded {} images from: {}", catalog.size(), cfg.getImagesPath());

    new BrowseClient(http, cfg.getLivenessMarker()).checkLiveness();
    log.info("target host is alive: {}", cfg.getTargetHost());

    var ring = new DiscoveredIdRing(cfg.getDownloadRingCapacity());
    List<WorkloadRun> runs = new ArrayList<>();
    List<WorkloadRunResult> results = new ArrayList<>();
    try {
      for (WorkloadType type : WorkloadType.values()) {
        int rate = cfg.rateFor(type);
        if (rate <= 0) {
          log.info("{}: disabled", type.label());
          continue;
        }
        var run =
            new WorkloadRun(
                createClient(type, catalog, ring),
                rate,
                cfg.getRampupTime(),
                cfg.getWorkers(),
                cfg.getReportInterval(),
                shutdown);
        runs.add(run);
        run.start();
      }

      Duration total = cfg.getRampupTime().plus(cfg.getTestDuration());
      if (shutdown.await(total)) {
        log.info("Shutdown requested before the configured {} elapsed", total);
      }
    } finally {
      shutdown.signal();
      Duration grace = cfg.getRequestTimeout().plus(STOP_MARGIN);
      for (WorkloadRun run : runs) {
        results.add(run.stop(grace));
      }
    }

    results.forEach(
        result ->
            log.info(
                "{}: finished - ticks={} admitted={} skipped={} dropped={} completed={}",
                result.type().label(),
                result.ticks(),
                result.admitted(),
                result.skipped(),
                result.dropped(),
                result.completed()));
    return List.copyOf(results);
  }

  /** Requests an early end of a running test. */
  @PreDestroy
  public void stop() {
    if (shutdown.signal()) {
      log.info("Stopping load test");
    }
  }

  public boolean isStopped() {
    return shutdown.isSignalled();
  }

  WorkloadClient createClient(WorkloadType type, FixtureCatalog catalog, DiscoveredIdRing ring) {
    var random = new Random();
    return switch (type) {
      case UPLOAD ->
          new UploadClient(
              http, catalog, new UserIdentityGenerator(cfg.getUserCount(), random), random);
      case BROWSE -> new BrowseClient(http, cfg.getLivenessMarker());
      case SEARCH -> new SearchClient(http, catalog.categories(), ring, random);
      case DOWNLOAD -> new DownloadClient(http, ring, cfg.getFullSizeDownloadPercent(), random);
    };
  }
}
