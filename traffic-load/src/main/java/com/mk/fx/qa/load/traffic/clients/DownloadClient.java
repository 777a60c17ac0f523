package com.mk.fx.qa.load.traffic.clients;

import com.mk.fx.qa.load.traffic.exceptions.EmptyBodyException;
import com.mk.fx.qa.load.traffic.exceptions.NoDownloadTargetsException;
import com.mk.fx.qa.load.traffic.model.WorkloadType;
import com.mk.fx.qa.load.traffic.rest.LoadHttpClient;
import com.mk.fx.qa.load.traffic.rest.Request;
import java.util.Objects;
import java.util.Random;

/**
 * Downloads a path taken from the shared ring. The path is put back so later cycles can reuse it,
 * and a small share of thumbnail downloads is redirected to the full-size image.
 */
public class DownloadClient extends HttpWorkloadClient {

  static final String THUMBNAIL_PREFIX = "/download/thumbnail_";
  static final String FULL_SIZE_PREFIX = "/download/";

  private final DiscoveredIdRing ring;
  private final int fullSizePercent;
  private final Random random;

  public DownloadClient(
      LoadHttpClient http, DiscoveredIdRing ring, int fullSizePercent, Random random) {
    super(http);
    if (fullSizePercent < 0 || fullSizePercent > 100) {
      throw new IllegalArgumentException("fullSizePercent must be between 0 and 100");
    }
    this.ring = Objects.requireNonNull(ring, "ring");
    this.fullSizePercent = fullSizePercent;
    this.random = Objects.requireNonNull(random, "random");
  }

  @Override
  public WorkloadType type() {
    return WorkloadType.DOWNLOAD;
  }

  @Override
  public void makeRequest() {
    String path = ring.poll().orElseThrow(NoDownloadTargetsException::new);
    ring.offer(path);

    var response = send(Request.get(resolvePath(path)));
    if (response.bodyLength() == 0) {
      throw new EmptyBodyException();
    }
  }

  String resolvePath(String path) {
    if (path.startsWith(THUMBNAIL_PREFIX) && random.nextInt(100) < fullSizePercent) {
      return FULL_SIZE_PREFIX + path.substring(THUMBNAIL_PREFIX.length());
    }
    return path;
  }
}
