package com.mk.fx.qa.load.traffic.clients;

import com.mk.fx.qa.load.traffic.exceptions.LivenessCheckFailedException;
import com.mk.fx.qa.load.traffic.exceptions.UnexpectedContentException;
import com.mk.fx.qa.load.traffic.model.Outcome;
import com.mk.fx.qa.load.traffic.model.WorkloadType;
import com.mk.fx.qa.load.traffic.rest.LoadHttpClient;
import com.mk.fx.qa.load.traffic.rest.Request;
import java.util.Objects;

/** Loads the landing page and checks that it carries the UI marker. */
public class BrowseClient extends HttpWorkloadClient {

  static final String PATH = "/";

  private final String marker;

  public BrowseClient(LoadHttpClient http, String marker) {
    super(http);
    this.marker = Objects.requireNonNull(marker, "marker");
  }

  @Override
  public WorkloadType type() {
    return WorkloadType.BROWSE;
  }

  @Override
  public void makeRequest() {
    var response = send(Request.get(PATH));
    if (!response.bodyAsString().contains(marker)) {
      throw new UnexpectedContentException("page content does not match: " + marker);
    }
  }

  /**
   * One-shot probe run before any workload starts.
   *
   * @throws LivenessCheckFailedException if the landing page cannot be loaded or validated
   */
  public void checkLiveness() {
    Outcome outcome = execute();
    if (!outcome.isSuccess()) {
      throw new LivenessCheckFailedException(http.getBaseUrl(), outcome.error());
    }
  }
}
