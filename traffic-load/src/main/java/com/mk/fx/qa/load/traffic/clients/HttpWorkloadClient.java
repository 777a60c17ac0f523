package com.mk.fx.qa.load.traffic.clients;

import com.mk.fx.qa.load.traffic.exceptions.UnexpectedStatusException;
import com.mk.fx.qa.load.traffic.rest.LoadHttpClient;
import com.mk.fx.qa.load.traffic.rest.Request;
import com.mk.fx.qa.load.traffic.rest.RestResponseData;
import java.util.Objects;

/** Common plumbing of the clients that talk to the target over HTTP. */
abstract class HttpWorkloadClient implements WorkloadClient {

  protected final LoadHttpClient http;

  protected HttpWorkloadClient(LoadHttpClient http) {
    this.http = Objects.requireNonNull(http, "http");
  }

  /** Sends the request and fails unless the status is 2xx. */
  protected RestResponseData send(Request request) {
    RestResponseData response = http.execute(request);
    if (!response.isSuccessful()) {
      throw new UnexpectedStatusException(response.getStatusCode());
    }
    return response;
  }
}
