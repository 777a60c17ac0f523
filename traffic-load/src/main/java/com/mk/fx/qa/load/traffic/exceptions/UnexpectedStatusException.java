package com.mk.fx.qa.load.traffic.exceptions;

public class UnexpectedStatusException extends WorkloadException {
  private final int statusCode;

  public UnexpectedStatusException(int statusCode) {
    super("unexpected status code: " + statusCode);
    this.statusCode = statusCode;
  }

  public int getStatusCode() {
    return statusCode;
  }
}
