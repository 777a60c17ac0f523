package com.mk.fx.qa.load.traffic.exceptions;

/** Base type of the per-request failures a workload client reports in its outcome. */
public abstract class WorkloadException extends RuntimeException {

  protected WorkloadException(String message) {
    super(message);
  }

  protected WorkloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
