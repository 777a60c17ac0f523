package com.mk.fx.qa.load.traffic.exceptions;

/** The pre-run probe of the target host failed; the run cannot start. */
public class LivenessCheckFailedException extends RuntimeException {

  public LivenessCheckFailedException(String targetHost, Throwable cause) {
    super("failed to check host " + targetHost + ": " + cause.getMessage(), cause);
  }
}
