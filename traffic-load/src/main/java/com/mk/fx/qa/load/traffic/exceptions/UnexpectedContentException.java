package com.mk.fx.qa.load.traffic.exceptions;

/** The response arrived with a success status but its body did not have the expected shape. */
public class UnexpectedContentException extends WorkloadException {

  public UnexpectedContentException(String message) {
    super(message);
  }

  public UnexpectedContentException(String message, Throwable cause) {
    super(message, cause);
  }
}
