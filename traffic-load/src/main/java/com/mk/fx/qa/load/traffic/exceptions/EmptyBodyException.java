package com.mk.fx.qa.load.traffic.exceptions;

public class EmptyBodyException extends WorkloadException {

  public EmptyBodyException() {
    super("download returned empty body");
  }
}
