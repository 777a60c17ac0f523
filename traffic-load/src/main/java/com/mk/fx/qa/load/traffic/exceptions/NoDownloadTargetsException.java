package com.mk.fx.qa.load.traffic.exceptions;

public class NoDownloadTargetsException extends WorkloadException {

  public NoDownloadTargetsException() {
    super("no download urls found");
  }
}
