package com.mk.fx.qa.load.traffic.model;

/** The classes of synthetic traffic, in the order they are started. */
public enum WorkloadType {
  UPLOAD("upload"),
  BROWSE("ui"),
  SEARCH("search"),
  DOWNLOAD("download");

  private final String label;

  WorkloadType(String label) {
    this.label = label;
  }

  /** Short name used as the prefix of every log line of the workload. */
  public String label() {
    return label;
  }
}
