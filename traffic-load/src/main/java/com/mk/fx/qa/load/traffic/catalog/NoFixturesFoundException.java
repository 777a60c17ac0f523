package com.mk.fx.qa.load.traffic.catalog;

import java.nio.file.Path;

/** The fixture scan finished without error but matched no image file. */
public class NoFixturesFoundException extends RuntimeException {

  public NoFixturesFoundException(Path root) {
    super("no image files found under " + root);
  }
}
