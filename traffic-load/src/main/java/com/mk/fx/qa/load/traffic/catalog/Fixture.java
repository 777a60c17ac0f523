package com.mk.fx.qa.load.traffic.catalog;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * An image file of the corpus.
 *
 * @param path location of the image
 * @param category name of the directory holding the image
 */
public record Fixture(Path path, String category) {

  public Fixture {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(category, "category");
  }

  public String fileName() {
    return path.getFileName().toString();
  }

  public String contentType() {
    String name = fileName().toLowerCase(Locale.ROOT);
    if (name.endsWith(".png")) {
      return "image/png";
    }
    if (name.endsWith(".gif")) {
      return "image/gif";
    }
    if (name.endsWith(".jpg") || name.endsWith(".jpeg")) {
      return "image/jpeg";
    }
    return "application/octet-stream";
  }
}
