package com.mk.fx.qa.load.traffic.catalog;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * Immutable set of image fixtures discovered under a root directory, grouped by the name of the
 * directory that holds each file.
 */
@Slf4j
public final class FixtureCatalog {

  /** Category that searches without a keyword filter. */
  public static final String NO_FILTER = "";

  private static final Set<String> IMAGE_EXTENSIONS = Set.of(".jpg", ".jpeg", ".gif", ".png");

  private final List<Fixture> fixtures;
  private final List<String> categories;

  private FixtureCatalog(List<Fixture> fixtures) {
    this.fixtures = List.copyOf(fixtures);
    Set<String> distinct = new LinkedHashSet<>();
    distinct.add(NO_FILTER);
    fixtures.forEach(fixture -> distinct.add(fixture.category()));
    this.categories = List.copyOf(distinct);
  }

  /**
   * Scans {@code root} recursively for image files.
   *
   * @param root corpus root
   * @return the loaded catalog, never empty
   * @throws IOException if the tree cannot be read
   * @throws NoFixturesFoundException if the scan matched no image file
   */
  public static FixtureCatalog load(Path root) throws IOException {
    Objects.requireNonNull(root, "root");
    List<Fixture> found = new ArrayList<>();
    try (Stream<Path> paths = Files.walk(root)) {
      paths
          .filter(Files::isRegularFile)
          .filter(FixtureCatalog::isImage)
          .sorted()
          .forEach(path -> found.add(new Fixture(path, categoryOf(path))));
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
    if (found.isEmpty()) {
      throw new NoFixturesFoundException(root);
    }
    log.debug("Discovered {} fixtures under {}", found.size(), root);
    return new FixtureCatalog(found);
  }

  public List<Fixture> fixtures() {
    return fixtures;
  }

  /** Distinct categories in discovery order, led by {@link #NO_FILTER}. */
  public List<String> categories() {
    return categories;
  }

  public int size() {
    return fixtures.size();
  }

  public Fixture randomFixture(Random random) {
    return fixtures.get(random.nextInt(fixtures.size()));
  }

  public String randomCategory(Random random) {
    return categories.get(random.nextInt(categories.size()));
  }

  private static boolean isImage(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot >= 0 && IMAGE_EXTENSIONS.contains(name.substring(dot));
  }

  private static String categoryOf(Path path) {
    Path parent = path.toAbsolutePath().getParent();
    if (parent == null || parent.getFileName() == null) {
      return NO_FILTER;
    }
    return parent.getFileName().toString();
  }
}
