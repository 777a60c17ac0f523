package com.mk.fx.qa.load.traffic.clients;

import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Bounded pool of download paths found by the search workload and consumed by the download
 * workload. Both sides only use non-blocking operations: a full ring drops new items and an empty
 * ring yields nothing. Items carry no ordering or uniqueness guarantee.
 */
public final class DiscoveredIdRing {

  public static final int DEFAULT_CAPACITY = 1000;

  private final BlockingQueue<String> items;
  private final int capacity;

  public DiscoveredIdRing() {
    this(DEFAULT_CAPACITY);
  }

  public DiscoveredIdRing(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.capacity = capacity;
    this.items = new ArrayBlockingQueue<>(capacity);
  }

  /** Adds an item unless the ring is full; returns whether it was added. */
  public boolean offer(String id) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("id must not be blank");
    }
    return items.offer(id);
  }

  public Optional<String> poll() {
    return Optional.ofNullable(items.poll());
  }

  public int size() {
    return items.size();
  }

  public int capacity() {
    return capacity;
  }
}
