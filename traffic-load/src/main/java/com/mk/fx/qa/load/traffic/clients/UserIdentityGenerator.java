package com.mk.fx.qa.load.traffic.clients;

import java.util.Random;

/** Produces synthetic user names {@code user1 .. user<count>}, uniformly at random. */
public final class UserIdentityGenerator {
  private final int userCount;
  private final Random random;

  public UserIdentityGenerator(int userCount, Random random) {
    if (userCount <= 0) {
      throw new IllegalArgumentException("userCount must be > 0");
    }
    this.userCount = userCount;
    this.random = random;
  }

  public String next() {
    return "user" + (random.nextInt(userCount) + 1);
  }
}
