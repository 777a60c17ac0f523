package com.mk.fx.qa.load.traffic.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of one executed request.
 *
 * @param elapsed wall-clock time spent in the request
 * @param error failure cause, or {@code null} on success
 */
public record Outcome(Duration elapsed, Throwable error) {

  public Outcome {
    Objects.requireNonNull(elapsed, "elapsed");
  }

  public static Outcome success(Duration elapsed) {
    return new Outcome(elapsed, null);
  }

  public static Outcome failure(Duration elapsed, Throwable error) {
    return new Outcome(elapsed, Objects.requireNonNull(error, "error"));
  }

  public boolean isSuccess() {
    return error == null;
  }

  /** Message the reporter groups errors by. */
  public String errorMessage() {
    if (error == null) {
      return null;
    }
    String message = error.getMessage();
    return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
  }
}
