package com.mk.fx.qa.load.traffic.metrics;

import com.mk.fx.qa.load.traffic.model.Outcome;

/** Receiver of completed request outcomes. */
@FunctionalInterface
public interface OutcomeSink {

  /**
   * Accepts an outcome without blocking.
   *
   * @return false if the sink no longer reports outcomes
   */
  boolean submit(Outcome outcome);
}
