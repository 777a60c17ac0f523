package com.mk.fx.qa.load.traffic.executors.dispatch;

/** Receiver of admission tokens. */
@FunctionalInterface
public interface AdmissionGate {

  /**
   * Hands the token to an idle executor without blocking.
   *
   * @return false if nobody could take the token right now; the token is then discarded
   */
  boolean tryAdmit(AdmissionToken token);
}
