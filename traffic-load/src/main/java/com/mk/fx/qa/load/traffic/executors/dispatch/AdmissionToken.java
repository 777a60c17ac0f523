package com.mk.fx.qa.load.traffic.executors.dispatch;

/**
 * Permission for one worker to start one request.
 *
 * @param sequence tick number that produced the token, starting at 1
 */
public record AdmissionToken(long sequence) {}
