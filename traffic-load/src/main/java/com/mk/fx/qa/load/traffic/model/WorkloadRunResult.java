package com.mk.fx.qa.load.traffic.model;

/**
 * Counters of a finished workload run.
 *
 * @param type the workload
 * @param ticks dispatcher ticks fired
 * @param admitted tokens handed to a worker
 * @param skipped ticks not admitted during ramp-up
 * @param dropped admitted ticks discarded because no worker was idle
 * @param completed requests that ran to completion
 * @param reported outcomes accepted by the reporter
 */
public record WorkloadRunResult(
    WorkloadType type,
    long ticks,
    long admitted,
    long skipped,
    long dropped,
    long completed,
    long reported) {}
