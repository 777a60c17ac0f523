package com.mk.fx.qa.load.traffic.metrics;

import com.mk.fx.qa.load.traffic.model.Outcome;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate of one reporting window of a workload.
 *
 * @param name workload label used as log prefix
 * @param interval wall-clock length of the window
 * @param count outcomes in the window
 * @param errorCount failed outcomes in the window
 * @param average mean duration, truncated to whole milliseconds; zero for an empty window
 * @param p99 duration at sorted index {@code floor(count * 0.99)}; zero for an empty window
 * @param errors occurrences per error message, in order of first occurrence
 */
public record WindowSummary(
    String name,
    Duration interval,
    int count,
    long errorCount,
    Duration average,
    Duration p99,
    Map<String, Long> errors) {

  public WindowSummary {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(interval, "interval");
    errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
  }

  public static WindowSummary of(String name, Duration interval, List<Outcome> outcomes) {
    List<Duration> durations = new ArrayList<>(outcomes.size());
    Map<String, Long> errors = new LinkedHashMap<>();
    long totalMillis = 0;
    long errorCount = 0;
    for (Outcome outcome : outcomes) {
      durations.add(outcome.elapsed());
      totalMillis += outcome.elapsed().toMillis();
      if (!outcome.isSuccess()) {
        errors.merge(outcome.errorMessage(), 1L, Long::sum);
        errorCount++;
      }
    }
    durations.sort(Comparator.naturalOrder());

    int count = durations.size();
    Duration average = count == 0 ? Duration.ZERO : Duration.ofMillis(totalMillis / count);
    Duration p99 = count == 0 ? Duration.ZERO : percentile99(durations);
    return new WindowSummary(
        name, interval, count, errorCount, average, p99, errors);
  }

  /** Value at index {@code floor(size * 0.99)} of an ascending, non-empty list. */
  public static Duration percentile99(List<Duration> sorted) {
    if (sorted.isEmpty()) {
      throw new IllegalArgumentException("Percentile of an empty window is undefined");
    }
    return sorted.get(sorted.size() * 99 / 100);
  }

  /** Requests per second over the window. */
  public double throughput() {
    double seconds = interval.toNanos() / 1_000_000_000.0;
    return seconds <= 0 ? 0.0 : count / seconds;
  }

  public boolean isEmpty() {
    return count == 0;
  }

  /** The summary line followed by one line per distinct error message. */
  public List<String> toLogLines() {
    List<String> lines = new ArrayList<>();
    var summary = new StringBuilder(String.format(Locale.ROOT, "%s: %.1f req/s", name, throughput()));
    if (count > 0) {
      summary.append(
          String.format(
              Locale.ROOT,
              ", avg %dms, p99 %dms, %d errors",
              average.toMillis(),
              p99.toMillis(),
              errorCount));
    }
    lines.add(summary.toString());
    errors.forEach(
        (message, times) ->
            lines.add(
                times == 1
                    ? name + ": " + message
                    : name + ": " + message + " (" + times + " times)"));
    return lines;
  }
}
