package com.leyline.discovery.stats;

import java.util.List;

/**
 * Timing aggregate for one named operation, in microseconds.
 *
 * @param recentMicros up to the ten most recent timings, oldest first
 */
public record OperationMetrics(
    long count,
    long totalMicros,
    long minMicros,
    long maxMicros,
    double averageMicros,
    List<Long> recentMicros) {

  public OperationMetrics {
    recentMicros = List.copyOf(recentMicros);
  }
}
