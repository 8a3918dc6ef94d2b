package com.leyline.discovery.stats;

/**
 * Totals over all timed operations.
 *
 * @param performanceTargetMet every operation averages below {@link OperationTimer#TARGET_MILLIS}
 */
public record PerformanceSummary(
    long totalOperations, double totalTimeMs, double averageTimeMs, boolean performanceTargetMet) {}
