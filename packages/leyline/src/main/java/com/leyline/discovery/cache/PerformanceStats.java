package com.leyline.discovery.cache;

import com.leyline.discovery.ScanStatistics;
import com.leyline.discovery.stats.OperationMetrics;
import com.leyline.discovery.stats.PerformanceSummary;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time view of cache effectiveness.
 *
 * <p>{@code hitRatio} is file-level: a hit is a file found unchanged during a freshness check, a
 * miss is a file that had to be scanned. {@code indexServedRatio} is query-level: the share of
 * queries answered without scanning anything.
 */
public record PerformanceStats(
    double hitRatio,
    long hitCount,
    long missCount,
    long scanCount,
    int documentCount,
    int categoryCount,
    long memoryUsage,
    long maxMemoryBytes,
    long evictionCount,
    CompressionStats compressionStats,
    long indexServedQueries,
    long rescanningQueries,
    double indexServedRatio,
    Instant lastScan,
    WarmupState warmupState,
    ScanStatistics scanner,
    Map<String, OperationMetrics> operationMetrics,
    PerformanceSummary summary) {

  public PerformanceStats {
    operationMetrics = Collections.unmodifiableMap(new LinkedHashMap<>(operationMetrics));
  }

  static double ratio(long part, long other) {
    long total = part + other;
    return total == 0 ? 0.0 : (double) part / total;
  }
}
