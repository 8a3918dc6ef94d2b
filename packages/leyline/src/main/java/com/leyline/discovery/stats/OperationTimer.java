package com.leyline.discovery.stats;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Records per-operation latencies. Each operation keeps running totals plus a bounded history of
 * the last {@link #HISTORY_SIZE} timings.
 */
public class OperationTimer {
  public static final int HISTORY_SIZE = 100;
  public static final int RECENT_SIZE = 10;
  public static final double TARGET_MILLIS = 1000.0;

  private final Map<String, Aggregate> operations = new TreeMap<>();

  public synchronized void record(String operation, long micros) {
    operations.computeIfAbsent(operation, k -> new Aggregate()).add(Math.max(0, micros));
  }

  /** Run {@code action} and record its wall time under {@code operation}, even if it throws. */
  public <T> T time(String operation, Supplier<T> action) {
    long start = System.nanoTime();
    try {
      return action.get();
    } finally {
      record(operation, (System.nanoTime() - start) / 1000);
    }
  }

  public synchronized Map<String, OperationMetrics> metrics() {
    Map<String, OperationMetrics> out = new LinkedHashMap<>();
    operations.forEach((name, agg) -> out.put(name, agg.snapshot()));
    return out;
  }

  public synchronized PerformanceSummary summary() {
    long count = 0;
    long totalMicros = 0;
    boolean targetMet = true;
    for (Aggregate agg : operations.values()) {
      count += agg.count;
      totalMicros += agg.total;
      if (agg.count > 0 && (agg.total / (double) agg.count) / 1000.0 >= TARGET_MILLIS) {
        targetMet = false;
      }
    }
    double totalMs = totalMicros / 1000.0;
    double avgMs = count == 0 ? 0.0 : totalMs / count;
    return new PerformanceSummary(count, totalMs, avgMs, targetMet);
  }

  public synchronized void reset() {
    operations.clear();
  }

  private static final class Aggregate {
    private long count;
    private long total;
    private long min = Long.MAX_VALUE;
    private long max;
    private final Deque<Long> history = new ArrayDeque<>();

    void add(long micros) {
      count++;
      total += micros;
      min = Math.min(min, micros);
      max = Math.max(max, micros);
      history.addLast(micros);
      if (history.size() > HISTORY_SIZE) {
        history.removeFirst();
      }
    }

    OperationMetrics snapshot() {
      List<Long> all = new ArrayList<>(history);
      List<Long> recent = all.subList(Math.max(0, all.size() - RECENT_SIZE), all.size());
      double average = count == 0 ? 0.0 : total / (double) count;
      return new OperationMetrics(count, total, count == 0 ? 0 : min, max, average, recent);
    }
  }
}
