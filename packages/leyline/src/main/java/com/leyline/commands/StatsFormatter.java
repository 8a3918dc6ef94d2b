package com.leyline.commands;

import com.leyline.discovery.cache.CompressionStats;
import com.leyline.discovery.cache.PerformanceStats;
import com.leyline.discovery.stats.OperationMetrics;
import com.leyline.utility.StringUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Text rendering of cache statistics and search relevance. */
public final class StatsFormatter {
  /** Raw scores above this are shown as full relevance. */
  public static final double MAX_DISPLAY_SCORE = 200.0;

  private static final int STARS = 5;

  private StatsFormatter() {}

  public static double normalizeScore(double score) {
    return Math.max(0.0, Math.min(score / MAX_DISPLAY_SCORE, 1.0));
  }

  /** Five-star rendering of a normalized score, e.g. {@code ★★★☆☆}. */
  public static String formatRelevance(double normalized) {
    double clamped = Math.max(0.0, Math.min(normalized, 1.0));
    int filled = (int) Math.round(clamped * STARS);
    return "★".repeat(filled) + "☆".repeat(STARS - filled);
  }

  /** Collapse whitespace and cut to {@code maxLength} characters including the ellipsis. */
  public static String truncateContent(String content, int maxLength) {
    if (content == null) return "";
    String flat = content.strip().replaceAll("\\s+", " ");
    if (flat.length() <= maxLength) return flat;
    return flat.substring(0, Math.max(0, maxLength - 3)) + "...";
  }

  public static List<String> render(PerformanceStats stats, long elapsedMillis) {
    List<String> lines = new ArrayList<>();
    lines.add("Cache Performance:");
    lines.add("  Documents cached: " + stats.documentCount());
    lines.add("  Categories: " + stats.categoryCount());
    lines.add(
        "  Memory usage: "
            + StringUtility.formatBytes(stats.memoryUsage())
            + " of "
            + StringUtility.formatBytes(stats.maxMemoryBytes()));
    lines.add(
        "  Hit ratio: "
            + StringUtility.percent(stats.hitRatio())
            + " ("
            + stats.hitCount()
            + " unchanged, "
            + stats.missCount()
            + " rescanned)");
    lines.add("  Index-served queries: " + StringUtility.percent(stats.indexServedRatio()));
    lines.add("  Scans: " + stats.scanCount() + ", evictions: " + stats.evictionCount());
    CompressionStats compression = stats.compressionStats();
    if (compression.enabled()) {
      lines.add(
          String.format(
              Locale.ROOT,
              "  Compression ratio: %.2f (%d compressed)",
              compression.compressionRatio(),
              compression.compressedDocuments()));
    }

    Map<String, OperationMetrics> operations = stats.operationMetrics();
    if (!operations.isEmpty()) {
      lines.add("");
      lines.add("Operation Performance:");
      operations.forEach(
          (name, m) -> {
            if (m.count() == 0) return;
            lines.add(
                String.format(
                    Locale.ROOT,
                    "  %s: %.3f ms avg (%d calls)",
                    name,
                    m.averageMicros() / 1000.0,
                    m.count()));
          });
    }
    lines.add("");
    lines.add("Total time: " + elapsedMillis + "ms");
    return lines;
  }
}
