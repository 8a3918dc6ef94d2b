package com.leyline.commands;

import static org.junit.jupiter.api.Assertions.*;

import com.leyline.discovery.ScanStatistics;
import com.leyline.discovery.cache.CompressionStats;
import com.leyline.discovery.cache.PerformanceStats;
import com.leyline.discovery.cache.WarmupState;
import com.leyline.discovery.stats.OperationMetrics;
import com.leyline.discovery.stats.PerformanceSummary;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StatsFormatterTest {

  @Test
  void scoresAreNormalizedAndClamped() {
    assertEquals(0.5, StatsFormatter.normalizeScore(100));
    assertEquals(1.0, StatsFormatter.normalizeScore(450));
    assertEquals(0.0, StatsFormatter.normalizeScore(-5));
  }

  @Test
  void relevanceStars() {
    assertEquals("★★★★★", StatsFormatter.formatRelevance(1.0));
    assertEquals("★★★☆☆", StatsFormatter.formatRelevance(0.6));
    assertEquals("☆☆☆☆☆", StatsFormatter.formatRelevance(0.05));
    assertEquals("★★★★★", StatsFormatter.formatRelevance(3.0));
  }

  @Test
  void truncateCollapsesWhitespace() {
    assertEquals("a b c", StatsFormatter.truncateContent("  a\n b\t\tc ", 20));
    assertEquals("abcdefg...", StatsFormatter.truncateContent("abcdefghijklmnop", 10));
    assertEquals("", StatsFormatter.truncateContent(null, 10));
  }

  @Test
  void rendersCacheAndOperationSections() {
    Map<String, OperationMetrics> ops = new LinkedHashMap<>();
    ops.put("list_categories", new OperationMetrics(2, 3000, 1000, 2000, 1500.0, List.of(1000L)));
    ops.put("search_content", new OperationMetrics(0, 0, 0, 0, 0.0, List.of()));
    PerformanceStats stats =
        new PerformanceStats(
            0.75,
            3,
            1,
            1,
            4,
            2,
            1536,
            10 * 1024 * 1024,
            0,
            new CompressionStats(true, 0.25, 4, 800, 200),
            1,
            1,
            0.5,
            Instant.EPOCH,
            WarmupState.WARM,
            new ScanStatistics(4, 0, 1, 0, 1536, 12.5),
            ops,
            new PerformanceSummary(2, 3.0, 1.5, true));

    List<String> lines = StatsFormatter.render(stats, 42);

    assertEquals("Cache Performance:", lines.get(0));
    assertTrue(lines.contains("  Documents cached: 4"));
    assertTrue(lines.contains("  Categories: 2"));
    assertTrue(lines.contains("  Memory usage: 1.5 KB of 10.0 MB"));
    assertTrue(lines.contains("  Hit ratio: 75.0% (3 unchanged, 1 rescanned)"));
    assertTrue(lines.contains("  Index-served queries: 50.0%"));
    assertTrue(lines.contains("  Compression ratio: 0.25 (4 compressed)"));
    assertTrue(lines.contains("  list_categories: 1.500 ms avg (2 calls)"));
    assertTrue(lines.stream().noneMatch(l -> l.startsWith("  search_content")));
    assertEquals("Total time: 42ms", lines.get(lines.size() - 1));
  }
}
