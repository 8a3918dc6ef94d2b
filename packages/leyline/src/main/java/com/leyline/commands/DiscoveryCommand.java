package com.leyline.commands;

import com.leyline.discovery.cache.MetadataCache;
import com.leyline.exception.ExceptionUtil;
import com.leyline.exception.LeylineException;
import com.leyline.utility.JacksonUtility;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;

/**
 * Shared flow of the discovery commands: start a background warm-up, gather the result, print it
 * as text or JSON, optionally append cache statistics. Failures are printed with recovery
 * suggestions and turned into a non-zero exit code.
 */
public abstract class DiscoveryCommand {
  private static final org.slf4j.Logger log =
      com.leyline.logging.LoggingService.getLogger(DiscoveryCommand.class);

  static final List<String> DEFAULT_SUGGESTIONS =
      List.of(
          "Ensure the leyline corpus directory is accessible",
          "Pass --corpus <dir> or set LEYLINE_CORPUS to the checkout root",
          "Run with --verbose for more detail");

  protected final MetadataCache cache;
  protected final CommandOptions options;
  protected final PrintStream out;

  protected DiscoveryCommand(MetadataCache cache, CommandOptions options, PrintStream out) {
    this.cache = cache;
    this.options = options;
    this.out = out;
  }

  /** @return process exit code */
  public final int execute() {
    long start = System.nanoTime();
    try {
      if (cache.warmCacheInBackground() && options.verbose() && !options.json()) {
        out.println("🔄 Starting cache warm-up in background...");
      }
      Map<String, Object> result = gather();
      if (options.json()) {
        out.println(JacksonUtility.toJson(result));
      } else {
        printHumanReadable(result);
      }
      if (options.stats()) {
        printStats((System.nanoTime() - start) / 1_000_000);
      }
      return 0;
    } catch (LeylineException e) {
      log.debug("Command failed: {}", ExceptionUtil.formatCompactStackTrace(e));
      printError(e);
      return 1;
    }
  }

  /** Collect the command's result as an ordered map, the shape used for JSON output. */
  protected abstract Map<String, Object> gather();

  protected abstract void printHumanReadable(Map<String, Object> result);

  private void printStats(long elapsedMillis) {
    if (options.json()) {
      out.println(JacksonUtility.toJson(cache.performanceStats()));
      return;
    }
    out.println();
    StatsFormatter.render(cache.performanceStats(), elapsedMillis).forEach(out::println);
  }

  private void printError(LeylineException e) {
    List<String> suggestions =
        e.getSuggestions().isEmpty() ? DEFAULT_SUGGESTIONS : e.getSuggestions();
    if (options.json()) {
      out.println(JacksonUtility.toJson(ExceptionUtil.toErrorDetails(e)));
      return;
    }
    out.println("❌ " + e.getMessage());
    if (!suggestions.isEmpty()) {
      out.println();
      out.println("Try:");
      suggestions.forEach(s -> out.println("  - " + s));
    }
  }
}
