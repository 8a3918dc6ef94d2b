package com.leyline.commands;

import com.leyline.discovery.Document;
import com.leyline.discovery.cache.MetadataCache;
import com.leyline.discovery.search.SearchResult;
import com.leyline.exception.DiscoveryException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code leyline search <query>}: ranked results limited by {@code --limit}, with "did you mean"
 * suggestions when nothing matched.
 */
public class SearchCommand extends DiscoveryCommand {
  static final int PREVIEW_LENGTH = 150;

  private final String query;

  public SearchCommand(MetadataCache cache, CommandOptions options, PrintStream out, String query) {
    super(cache, options, out);
    if (query == null || query.isBlank()) {
      throw new DiscoveryException(
          "Search query cannot be empty",
          List.of("Provide a search term, e.g. leyline search testing"));
    }
    this.query = query.strip();
  }

  @Override
  protected Map<String, Object> gather() {
    List<SearchResult> results = cache.search(query);
    List<String> suggestions =
        results.isEmpty() ? cache.suggestCorrections(query) : List.of();

    List<Map<String, Object>> rows = new ArrayList<>();
    for (SearchResult result : results.subList(0, Math.min(options.limit(), results.size()))) {
      Document doc = result.document();
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("title", doc.title());
      row.put("path", doc.path());
      row.put("score", StatsFormatter.normalizeScore(result.score()));
      row.put("type", doc.type().label());
      row.put("category", doc.category());
      row.put("matches", result.matches());
      row.put("preview", doc.contentPreview());
      rows.add(row);
    }

    Map<String, Object> data = new LinkedHashMap<>();
    data.put("query", query);
    data.put("total_results", results.size());
    data.put("shown_results", rows.size());
    data.put("limit", options.limit());
    data.put("results", rows);
    data.put("suggestions", suggestions);
    return data;
  }

  @Override
  @SuppressWarnings("unchecked")
  protected void printHumanReadable(Map<String, Object> result) {
    List<Map<String, Object>> rows = (List<Map<String, Object>>) result.get("results");
    int total = (Integer) result.get("total_results");
    if (rows.isEmpty()) {
      out.println("No results found for '" + query + "'");
      List<String> suggestions = (List<String>) result.get("suggestions");
      if (!suggestions.isEmpty()) {
        out.println();
        out.println("Did you mean:");
        suggestions.forEach(s -> out.println("  " + s));
      }
      return;
    }

    out.println(
        "Search results for '" + query + "' (showing " + rows.size() + " of " + total + "):");
    out.println();
    int index = 1;
    for (Map<String, Object> row : rows) {
      out.println(
          index++
              + ". "
              + row.get("title")
              + " "
              + StatsFormatter.formatRelevance((Double) row.get("score")));
      out.println("   Category: " + row.get("category") + " | Type: " + row.get("type"));
      if (options.verbose()) {
        String preview = (String) row.get("preview");
        if (!preview.isBlank()) {
          out.println("   Preview: " + StatsFormatter.truncateContent(preview, PREVIEW_LENGTH));
        }
        List<String> matches = (List<String>) row.get("matches");
        if (!matches.isEmpty()) {
          out.println("   Matches: " + String.join(", ", matches));
        }
      }
      out.println();
    }
    if (total > rows.size()) {
      out.println("Use --limit " + total + " to see all results");
    }
  }
}
