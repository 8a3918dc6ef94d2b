package com.leyline.commands;

import com.leyline.discovery.cache.MetadataCache;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** {@code leyline categories}: every category in the corpus with its document count. */
public class CategoriesCommand extends DiscoveryCommand {

  public CategoriesCommand(MetadataCache cache, CommandOptions options, PrintStream out) {
    super(cache, options, out);
  }

  @Override
  protected Map<String, Object> gather() {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (String category : cache.categories()) {
      counts.put(category, cache.documentsForCategory(category).size());
    }
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("categories", List.copyOf(counts.keySet()));
    result.put("document_counts", counts);
    result.put("total_count", counts.size());
    return result;
  }

  @Override
  @SuppressWarnings("unchecked")
  protected void printHumanReadable(Map<String, Object> result) {
    Map<String, Integer> counts = (Map<String, Integer>) result.get("document_counts");
    if (counts.isEmpty()) {
      out.println("No categories found");
      return;
    }
    out.println("Available categories (" + counts.size() + "):");
    out.println();
    counts.forEach((category, count) -> out.println("  - " + category + " (" + count + ")"));
    out.println();
    out.println("Show the documents of one category with: leyline show <category>");
  }
}
