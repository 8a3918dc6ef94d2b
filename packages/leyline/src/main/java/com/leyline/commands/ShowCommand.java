package com.leyline.commands;

import com.leyline.discovery.Document;
import com.leyline.discovery.cache.MetadataCache;
import com.leyline.exception.DiscoveryException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** {@code leyline show <category>}: documents of one category. */
public class ShowCommand extends DiscoveryCommand {
  static final int DESCRIPTION_LENGTH = 200;

  private final String category;

  public ShowCommand(
      MetadataCache cache, CommandOptions options, PrintStream out, String category) {
    super(cache, options, out);
    if (category == null || category.isBlank()) {
      throw new DiscoveryException(
          "Category parameter is required",
          List.of("Run leyline categories to list the available categories"));
    }
    this.category = category.strip();
  }

  @Override
  protected Map<String, Object> gather() {
    List<Document> documents = cache.documentsForCategory(category);
    List<Map<String, Object>> rows = new ArrayList<>();
    for (Document doc : documents) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("title", doc.title());
      row.put("id", doc.id());
      row.put("type", doc.type().label());
      row.put("path", doc.path());
      row.put("description", doc.contentPreview());
      rows.add(row);
    }
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("category", category);
    result.put("document_count", rows.size());
    result.put("documents", rows);
    if (rows.isEmpty()) {
      result.put("available_categories", cache.categories());
    }
    return result;
  }

  @Override
  @SuppressWarnings("unchecked")
  protected void printHumanReadable(Map<String, Object> result) {
    List<Map<String, Object>> rows = (List<Map<String, Object>>) result.get("documents");
    if (rows.isEmpty()) {
      out.println("No documents found in category '" + category + "'");
      out.println();
      out.println(
          "Available categories: "
              + String.join(", ", (List<String>) result.get("available_categories")));
      return;
    }
    out.println("Documents in '" + category + "' (" + rows.size() + "):");
    out.println();
    for (Map<String, Object> row : rows) {
      out.println(row.get("title"));
      out.println("  ID: " + row.get("id"));
      out.println("  Type: " + row.get("type"));
      if (options.verbose()) {
        out.println("  Path: " + row.get("path"));
        String description = (String) row.get("description");
        if (!description.isBlank()) {
          out.println(
              "  Description: "
                  + StatsFormatter.truncateContent(description, DESCRIPTION_LENGTH));
        }
      }
      out.println();
    }
  }
}
