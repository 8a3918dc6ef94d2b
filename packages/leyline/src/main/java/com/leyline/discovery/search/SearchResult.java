package com.leyline.discovery.search;

import com.leyline.discovery.Document;
import java.util.List;

/**
 * One ranked search hit.
 *
 * @param document matched document
 * @param score relevance, higher is better; exact title matches score at least 100
 * @param matches fields that contributed, e.g. {@code title}, {@code id}, {@code fuzzy:testing}
 */
public record SearchResult(Document document, double score, List<String> matches) {
  public SearchResult {
    matches = List.copyOf(matches);
  }
}
