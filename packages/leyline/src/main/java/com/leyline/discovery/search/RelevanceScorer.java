package com.leyline.discovery.search;

import com.leyline.discovery.Document;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Scores a document against a query. Field weights: exact title substring 100, id substring 50,
 * preview substring 25, category substring 10. When the title has no exact match a fuzzy title
 * match contributes {@code 80 * (1 - d / (maxDistance + 1))}, at most 80 and below any exact
 * title match.
 */
public final class RelevanceScorer {
  public static final double TITLE_WEIGHT = 100.0;
  public static final double ID_WEIGHT = 50.0;
  public static final double CONTENT_WEIGHT = 25.0;
  public static final double CATEGORY_WEIGHT = 10.0;
  public static final double FUZZY_CEILING = 80.0;

  private RelevanceScorer() {}

  /** @param query non-blank query */
  public static Optional<SearchResult> score(String query, Document document) {
    String q = query.toLowerCase(Locale.ROOT).strip();
    double score = 0;
    List<String> matches = new ArrayList<>();

    String title = document.title().toLowerCase(Locale.ROOT);
    if (title.contains(q)) {
      score += TITLE_WEIGHT;
      matches.add("title");
    } else {
      int d = FuzzyMatcher.bestDistance(q, title);
      if (FuzzyMatcher.withinTolerance(d, q.length())) {
        score += fuzzyScore(d, q.length());
        matches.add("fuzzy:" + document.title());
      }
    }
    if (document.id().toLowerCase(Locale.ROOT).contains(q)) {
      score += ID_WEIGHT;
      matches.add("id");
    }
    if (document.contentPreview().toLowerCase(Locale.ROOT).contains(q)) {
      score += CONTENT_WEIGHT;
      matches.add("content");
    }
    if (document.category().toLowerCase(Locale.ROOT).contains(q)) {
      score += CATEGORY_WEIGHT;
      matches.add("category");
    }
    return score > 0 ? Optional.of(new SearchResult(document, score, matches)) : Optional.empty();
  }

  static double fuzzyScore(int distance, int queryLength) {
    int bound = FuzzyMatcher.maxDistance(queryLength);
    return FUZZY_CEILING * (1.0 - (double) distance / (bound + 1));
  }
}
