package com.leyline.discovery.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Typo-tolerant matching of a query against titles.
 *
 * <p>Distances are optimal string alignment distances: insertions, deletions, substitutions and
 * transpositions of adjacent characters each cost one edit. A query of length {@code n} tolerates
 * at most {@code floor(0.4 * n)} edits.
 */
public final class FuzzyMatcher {
  public static final double MAX_EDIT_FRACTION = 0.4;

  private static final Pattern WORD_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

  private FuzzyMatcher() {}

  public static int maxDistance(int queryLength) {
    return (int) Math.floor(queryLength * MAX_EDIT_FRACTION);
  }

  /** Optimal string alignment distance between {@code a} and {@code b} (case-sensitive). */
  public static int distance(String a, String b) {
    int n = a.length();
    int m = b.length();
    if (n == 0) return m;
    if (m == 0) return n;

    int[][] dp = new int[n + 1][m + 1];
    for (int i = 0; i <= n; i++) dp[i][0] = i;
    for (int j = 0; j <= m; j++) dp[0][j] = j;

    for (int i = 1; i <= n; i++) {
      for (int j = 1; j <= m; j++) {
        int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
        dp[i][j] =
            Math.min(Math.min(dp[i - 1][j] + 1, dp[i][j - 1] + 1), dp[i - 1][j - 1] + cost);
        if (i > 1
            && j > 1
            && a.charAt(i - 1) == b.charAt(j - 2)
            && a.charAt(i - 2) == b.charAt(j - 1)) {
          dp[i][j] = Math.min(dp[i][j], dp[i - 2][j - 2] + 1);
        }
      }
    }
    return dp[n][m];
  }

  public static List<String> words(String text) {
    List<String> out = new ArrayList<>();
    if (text == null) return out;
    for (String w : WORD_SPLIT.split(text)) {
      if (!w.isEmpty()) out.add(w);
    }
    return out;
  }

  /**
   * Smallest distance between {@code query} and the title, its words, or prefixes of its words
   * whose length is within one of the query length. Multi-word queries are also matched word by
   * word, summing the best distance of each query word; every word must be within its own
   * tolerance for the sum to count. Both inputs are compared lower-cased.
   *
   * @return best distance, or -1 when the title has no comparable text
   */
  public static int bestDistance(String query, String title) {
    if (query == null || title == null) return -1;
    String q = query.toLowerCase(Locale.ROOT).strip();
    String t = title.toLowerCase(Locale.ROOT).strip();
    if (q.isEmpty() || t.isEmpty()) return -1;

    List<String> titleWords = words(t);
    int best = distance(q, t);
    best = Math.min(best, bestAgainstWords(q, titleWords));

    List<String> queryWords = words(q);
    if (queryWords.size() > 1 && !titleWords.isEmpty()) {
      int sum = 0;
      for (String token : queryWords) {
        int d = bestAgainstWords(token, titleWords);
        if (d > maxDistance(token.length())) {
          sum = Integer.MAX_VALUE;
          break;
        }
        sum += d;
      }
      best = Math.min(best, sum);
    }
    return best;
  }

  private static int bestAgainstWords(String token, List<String> titleWords) {
    int best = Integer.MAX_VALUE;
    int len = token.length();
    for (String word : titleWords) {
      best = Math.min(best, distance(token, word));
      for (int prefix = Math.max(1, len - 1); prefix <= len + 1; prefix++) {
        if (prefix < word.length()) {
          best = Math.min(best, distance(token, word.substring(0, prefix)));
        }
      }
      if (best == 0) return 0;
    }
    return best;
  }

  /** Whether {@code distance} is close enough for a query of {@code queryLength} characters. */
  public static boolean withinTolerance(int distance, int queryLength) {
    return distance >= 0 && distance <= maxDistance(queryLength);
  }
}
