package com.leyline.utility;

import java.util.Locale;

public class StringUtility {

  private static final String[] BYTE_UNITS = {"B", "KB", "MB", "GB"};

  /** Human readable byte count, e.g. {@code 1536 -> "1.5 KB"}. Negative values render as 0 B. */
  public static String formatBytes(long bytes) {
    if (bytes <= 0) return "0 B";
    double value = bytes;
    int unit = 0;
    while (value >= 1024 && unit < BYTE_UNITS.length - 1) {
      value /= 1024;
      unit++;
    }
    if (unit == 0) {
      return bytes + " B";
    }
    return String.format(Locale.ROOT, "%.1f %s", value, BYTE_UNITS[unit]);
  }

  /**
   * Cut {@code text} to at most {@code maxLength} characters on a word boundary and append "..."
   * when anything was removed. A single word longer than the limit is cut mid-word.
   */
  public static String truncateAtWord(String text, int maxLength) {
    if (text == null) return "";
    if (text.length() <= maxLength) return text;
    String cut = text.substring(0, maxLength);
    int lastSpace = cut.lastIndexOf(' ');
    if (lastSpace > 0) {
      cut = cut.substring(0, lastSpace);
    }
    return cut.stripTrailing() + "...";
  }

  /** Replace '-' and '_' with spaces and capitalize the first letter. */
  public static String humanize(String name) {
    if (name == null || name.isBlank()) return "";
    String spaced = name.replace('-', ' ').replace('_', ' ').trim();
    return Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
  }

  public static String percent(double ratio) {
    return String.format(Locale.ROOT, "%.1f%%", ratio * 100.0);
  }
}
