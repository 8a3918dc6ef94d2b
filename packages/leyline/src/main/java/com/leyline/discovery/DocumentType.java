package com.leyline.discovery;

import java.util.Locale;

public enum DocumentType {
  TENET,
  BINDING,
  UNKNOWN;

  /** Classify by directory placement: {@code /tenets/} or {@code /bindings/}. */
  public static DocumentType fromPath(String path) {
    if (path == null) return UNKNOWN;
    String normalized = path.replace('\\', '/');
    if (normalized.contains("/tenets/") || normalized.startsWith("tenets/")) return TENET;
    if (normalized.contains("/bindings/") || normalized.startsWith("bindings/")) return BINDING;
    return UNKNOWN;
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
