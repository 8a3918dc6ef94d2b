package com.leyline.exception;

import java.time.Instant;

/** Helpers for converting throwables into structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. Code, context and suggestions of a
   * {@link LeylineException} are preserved; anything else maps to {@link LeylineErrorCode#UNKNOWN}.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof LeylineException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext().isEmpty() ? null : ex.getContext(),
          ex.getSuggestions().isEmpty() ? null : ex.getSuggestions(),
          Instant.now().toString());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        LeylineErrorCode.UNKNOWN,
        null,
        null,
        Instant.now().toString());
  }

  /** Single-line summary of the top stack frames, joined in call order with {@code " > "}. */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
