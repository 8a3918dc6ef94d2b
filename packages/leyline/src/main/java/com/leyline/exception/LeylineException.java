package com.leyline.exception;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runtime failure surfaced by the discovery engine or its commands.
 *
 * <p>Besides the message, every failure carries a {@link LeylineErrorCode} for scripts, a context
 * map for diagnostics (the offending path, the config key) and the recovery steps a user can take.
 * All three are immutable.
 */
public class LeylineException extends RuntimeException {
  private final LeylineErrorCode code;
  private final Map<String, Object> context;
  private final List<String> suggestions;

  public LeylineException(LeylineErrorCode code, String message) {
    this(code, message, null, Map.of(), List.of());
  }

  public LeylineException(LeylineErrorCode code, String message, Throwable cause) {
    this(code, message, cause, Map.of(), List.of());
  }

  protected LeylineException(
      LeylineErrorCode code,
      String message,
      Throwable cause,
      Map<String, ?> context,
      List<String> suggestions) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = context == null ? Map.of() : Map.copyOf(context);
    this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
  }

  public LeylineErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return context;
  }

  /** Recovery steps to print below the message; empty when the caller should pick generic ones. */
  public List<String> getSuggestions() {
    return suggestions;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName());
    sb.append('[').append(code).append("] ").append(getMessage());
    if (!context.isEmpty()) sb.append(' ').append(context);
    return sb.toString();
  }
}
