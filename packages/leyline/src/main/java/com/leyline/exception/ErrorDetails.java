package com.leyline.exception;

import java.util.List;
import java.util.Map;

/**
 * JSON shape of a failed command.
 *
 * @param type simple class name of the failure
 * @param context diagnostics, {@code null} when there are none
 * @param suggestions recovery steps, {@code null} when there are none
 * @param timestamp ISO-8601 instant the details were produced
 */
public record ErrorDetails(
    String type,
    String message,
    LeylineErrorCode code,
    Map<String, Object> context,
    List<String> suggestions,
    String timestamp) {}
