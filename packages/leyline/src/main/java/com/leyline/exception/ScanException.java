package com.leyline.exception;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** The corpus could not be listed or read as a whole. Per-file failures never raise this. */
public class ScanException extends LeylineException {
  public ScanException(String message) {
    super(LeylineErrorCode.SCAN_FAILURE, message);
  }

  public ScanException(String message, Path path, Throwable cause) {
    super(
        LeylineErrorCode.SCAN_FAILURE,
        message,
        cause,
        Map.of("path", String.valueOf(path)),
        List.of(
            "Check that " + path + " exists and is readable",
            "Pass --corpus <dir> or set LEYLINE_CORPUS to the checkout root"));
  }
}
