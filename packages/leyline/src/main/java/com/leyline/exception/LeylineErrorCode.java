package com.leyline.exception;

/**
 * Stable error codes for discovery failures. Codes are suitable for logs and JSON output; pick the
 * most specific one that tells the caller what can be done about the failure.
 */
public enum LeylineErrorCode {
  // Generic
  UNKNOWN,

  // I/O and configuration
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,

  // Discovery
  SCAN_FAILURE,
  DISCOVERY_ERROR,
}
