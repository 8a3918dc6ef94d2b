package com.leyline.exception;

/** Configuration value missing, malformed or outside its allowed range. */
public class ConfigException extends LeylineException {
  public ConfigException(String message) {
    super(LeylineErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(LeylineErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
