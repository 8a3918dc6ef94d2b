package com.leyline.exception;

/** JSON or YAML (de)serialization failed. */
public class SerializationException extends LeylineException {
  public SerializationException(String message) {
    super(LeylineErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(LeylineErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
