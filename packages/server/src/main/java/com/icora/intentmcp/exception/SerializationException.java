package com.icora.intentmcp.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends IntentMcpException {
  public SerializationException(String message) {
    super(IntentMcpErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(IntentMcpErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
