package com.icora.intentmcp.exception;

import java.util.Map;

/** Another transition on the same intent is in flight. */
public class ConflictException extends IntentMcpException {
  public ConflictException(String message) {
    super(IntentMcpErrorCode.CONFLICT, message);
  }

  public ConflictException(String message, Throwable cause) {
    super(IntentMcpErrorCode.CONFLICT, message, cause);
  }

  public ConflictException(String message, Map<String, ?> context) {
    super(IntentMcpErrorCode.CONFLICT, message, context);
  }
}
