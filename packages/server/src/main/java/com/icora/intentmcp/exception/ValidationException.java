package com.icora.intentmcp.exception;

import java.util.Map;

/** Malformed tool input, rejected before the lifecycle engine is touched. */
public class ValidationException extends IntentMcpException {
  public ValidationException(String message) {
    super(IntentMcpErrorCode.VALIDATION_ERROR, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(IntentMcpErrorCode.VALIDATION_ERROR, message, cause);
  }

  public ValidationException(String message, Map<String, ?> context) {
    super(IntentMcpErrorCode.VALIDATION_ERROR, message, context);
  }
}
