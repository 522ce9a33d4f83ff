package com.icora.intentmcp.exception;

import java.util.Map;

/** The requested event is not permitted for the intent's current state. */
public class InvalidTransitionException extends IntentMcpException {
  public InvalidTransitionException(String message) {
    super(IntentMcpErrorCode.INVALID_TRANSITION, message);
  }

  public InvalidTransitionException(String message, Throwable cause) {
    super(IntentMcpErrorCode.INVALID_TRANSITION, message, cause);
  }

  public InvalidTransitionException(String message, Map<String, ?> context) {
    super(IntentMcpErrorCode.INVALID_TRANSITION, message, context);
  }
}
