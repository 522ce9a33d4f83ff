package com.icora.intentmcp.exception;

import java.util.Map;

/** Missing or malformed bearer credential. */
public class AuthenticationException extends IntentMcpException {
  public AuthenticationException(String message) {
    super(IntentMcpErrorCode.UNAUTHENTICATED, message);
  }

  public AuthenticationException(String message, Throwable cause) {
    super(IntentMcpErrorCode.UNAUTHENTICATED, message, cause);
  }

  public AuthenticationException(String message, Map<String, ?> context) {
    super(IntentMcpErrorCode.UNAUTHENTICATED, message, context);
  }
}
