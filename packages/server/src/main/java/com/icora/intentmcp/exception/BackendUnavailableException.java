package com.icora.intentmcp.exception;

import java.util.Map;

/** Retryable backend failure, surfaced only after the client exhausted its retries. */
public class BackendUnavailableException extends IntentMcpException {
  public BackendUnavailableException(String message) {
    super(IntentMcpErrorCode.BACKEND_UNAVAILABLE, message);
  }

  public BackendUnavailableException(String message, Throwable cause) {
    super(IntentMcpErrorCode.BACKEND_UNAVAILABLE, message, cause);
  }

  public BackendUnavailableException(String message, Map<String, ?> context) {
    super(IntentMcpErrorCode.BACKEND_UNAVAILABLE, message, context);
  }
}
