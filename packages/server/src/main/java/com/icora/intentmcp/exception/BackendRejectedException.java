package com.icora.intentmcp.exception;

import java.util.Map;

/** Terminal refusal reported by the intent-management backend. */
public class BackendRejectedException extends IntentMcpException {
  public BackendRejectedException(String message) {
    super(IntentMcpErrorCode.BACKEND_REJECTED, message);
  }

  public BackendRejectedException(String message, Throwable cause) {
    super(IntentMcpErrorCode.BACKEND_REJECTED, message, cause);
  }

  public BackendRejectedException(String message, Map<String, ?> context) {
    super(IntentMcpErrorCode.BACKEND_REJECTED, message, context);
  }
}
