package com.icora.intentmcp.exception;

import java.util.Map;

/** No intent (or backend entity) exists for the requested identifier. */
public class NotFoundException extends IntentMcpException {
  public NotFoundException(String message) {
    super(IntentMcpErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(IntentMcpErrorCode.NOT_FOUND, message, cause);
  }

  public NotFoundException(String message, Map<String, ?> context) {
    super(IntentMcpErrorCode.NOT_FOUND, message, context);
  }
}
