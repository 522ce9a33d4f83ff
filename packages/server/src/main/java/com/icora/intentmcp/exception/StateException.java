package com.icora.intentmcp.exception;

/** Illegal or unexpected application state, e.g. a component used before initialization. */
public class StateException extends IntentMcpException {
  public StateException(String message) {
    super(IntentMcpErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(IntentMcpErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
