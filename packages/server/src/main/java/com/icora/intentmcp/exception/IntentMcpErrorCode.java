package com.icora.intentmcp.exception;

/**
 * Error codes surfaced to tool callers and logs. Callers branch on these, so the names are part of
 * the tool contract.
 */
public enum IntentMcpErrorCode {
  UNKNOWN(false),
  VALIDATION_ERROR(false),
  NOT_FOUND(false),
  FAILED_PRECONDITION(false),
  UNAUTHENTICATED(false),

  CONFIGURATION_ERROR(false),
  IO_ERROR(true),
  SERIALIZATION_ERROR(false),

  INVALID_TRANSITION(false),
  CONFLICT(true),
  BACKEND_UNAVAILABLE(true),
  BACKEND_REJECTED(false);

  private final boolean retryable;

  IntentMcpErrorCode(boolean retryable) {
    this.retryable = retryable;
  }

  /** Whether repeating the same call later can succeed without changing its input. */
  public boolean retryable() {
    return retryable;
  }
}
