package com.icora.intentmcp.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Root of every failure the server reports on purpose. Each subclass pins an {@link
 * IntentMcpErrorCode}; the context map carries the ids and backend details a caller needs to act
 * on the error, and ends up verbatim in the tool result.
 */
public abstract class IntentMcpException extends RuntimeException {
  private final IntentMcpErrorCode code;
  private final Map<String, Object> context;

  protected IntentMcpException(
      IntentMcpErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    if (context == null || context.isEmpty()) {
      this.context = Map.of();
    } else {
      // Insertion order is kept for readable tool output; values may be null.
      this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }
  }

  protected IntentMcpException(IntentMcpErrorCode code, String message) {
    this(code, message, null, null);
  }

  protected IntentMcpException(IntentMcpErrorCode code, String message, Throwable cause) {
    this(code, message, null, cause);
  }

  protected IntentMcpException(IntentMcpErrorCode code, String message, Map<String, ?> context) {
    this(code, message, context, null);
  }

  public IntentMcpErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return context;
  }

  public boolean isRetryable() {
    return code.retryable();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName());
    sb.append('[').append(code).append("] ").append(getMessage());
    if (!context.isEmpty()) {
      sb.append(' ').append(context);
    }
    if (getCause() != null) {
      sb.append(" caused by ").append(getCause().getClass().getSimpleName());
    }
    return sb.toString();
  }
}
