package com.icora.intentmcp.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * The {@code error} object of a failed tool call or a rejected HTTP request.
 *
 * @param code stable error code
 * @param message human readable message, never null
 * @param exception simple name of the exception class
 * @param retryable whether the same call may succeed later
 * @param context extra details, omitted when empty
 * @param occurredAt when the failure was reported
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorDetails(
    IntentMcpErrorCode code,
    String message,
    String exception,
    boolean retryable,
    Map<String, Object> context,
    Instant occurredAt) {

  public static ErrorDetails of(Throwable t) {
    return of(t, Clock.systemUTC());
  }

  public static ErrorDetails of(Throwable t, Clock clock) {
    IntentMcpErrorCode code = IntentMcpErrorCode.UNKNOWN;
    Map<String, Object> context = Map.of();
    if (t instanceof IntentMcpException ime) {
      code = ime.getCode();
      context = ime.getContext();
    }
    return new ErrorDetails(
        code,
        t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage(),
        t.getClass().getSimpleName(),
        code.retryable(),
        context,
        clock.instant());
  }

  /** Wraps these details as {@code {"error": {...}}}. */
  public Map<String, ErrorDetails> asEnvelope() {
    return Map.of("error", this);
  }
}
