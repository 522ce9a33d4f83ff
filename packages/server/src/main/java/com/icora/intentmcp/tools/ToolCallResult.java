package com.icora.intentmcp.tools;

import com.icora.intentmcp.exception.ErrorDetails;
import com.icora.intentmcp.utility.JacksonUtility;

/** JSON result of a tool call. Errors carry {@code {"error": {code, message, retryable, ...}}}. */
public final class ToolCallResult {
  private final boolean error;
  private final String json;

  private ToolCallResult(boolean error, String json) {
    this.error = error;
    this.json = json;
  }

  public static ToolCallResult success(Object payload) {
    return new ToolCallResult(false, JacksonUtility.toJson(payload));
  }

  public static ToolCallResult failure(Throwable t) {
    return new ToolCallResult(true, JacksonUtility.toJson(ErrorDetails.of(t).asEnvelope()));
  }

  public boolean isError() {
    return error;
  }

  public String json() {
    return json;
  }

  @Override
  public String toString() {
    return (error ? "ToolCallResult{error, " : "ToolCallResult{ok, ") + json + "}";
  }
}
