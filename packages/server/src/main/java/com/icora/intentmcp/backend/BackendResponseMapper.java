package com.icora.intentmcp.backend;

import com.icora.intentmcp.utility.JacksonUtility;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Translates raw TMF921 HTTP responses into {@link BackendResult}s.
 *
 * <p>Every backend quirk lives here: status-string normalization, where the entity id is found,
 * and which statuses mean "already gone". The lifecycle engine only sees the normalized result.
 */
public class BackendResponseMapper {
  private static final org.slf4j.Logger log =
      com.icora.intentmcp.logging.LoggingService.getLogger(BackendResponseMapper.class);

  private static final Set<String> PENDING =
      Set.of(
          "created",
          "acknowledged",
          "received",
          "inprogress",
          "pending",
          "submitted",
          "feasibilitychecked");
  private static final Set<String> ACTIVE =
      Set.of("active", "fulfilled", "completed", "activated", "inservice");
  private static final Set<String> TERMINATED =
      Set.of("terminated", "cancelled", "canceled", "deleted", "retired");
  private static final Set<String> FAILED = Set.of("rejected", "failed", "notfulfilled");

  /** Normalize a TMF921 lifecycle status; {@code null} or unknown values are UNRECOGNIZED. */
  public BackendState normalizeStatus(String status) {
    if (status == null) {
      return BackendState.UNRECOGNIZED;
    }
    String key = status.replaceAll("[^A-Za-z]", "").toLowerCase(Locale.ROOT);
    if (PENDING.contains(key)) return BackendState.PENDING;
    if (ACTIVE.contains(key)) return BackendState.ACTIVE;
    if (TERMINATED.contains(key)) return BackendState.TERMINATED;
    if (FAILED.contains(key)) return BackendState.FAILED;
    return BackendState.UNRECOGNIZED;
  }

  public BackendResult mapSubmit(int httpStatus, String body, String location) {
    if (httpStatus == 200 || httpStatus == 201 || httpStatus == 202) {
      Map<String, Object> entity = parseBody(body);
      String reference = stringValue(entity.get("id"));
      if (reference == null) {
        reference = lastPathSegment(location);
      }
      if (reference == null) {
        return BackendResult.unknown(
            "Backend accepted the submission (HTTP %d) without returning an id"
                .formatted(httpStatus),
            httpStatus);
      }
      String status = stringValue(entity.get("status"));
      BackendState state = status == null ? BackendState.PENDING : normalizeStatus(status);
      return BackendResult.accepted(reference, state, httpStatus);
    }
    return mapFailure(httpStatus, body);
  }

  public BackendResult mapStatus(String reference, int httpStatus, String body) {
    if (httpStatus == 200) {
      Map<String, Object> entity = parseBody(body);
      String status = stringValue(entity.get("status"));
      String id = stringValue(entity.get("id"));
      BackendState state = normalizeStatus(status);
      if (state == BackendState.UNRECOGNIZED) {
        log.warn("Backend reported unrecognized status '{}' for {}", status, reference);
      }
      return BackendResult.accepted(id == null ? reference : id, state, httpStatus);
    }
    if (httpStatus == 404) {
      return BackendResult.rejected(
          "Backend has no intent with reference '%s'".formatted(reference), httpStatus);
    }
    return mapFailure(httpStatus, body);
  }

  public BackendResult mapCancel(String reference, int httpStatus, String body) {
    if (httpStatus == 200 || httpStatus == 202 || httpStatus == 204) {
      return BackendResult.accepted(reference, BackendState.TERMINATED, httpStatus);
    }
    if (httpStatus == 404) {
      log.debug("Cancel of {} returned 404, treating as already cancelled", reference);
      return BackendResult.accepted(reference, BackendState.TERMINATED, httpStatus);
    }
    return mapFailure(httpStatus, body);
  }

  /** I/O error or timeout before a response was received. */
  public BackendResult transportFailure(IOException e) {
    String kind = e instanceof InterruptedIOException ? "timeout" : "transport error";
    String detail = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    return BackendResult.unavailable("Backend %s: %s".formatted(kind, detail), 0);
  }

  private BackendResult mapFailure(int httpStatus, String body) {
    if (RetryPolicy.isRetryableStatus(httpStatus)) {
      return BackendResult.unavailable(
          "Backend returned HTTP %d%s".formatted(httpStatus, suffix(errorReason(body))),
          httpStatus);
    }
    if (httpStatus >= 400 && httpStatus < 500) {
      String reason = errorReason(body);
      return BackendResult.rejected(
          reason == null ? "Backend rejected the request with HTTP " + httpStatus : reason,
          httpStatus);
    }
    return BackendResult.unknown("Unexpected backend response HTTP " + httpStatus, httpStatus);
  }

  private String errorReason(String body) {
    Map<String, Object> entity = parseBody(body);
    for (String key : new String[] {"error_description", "message", "reason", "error"}) {
      String v = stringValue(entity.get(key));
      if (v != null) return v;
    }
    if (entity.isEmpty() && body != null && !body.isBlank() && body.length() <= 200) {
      return body.trim();
    }
    return null;
  }

  private Map<String, Object> parseBody(String body) {
    if (body == null || body.isBlank()) {
      return Collections.emptyMap();
    }
    try {
      return JacksonUtility.toMap(body);
    } catch (RuntimeException e) {
      log.debug("Backend response body is not a JSON object: {}", e.getMessage());
      return Collections.emptyMap();
    }
  }

  private static String stringValue(Object value) {
    if (value == null) return null;
    String s = value.toString().trim();
    return s.isEmpty() ? null : s;
  }

  private static String lastPathSegment(String location) {
    if (location == null || location.isBlank()) return null;
    String trimmed =
        location.endsWith("/") ? location.substring(0, location.length() - 1) : location;
    int idx = trimmed.lastIndexOf('/');
    String segment = idx < 0 ? trimmed : trimmed.substring(idx + 1);
    return segment.isBlank() ? null : segment;
  }

  private static String suffix(String reason) {
    return reason == null ? "" : ": " + reason;
  }
}
