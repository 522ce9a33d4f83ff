package com.icora.intentmcp.backend;

import java.util.Objects;

/**
 * Outcome of a single backend operation after retries, in the client's internal taxonomy.
 *
 * <ul>
 *   <li>{@link Kind#ACCEPTED}: the backend performed the operation; {@link #reference()} and
 *       {@link #state()} describe the entity.
 *   <li>{@link Kind#REJECTED}: terminal refusal (4xx); {@link #reason()} explains it.
 *   <li>{@link Kind#UNAVAILABLE}: transport failure or 5xx that outlived the retry budget.
 *   <li>{@link Kind#UNKNOWN}: ambiguous outcome; treated as failed and reconciled later.
 * </ul>
 */
public final class BackendResult {
  public enum Kind {
    ACCEPTED,
    REJECTED,
    UNAVAILABLE,
    UNKNOWN
  }

  private final Kind kind;
  private final String reference;
  private final BackendState state;
  private final String reason;
  private final int httpStatus;
  private final boolean sent;

  private BackendResult(
      Kind kind,
      String reference,
      BackendState state,
      String reason,
      int httpStatus,
      boolean sent) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.reference = reference;
    this.state = state;
    this.reason = reason;
    this.httpStatus = httpStatus;
    this.sent = sent;
  }

  public static BackendResult accepted(String reference, BackendState state, int httpStatus) {
    return new BackendResult(Kind.ACCEPTED, reference, state, null, httpStatus, true);
  }

  public static BackendResult rejected(String reason, int httpStatus) {
    return new BackendResult(Kind.REJECTED, null, null, reason, httpStatus, true);
  }

  public static BackendResult unavailable(String reason, int httpStatus) {
    return new BackendResult(Kind.UNAVAILABLE, null, null, reason, httpStatus, true);
  }

  public static BackendResult unknown(String reason, int httpStatus) {
    return new BackendResult(Kind.UNKNOWN, null, null, reason, httpStatus, true);
  }

  /** Unavailable, and no request for the operation ever left this process. */
  public static BackendResult notSent(String reason) {
    return new BackendResult(Kind.UNAVAILABLE, null, null, reason, 0, false);
  }

  public Kind kind() {
    return kind;
  }

  public boolean isAccepted() {
    return kind == Kind.ACCEPTED;
  }

  public boolean isRetryable() {
    return kind == Kind.UNAVAILABLE;
  }

  public String reference() {
    return reference;
  }

  public BackendState state() {
    return state;
  }

  public String reason() {
    return reason;
  }

  /**
   * Whether the backend may have acted on the request without this process learning the result:
   * an {@link Kind#UNKNOWN} outcome, or a request that got no response at all. An HTTP error
   * response means the backend answered and did not act.
   */
  public boolean isInconclusive() {
    if (kind == Kind.UNKNOWN) {
      return true;
    }
    return kind == Kind.UNAVAILABLE && sent && httpStatus == 0;
  }

  /** HTTP status of the last attempt, or 0 when no response was received. */
  public int httpStatus() {
    return httpStatus;
  }

  @Override
  public String toString() {
    return switch (kind) {
      case ACCEPTED -> "Accepted{reference=%s, state=%s}".formatted(reference, state);
      case REJECTED -> "Rejected{reason=%s, http=%d}".formatted(reason, httpStatus);
      case UNAVAILABLE -> "Unavailable{reason=%s, http=%d}".formatted(reason, httpStatus);
      case UNKNOWN -> "Unknown{reason=%s, http=%d}".formatted(reason, httpStatus);
    };
  }
}
