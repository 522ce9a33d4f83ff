package com.icora.intentmcp.mock;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Programmable misbehaviour of the mock backend. Applies to the intent endpoints only; health,
 * token and admin routes always answer normally.
 */
public final class MockFaults {
  private final AtomicInteger failuresLeft = new AtomicInteger();
  private volatile int failureStatus = 503;
  private final AtomicReference<String> nextRejection = new AtomicReference<>();
  private final Map<String, String> forcedStatuses = new ConcurrentHashMap<>();
  private volatile Duration responseDelay = Duration.ZERO;

  /** The next {@code times} intent requests answer {@code httpStatus} without side effects. */
  public MockFaults failNext(int times, int httpStatus) {
    this.failureStatus = httpStatus;
    this.failuresLeft.set(Math.max(0, times));
    return this;
  }

  /** The next submission is refused with 400 and this reason. */
  public MockFaults rejectNextSubmission(String reason) {
    nextRejection.set(reason);
    return this;
  }

  /** Report {@code status} for {@code reference} regardless of its lifecycle. */
  public MockFaults forceStatus(String reference, String status) {
    forcedStatuses.put(reference, status);
    return this;
  }

  /** Sleep before answering each intent request. */
  public MockFaults delayResponses(Duration delay) {
    this.responseDelay = delay == null ? Duration.ZERO : delay;
    return this;
  }

  public void reset() {
    failuresLeft.set(0);
    failureStatus = 503;
    nextRejection.set(null);
    forcedStatuses.clear();
    responseDelay = Duration.ZERO;
  }

  /** Consumes one pending failure; returns its status, or 0 when none is pending. */
  int takeFailure() {
    while (true) {
      int left = failuresLeft.get();
      if (left <= 0) return 0;
      if (failuresLeft.compareAndSet(left, left - 1)) return failureStatus;
    }
  }

  String takeRejection() {
    return nextRejection.getAndSet(null);
  }

  String forcedStatus(String reference) {
    return forcedStatuses.get(reference);
  }

  Duration responseDelay() {
    return responseDelay;
  }
}
