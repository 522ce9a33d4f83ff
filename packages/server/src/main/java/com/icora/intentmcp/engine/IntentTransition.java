package com.icora.intentmcp.engine;

import com.icora.intentmcp.model.IntentState;
import java.time.Instant;

/** Published lifecycle event. {@code from} is null on create and {@code to} is null on delete. */
public final class IntentTransition {
  public final String intentId;
  public final LifecycleEvent event;
  public final IntentState from;
  public final IntentState to;
  public final String backendReference;
  public final String lastError;
  public final Instant at;

  public IntentTransition(
      String intentId,
      LifecycleEvent event,
      IntentState from,
      IntentState to,
      String backendReference,
      String lastError,
      Instant at) {
    this.intentId = intentId;
    this.event = event;
    this.from = from;
    this.to = to;
    this.backendReference = backendReference;
    this.lastError = lastError;
    this.at = at;
  }

  @Override
  public String toString() {
    return "IntentTransition{"
        + intentId
        + ", "
        + event
        + ", "
        + from
        + " -> "
        + to
        + (lastError == null ? "" : ", lastError=" + lastError)
        + '}';
  }
}
