package com.icora.intentmcp.model;

import java.time.Instant;

/** Compact view of an intent returned by mutating and listing tools. */
public final class IntentSummary {
  public final String id;
  public final String name;
  public final IntentState state;
  public final String backendReference;
  public final Instant updatedAt;
  public final String lastError;
  public final boolean submissionPending;

  private IntentSummary(Intent intent) {
    this.id = intent.id();
    this.name = intent.name();
    this.state = intent.state();
    this.backendReference = intent.backendReference();
    this.updatedAt = intent.updatedAt();
    this.lastError = intent.lastError();
    this.submissionPending = intent.submissionPending();
  }

  public static IntentSummary of(Intent intent) {
    return new IntentSummary(intent);
  }
}
