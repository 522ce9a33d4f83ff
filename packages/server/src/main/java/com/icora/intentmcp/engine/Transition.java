package com.icora.intentmcp.engine;

import com.icora.intentmcp.model.IntentState;
import java.util.Objects;

/** One row of the {@link TransitionTable}. A {@code null} target removes the record. */
public final class Transition {
  private final IntentState from;
  private final LifecycleEvent event;
  private final IntentState to;

  Transition(IntentState from, LifecycleEvent event, IntentState to) {
    this.from = Objects.requireNonNull(from, "from");
    this.event = Objects.requireNonNull(event, "event");
    this.to = to;
  }

  public IntentState from() {
    return from;
  }

  public LifecycleEvent event() {
    return event;
  }

  public IntentState to() {
    return to;
  }

  public boolean removesRecord() {
    return to == null;
  }

  public boolean changesState() {
    return to != null && to != from;
  }

  @Override
  public String toString() {
    return from.label() + " --" + event + "--> " + (to == null ? "(removed)" : to.label());
  }
}
