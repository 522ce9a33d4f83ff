package com.icora.intentmcp.engine;

import static com.icora.intentmcp.engine.LifecycleEvent.*;
import static com.icora.intentmcp.model.IntentState.*;

import com.icora.intentmcp.exception.InvalidTransitionException;
import com.icora.intentmcp.model.Intent;
import com.icora.intentmcp.model.IntentState;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The lifecycle state machine as data: every permitted {@code (state, event)} pair and its
 * target. Pairs not listed are invalid and leave the record untouched.
 *
 * <pre>
 * Draft       SUBMIT -> Submitted, UPDATE -> Draft, DELETE
 * Submitted   CONFIRM_ACTIVE -> Active, REJECT -> Failed, BACKEND_TERMINATED -> Terminated,
 *             QUERY | BACKEND_PENDING | BACKEND_UNAVAILABLE -> Submitted
 * Active      TERMINATE -> Terminated, REJECT -> Failed, BACKEND_TERMINATED -> Terminated,
 *             BACKEND_PENDING -> Submitted, QUERY | CONFIRM_ACTIVE | BACKEND_UNAVAILABLE -> Active
 * Failed      CONFIRM_ACTIVE -> Active, BACKEND_PENDING -> Submitted,
 *             BACKEND_TERMINATED -> Terminated, QUERY | REJECT | BACKEND_UNAVAILABLE -> Failed,
 *             DELETE
 * Terminated  DELETE
 * </pre>
 *
 * A draft whose last submission has no known outcome ({@link Intent#submissionPending()}) only
 * accepts SUBMIT: the backend may already hold an entity built from its current content.
 */
public final class TransitionTable {
  private static final TransitionTable STANDARD = buildStandard();

  /** Events refused while a submission is pending. */
  private static final Set<LifecycleEvent> PENDING_GUARDED = EnumSet.of(UPDATE, DELETE);

  private final Map<IntentState, Map<LifecycleEvent, Transition>> rows;

  private TransitionTable(Map<IntentState, Map<LifecycleEvent, Transition>> rows) {
    this.rows = rows;
  }

  public static TransitionTable standard() {
    return STANDARD;
  }

  private static TransitionTable buildStandard() {
    Builder b = new Builder();
    b.on(DRAFT, SUBMIT, SUBMITTED).on(DRAFT, UPDATE, DRAFT).removeOn(DRAFT);

    b.on(SUBMITTED, CONFIRM_ACTIVE, ACTIVE)
        .on(SUBMITTED, REJECT, FAILED)
        .on(SUBMITTED, BACKEND_TERMINATED, TERMINATED)
        .on(SUBMITTED, QUERY, SUBMITTED)
        .on(SUBMITTED, BACKEND_PENDING, SUBMITTED)
        .on(SUBMITTED, BACKEND_UNAVAILABLE, SUBMITTED);

    b.on(ACTIVE, TERMINATE, TERMINATED)
        .on(ACTIVE, REJECT, FAILED)
        .on(ACTIVE, BACKEND_TERMINATED, TERMINATED)
        .on(ACTIVE, BACKEND_PENDING, SUBMITTED)
        .on(ACTIVE, QUERY, ACTIVE)
        .on(ACTIVE, CONFIRM_ACTIVE, ACTIVE)
        .on(ACTIVE, BACKEND_UNAVAILABLE, ACTIVE);

    b.on(FAILED, CONFIRM_ACTIVE, ACTIVE)
        .on(FAILED, BACKEND_PENDING, SUBMITTED)
        .on(FAILED, BACKEND_TERMINATED, TERMINATED)
        .on(FAILED, QUERY, FAILED)
        .on(FAILED, REJECT, FAILED)
        .on(FAILED, BACKEND_UNAVAILABLE, FAILED)
        .removeOn(FAILED);

    b.removeOn(TERMINATED);
    return b.build();
  }

  public Optional<Transition> find(IntentState from, LifecycleEvent event) {
    return Optional.ofNullable(rows.getOrDefault(from, Collections.emptyMap()).get(event));
  }

  /** The transition for the intent's current state, or {@link InvalidTransitionException}. */
  public Transition require(Intent intent, LifecycleEvent event) {
    if (intent.submissionPending() && PENDING_GUARDED.contains(event)) {
      Map<String, Object> ctx = new LinkedHashMap<>();
      ctx.put("id", intent.id());
      ctx.put("state", intent.state().label());
      ctx.put("event", event.name());
      ctx.put("submissionPending", true);
      ctx.put("allowedEvents", Set.of(SUBMIT));
      throw new InvalidTransitionException(
          "Cannot %s intent '%s': its last submission has no known outcome, submit it again first"
              .formatted(event.name().toLowerCase(Locale.ROOT), intent.id()),
          ctx);
    }
    return find(intent.state(), event)
        .orElseThrow(
            () -> {
              Map<String, Object> ctx = new LinkedHashMap<>();
              ctx.put("id", intent.id());
              ctx.put("state", intent.state().label());
              ctx.put("event", event.name());
              ctx.put("allowedEvents", allowedEvents(intent.state()));
              return new InvalidTransitionException(
                  "Cannot %s intent '%s' in state %s"
                      .formatted(
                          event.name().toLowerCase(Locale.ROOT),
                          intent.id(),
                          intent.state().label()),
                  ctx);
            });
  }

  public Set<LifecycleEvent> allowedEvents(IntentState state) {
    Map<LifecycleEvent, Transition> row = rows.get(state);
    return row == null || row.isEmpty()
        ? Collections.emptySet()
        : Collections.unmodifiableSet(row.keySet());
  }

  static final class Builder {
    private final Map<IntentState, Map<LifecycleEvent, Transition>> rows =
        new EnumMap<>(IntentState.class);

    Builder on(IntentState from, LifecycleEvent event, IntentState to) {
      if (event == CREATE) {
        throw new IllegalArgumentException("CREATE is not a state transition");
      }
      rows.computeIfAbsent(from, k -> new EnumMap<>(LifecycleEvent.class))
          .put(event, new Transition(from, event, to));
      return this;
    }

    Builder removeOn(IntentState from) {
      return on(from, DELETE, null);
    }

    TransitionTable build() {
      Map<IntentState, Map<LifecycleEvent, Transition>> copy = new EnumMap<>(IntentState.class);
      rows.forEach((k, v) -> copy.put(k, Collections.unmodifiableMap(new EnumMap<>(v))));
      return new TransitionTable(Collections.unmodifiableMap(copy));
    }
  }
}
