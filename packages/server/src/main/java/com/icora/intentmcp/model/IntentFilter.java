package com.icora.intentmcp.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;

/** Criteria for listing intents. Empty criteria match every intent. */
public final class IntentFilter implements Predicate<Intent> {
  private static final IntentFilter ALL = new IntentFilter(Collections.emptySet(), null);

  private final Set<IntentState> states;
  private final String nameContains;

  private IntentFilter(Set<IntentState> states, String nameContains) {
    this.states =
        states.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(states));
    this.nameContains =
        nameContains == null || nameContains.isBlank()
            ? null
            : nameContains.trim().toLowerCase(Locale.ROOT);
  }

  public static IntentFilter all() {
    return ALL;
  }

  public static IntentFilter of(Set<IntentState> states, String nameContains) {
    return new IntentFilter(states == null ? Collections.emptySet() : states, nameContains);
  }

  public static IntentFilter byState(IntentState state) {
    return of(EnumSet.of(state), null);
  }

  public Set<IntentState> states() {
    return states;
  }

  public String nameContains() {
    return nameContains;
  }

  @Override
  public boolean test(Intent intent) {
    if (!states.isEmpty() && !states.contains(intent.state())) {
      return false;
    }
    return nameContains == null || intent.name().toLowerCase(Locale.ROOT).contains(nameContains);
  }
}
