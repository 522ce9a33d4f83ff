package com.icora.intentmcp.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.icora.intentmcp.exception.ValidationException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/** Lifecycle state of an intent. Serialized with its label ("Draft", "Active", ...). */
public enum IntentState {
  DRAFT("Draft"),
  SUBMITTED("Submitted"),
  ACTIVE("Active"),
  FAILED("Failed"),
  TERMINATED("Terminated");

  private final String label;

  IntentState(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  /** Case-insensitive lookup by label or constant name. */
  @JsonCreator
  public static IntentState fromLabel(String value) {
    if (value != null) {
      for (IntentState s : values()) {
        if (s.label.equalsIgnoreCase(value.trim()) || s.name().equalsIgnoreCase(value.trim())) {
          return s;
        }
      }
    }
    throw new ValidationException(
        "Unknown intent state '%s'".formatted(value), Map.of("allowed", labels()));
  }

  public static List<String> labels() {
    return Arrays.stream(values()).map(IntentState::label).toList();
  }

  @Override
  public String toString() {
    return label;
  }
}
