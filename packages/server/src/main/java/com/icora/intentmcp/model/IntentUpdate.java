package com.icora.intentmcp.model;

import java.util.Map;

/**
 * Fields to change on a draft intent. A {@code null} field leaves the current value untouched; a
 * supplied specification replaces the previous one as a whole.
 */
public final class IntentUpdate {
  private final String name;
  private final String description;
  private final Map<String, Object> specification;

  public IntentUpdate(String name, String description, Map<String, Object> specification) {
    this.name = name;
    this.description = description;
    this.specification = specification;
  }

  public String name() {
    return name;
  }

  public String description() {
    return description;
  }

  public Map<String, Object> specification() {
    return specification;
  }

  public boolean isEmpty() {
    return name == null && description == null && specification == null;
  }
}
