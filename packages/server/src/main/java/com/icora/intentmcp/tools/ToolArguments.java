package com.icora.intentmcp.tools;

import com.icora.intentmcp.exception.ValidationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Typed read access to validated tool arguments. */
public final class ToolArguments {
  private final Map<String, Object> values;

  ToolArguments(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public static ToolArguments of(Map<String, Object> values) {
    return new ToolArguments(values == null ? Collections.emptyMap() : values);
  }

  public boolean has(String name) {
    return values.get(name) != null;
  }

  public String requireString(String name) {
    String value = optionalString(name);
    if (value == null) {
      throw new ValidationException("Missing required argument '" + name + "'");
    }
    return value;
  }

  public String optionalString(String name) {
    Object value = values.get(name);
    return value == null ? null : value.toString();
  }

  public Map<String, Object> optionalObject(String name) {
    Object value = values.get(name);
    if (value == null) return null;
    if (!(value instanceof Map<?, ?> map)) {
      throw new ValidationException("Argument '" + name + "' must be an object");
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    map.forEach((k, v) -> copy.put(String.valueOf(k), v));
    return copy;
  }

  public Map<String, Object> requireObject(String name) {
    Map<String, Object> value = optionalObject(name);
    if (value == null) {
      throw new ValidationException("Missing required argument '" + name + "'");
    }
    return value;
  }

  public Map<String, Object> asMap() {
    return values;
  }
}
