package com.icora.intentmcp.tools;

import com.icora.intentmcp.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks raw tool arguments against a {@link ToolDefinition}: required fields, JSON types, enum
 * membership and unexpected keys. All violations are collected and reported together.
 */
public class ToolInputValidator {

  public ToolArguments validate(ToolDefinition definition, Map<String, Object> arguments) {
    Map<String, Object> args = arguments == null ? Map.of() : arguments;
    List<String> violations = new ArrayList<>();
    validateObject("", definition.schema(), args, violations);
    if (!violations.isEmpty()) {
      Map<String, Object> ctx = new LinkedHashMap<>();
      ctx.put("tool", definition.name());
      ctx.put("violations", violations);
      String summary = String.join("; ", violations);
      throw new ValidationException(
          "Invalid arguments for %s: %s".formatted(definition.name(), summary), ctx);
    }
    return new ToolArguments(args);
  }

  private void validateObject(
      String path, ToolProperty schema, Map<?, ?> value, List<String> violations) {
    for (ToolProperty p : schema.getProperties()) {
      Object v = value.get(p.getName());
      String childPath = path.isEmpty() ? p.getName() : path + "." + p.getName();
      if (v == null) {
        if (p.isRequired()) {
          violations.add("'" + childPath + "' is required");
        }
        continue;
      }
      validateValue(childPath, p, v, violations);
    }
    if (!schema.isAdditionalProperties()) {
      for (Object key : value.keySet()) {
        boolean known =
            schema.getProperties().stream().anyMatch(p -> p.getName().equals(String.valueOf(key)));
        if (!known) {
          String keyPath = path.isEmpty() ? String.valueOf(key) : path + "." + key;
          violations.add("'" + keyPath + "' is not an accepted argument");
        }
      }
    }
    Integer min = schema.getMinProperties();
    if (min != null && value.size() < min) {
      violations.add(
          "'%s' must have at least %d entr%s"
              .formatted(path.isEmpty() ? "(root)" : path, min, min == 1 ? "y" : "ies"));
    }
  }

  private void validateValue(String path, ToolProperty p, Object v, List<String> violations) {
    switch (p.getType()) {
      case STRING:
        if (!(v instanceof String s)) {
          violations.add("'" + path + "' must be a string");
          return;
        }
        if (p.isRequired() && s.isBlank()) {
          violations.add("'" + path + "' must not be blank");
        }
        if (!p.getEnumValues().isEmpty() && !p.getEnumValues().contains(s)) {
          violations.add("'" + path + "' must be one of " + p.getEnumValues());
        }
        break;
      case BOOLEAN:
        if (!(v instanceof Boolean)) violations.add("'" + path + "' must be a boolean");
        break;
      case INTEGER:
        if (!isIntegral(v)) violations.add("'" + path + "' must be an integer");
        break;
      case NUMBER:
        if (!(v instanceof Number)) violations.add("'" + path + "' must be a number");
        break;
      case OBJECT:
        if (!(v instanceof Map<?, ?> m)) {
          violations.add("'" + path + "' must be an object");
          return;
        }
        validateObject(path, p, m, violations);
        break;
      case ARRAY:
        if (!(v instanceof Collection<?> c)) {
          violations.add("'" + path + "' must be an array");
          return;
        }
        if (p.getItems() != null) {
          int i = 0;
          for (Object item : c) {
            String itemPath = path + "[" + i++ + "]";
            if (item == null) {
              violations.add("'" + itemPath + "' must not be null");
            } else {
              validateValue(itemPath, p.getItems(), item, violations);
            }
          }
        }
        break;
    }
  }

  private static boolean isIntegral(Object v) {
    if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
      return true;
    }
    if (v instanceof Number n) {
      double d = n.doubleValue();
      return !Double.isInfinite(d) && d == Math.rint(d);
    }
    return false;
  }
}
