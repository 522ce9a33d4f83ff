package com.icora.intentmcp.tools;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** One node of a tool's input schema, rendered to JSON Schema by {@link #toJsonSchema()}. */
public class ToolProperty {
  public enum Type {
    STRING,
    BOOLEAN,
    INTEGER,
    NUMBER,
    OBJECT,
    ARRAY;

    public String jsonName() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  private final String name;
  private final String description;
  private final boolean required;
  private final Type type;
  private final ToolProperty items;
  private final List<ToolProperty> properties;
  private final List<String> enumValues;
  private final boolean additionalProperties;
  private final Integer minProperties;

  public ToolProperty(String name, String description, boolean required, Type type) {
    this(name, description, required, type, null, null, null, false, null);
  }

  public ToolProperty(
      String name,
      String description,
      boolean required,
      Type type,
      ToolProperty items,
      List<ToolProperty> properties,
      List<String> enumValues,
      boolean additionalProperties,
      Integer minProperties) {
    this.name = name;
    this.description = description;
    this.required = required;
    this.type = Objects.requireNonNull(type, "type");
    this.items = items;
    this.properties = properties == null ? Collections.emptyList() : List.copyOf(properties);
    this.enumValues = enumValues == null ? Collections.emptyList() : List.copyOf(enumValues);
    this.additionalProperties = additionalProperties;
    this.minProperties = minProperties;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public boolean isRequired() {
    return required;
  }

  public Type getType() {
    return type;
  }

  public ToolProperty getItems() {
    return items;
  }

  public List<ToolProperty> getProperties() {
    return properties;
  }

  public List<String> getEnumValues() {
    return enumValues;
  }

  /** Whether an object accepts keys beyond {@link #getProperties()}. */
  public boolean isAdditionalProperties() {
    return additionalProperties;
  }

  public Integer getMinProperties() {
    return minProperties;
  }

  public List<String> requiredNames() {
    List<String> names = new ArrayList<>();
    for (ToolProperty p : properties) {
      if (p.isRequired()) names.add(p.getName());
    }
    return names;
  }

  /** Properties of an object node as JSON Schema, keyed by property name. */
  public Map<String, Object> propertiesAsJsonSchema() {
    Map<String, Object> props = new LinkedHashMap<>();
    for (ToolProperty p : properties) {
      props.put(p.getName(), p.toJsonSchema());
    }
    return props;
  }

  public Map<String, Object> toJsonSchema() {
    Map<String, Object> schema = new LinkedHashMap<>();
    schema.put("type", type.jsonName());
    if (description != null) {
      schema.put("description", description);
    }
    if (!enumValues.isEmpty()) {
      schema.put("enum", enumValues);
    }
    if (type == Type.ARRAY && items != null) {
      schema.put("items", items.toJsonSchema());
    }
    if (type == Type.OBJECT) {
      if (!properties.isEmpty()) {
        schema.put("properties", propertiesAsJsonSchema());
        List<String> req = requiredNames();
        if (!req.isEmpty()) schema.put("required", req);
      }
      schema.put("additionalProperties", additionalProperties);
      if (minProperties != null) schema.put("minProperties", minProperties);
    }
    return schema;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ToolProperty that)) return false;
    return isRequired() == that.isRequired()
        && Objects.equals(getName(), that.getName())
        && Objects.equals(getDescription(), that.getDescription())
        && getType() == that.getType();
  }

  @Override
  public int hashCode() {
    return Objects.hash(getName(), getDescription(), isRequired(), getType());
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private String name;
    private String description;
    private boolean required;
    private Type type;
    private ToolProperty items;
    private List<ToolProperty> properties;
    private List<String> enumValues;
    private boolean additionalProperties;
    private Integer minProperties;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder required(boolean required) {
      this.required = required;
      return this;
    }

    public Builder type(Type type) {
      this.type = type;
      return this;
    }

    public Builder items(ToolProperty items) {
      this.items = items;
      return this;
    }

    public Builder property(ToolProperty property) {
      if (this.properties == null) {
        this.properties = new ArrayList<>();
      }
      this.properties.add(property);
      return this;
    }

    public Builder enumValues(List<String> enumValues) {
      this.enumValues = enumValues;
      return this;
    }

    public Builder additionalProperties(boolean additionalProperties) {
      this.additionalProperties = additionalProperties;
      return this;
    }

    public Builder minProperties(Integer minProperties) {
      this.minProperties = minProperties;
      return this;
    }

    public ToolProperty build() {
      return new ToolProperty(
          name,
          description,
          required,
          type,
          items,
          properties,
          enumValues,
          additionalProperties,
          minProperties);
    }
  }
}
