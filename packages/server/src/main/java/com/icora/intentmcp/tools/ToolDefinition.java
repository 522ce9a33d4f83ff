package com.icora.intentmcp.tools;

import java.util.Objects;

/**
 * What an MCP client sees of a tool before calling it.
 *
 * @param name stable tool name, e.g. {@code submit_intent}
 * @param description one paragraph shown to the agent
 * @param schema input schema; always an object whose properties are the tool arguments
 */
public record ToolDefinition(String name, String description, ToolProperty schema) {

  public ToolDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(description, "description");
    Objects.requireNonNull(schema, "schema");
    if (schema.getType() != ToolProperty.Type.OBJECT) {
      throw new IllegalArgumentException(name + ": input schema root must be an object");
    }
  }

  /** Starts a definition whose schema rejects arguments it does not declare. */
  public static Builder named(String name) {
    return new Builder(name);
  }

  public static final class Builder {
    private final String name;
    private String description = "";
    private final ToolProperty.Builder root =
        ToolProperty.builder().type(ToolProperty.Type.OBJECT).additionalProperties(false);

    private Builder(String name) {
      this.name = name;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder argument(ToolProperty property) {
      root.property(property);
      return this;
    }

    public ToolDefinition build() {
      return new ToolDefinition(name, description, root.build());
    }
  }
}
