package com.icora.intentmcp.tools;

import com.icora.intentmcp.engine.IntentLifecycleEngine;
import java.util.Objects;

/** Shared plumbing for the intent tools: engine access and common argument definitions. */
abstract class AbstractIntentTool implements Tool {
  protected final IntentLifecycleEngine engine;
  private final ToolDefinition definition;

  protected AbstractIntentTool(IntentLifecycleEngine engine) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.definition = buildDefinition();
  }

  protected abstract ToolDefinition buildDefinition();

  @Override
  public String name() {
    return definition.name();
  }

  @Override
  public String summary() {
    return definition.description();
  }

  @Override
  public ToolDefinition definition() {
    return definition;
  }

  protected static ToolProperty intentId(String description) {
    return new ToolProperty("id", description, true, ToolProperty.Type.STRING);
  }

  protected static ToolProperty specification(boolean required) {
    return ToolProperty.builder()
        .name("specification")
        .description(
            "Desired network behaviour as key/value attributes, e.g. bandwidth, participants,"
                + " intentType, serviceArea, validFor, deliveryExpectations,"
                + " propertyExpectations.")
        .required(required)
        .type(ToolProperty.Type.OBJECT)
        .additionalProperties(true)
        .minProperties(1)
        .build();
  }
}
