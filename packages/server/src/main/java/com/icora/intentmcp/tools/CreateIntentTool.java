package com.icora.intentmcp.tools;

import com.icora.intentmcp.engine.IntentLifecycleEngine;
import com.icora.intentmcp.model.IntentSummary;

/** Authors a new draft intent. Never contacts the backend. */
public class CreateIntentTool extends AbstractIntentTool {
  public static final String NAME = "create_intent";

  public CreateIntentTool(IntentLifecycleEngine engine) {
    super(engine);
  }

  @Override
  protected ToolDefinition buildDefinition() {
    return ToolDefinition.named(NAME)
        .description(
            "Create a new network intent in Draft state. Use submit_intent to send it to the"
                + " network.")
        .argument(
            new ToolProperty("name", "Short human readable name.", true, ToolProperty.Type.STRING))
        .argument(
            new ToolProperty(
                "description",
                "What the intent is for, e.g. '4K broadcast for 1000 participants'.",
                true,
                ToolProperty.Type.STRING))
        .argument(specification(true))
        .build();
  }

  @Override
  public Object execute(ToolArguments args) {
    return IntentSummary.of(
        engine.create(
            args.requireString("name"),
            args.requireString("description"),
            args.requireObject("specification")));
  }
}
