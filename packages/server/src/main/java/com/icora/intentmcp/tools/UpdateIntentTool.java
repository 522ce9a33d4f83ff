package com.icora.intentmcp.tools;

import com.icora.intentmcp.engine.IntentLifecycleEngine;
import com.icora.intentmcp.model.IntentSummary;
import com.icora.intentmcp.model.IntentUpdate;

public class UpdateIntentTool extends AbstractIntentTool {
  public static final String NAME = "update_intent";

  public UpdateIntentTool(IntentLifecycleEngine engine) {
    super(engine);
  }

  @Override
  protected ToolDefinition buildDefinition() {
    return ToolDefinition.named(NAME)
        .description(
            "Change name, description and/or specification of a Draft intent. A supplied"
                + " specification replaces the previous one.")
        .argument(intentId("Id of the Draft intent to change."))
        .argument(new ToolProperty("name", "New name.", false, ToolProperty.Type.STRING))
        .argument(
            new ToolProperty("description", "New description.", false, ToolProperty.Type.STRING))
        .argument(specification(false))
        .build();
  }

  @Override
  public Object execute(ToolArguments args) {
    IntentUpdate update =
        new IntentUpdate(
            args.optionalString("name"),
            args.optionalString("description"),
            args.optionalObject("specification"));
    return IntentSummary.of(engine.update(args.requireString("id"), update));
  }
}
