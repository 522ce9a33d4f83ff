package com.icora.intentmcp.tools;

import com.icora.intentmcp.engine.IntentLifecycleEngine;

/** Full intent record as stored locally; does not contact the backend. */
public class GetIntentTool extends AbstractIntentTool {
  public static final String NAME = "get_intent";

  public GetIntentTool(IntentLifecycleEngine engine) {
    super(engine);
  }

  @Override
  protected ToolDefinition buildDefinition() {
    return ToolDefinition.named(NAME)
        .description("Return the full intent record, including its specification.")
        .argument(intentId("Intent id."))
        .build();
  }

  @Override
  public Object execute(ToolArguments args) {
    return engine.get(args.requireString("id"));
  }
}
