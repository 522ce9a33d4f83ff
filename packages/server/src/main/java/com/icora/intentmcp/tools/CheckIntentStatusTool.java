package com.icora.intentmcp.tools;

import com.icora.intentmcp.engine.IntentLifecycleEngine;
import com.icora.intentmcp.model.IntentSummary;

/** Pulls the backend status and reconciles the local record with it. */
public class CheckIntentStatusTool extends AbstractIntentTool {
  public static final String NAME = "check_intent_status";

  public CheckIntentStatusTool(IntentLifecycleEngine engine) {
    super(engine);
  }

  @Override
  protected ToolDefinition buildDefinition() {
    return ToolDefinition.named(NAME)
        .description(
            "Ask the backend for the current status of a Submitted, Active or Failed intent and"
                + " update the local record when they differ.")
        .argument(intentId("Intent id."))
        .build();
  }

  @Override
  public Object execute(ToolArguments args) {
    return IntentSummary.of(engine.checkStatus(args.requireString("id")));
  }
}
