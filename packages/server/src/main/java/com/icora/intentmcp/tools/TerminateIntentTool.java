package com.icora.intentmcp.tools;

import com.icora.intentmcp.engine.IntentLifecycleEngine;
import com.icora.intentmcp.model.IntentSummary;

public class TerminateIntentTool extends AbstractIntentTool {
  public static final String NAME = "terminate_intent";

  public TerminateIntentTool(IntentLifecycleEngine engine) {
    super(engine);
  }

  @Override
  protected ToolDefinition buildDefinition() {
    return ToolDefinition.named(NAME)
        .description(
            "Terminate an Active intent. The intent ends Terminated even if the backend"
                + " cancellation fails; the failure is reported in lastError.")
        .argument(intentId("Id of the Active intent to terminate."))
        .build();
  }

  @Override
  public Object execute(ToolArguments args) {
    return IntentSummary.of(engine.terminate(args.requireString("id")));
  }
}
