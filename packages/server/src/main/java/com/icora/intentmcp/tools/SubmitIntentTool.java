package com.icora.intentmcp.tools;

import com.icora.intentmcp.engine.IntentLifecycleEngine;
import com.icora.intentmcp.model.IntentSummary;

public class SubmitIntentTool extends AbstractIntentTool {
  public static final String NAME = "submit_intent";

  public SubmitIntentTool(IntentLifecycleEngine engine) {
    super(engine);
  }

  @Override
  protected ToolDefinition buildDefinition() {
    return ToolDefinition.named(NAME)
        .description(
            "Submit a Draft intent to the intent management backend. Safe to retry after a"
                + " BACKEND_UNAVAILABLE error.")
        .argument(intentId("Id of the Draft intent to submit."))
        .build();
  }

  @Override
  public Object execute(ToolArguments args) {
    return IntentSummary.of(engine.submit(args.requireString("id")));
  }
}
