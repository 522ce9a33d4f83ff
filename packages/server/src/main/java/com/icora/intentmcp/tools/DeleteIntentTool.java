package com.icora.intentmcp.tools;

import com.icora.intentmcp.engine.IntentLifecycleEngine;
import java.util.LinkedHashMap;
import java.util.Map;

public class DeleteIntentTool extends AbstractIntentTool {
  public static final String NAME = "delete_intent";

  public DeleteIntentTool(IntentLifecycleEngine engine) {
    super(engine);
  }

  @Override
  protected ToolDefinition buildDefinition() {
    return ToolDefinition.named(NAME)
        .description(
            "Delete a Draft, Failed or Terminated intent record. Submitted and Active intents must"
                + " be terminated first. Deleted ids are never reused.")
        .argument(intentId("Id of the intent to delete."))
        .build();
  }

  @Override
  public Object execute(ToolArguments args) {
    String id = args.requireString("id");
    engine.delete(id);
    Map<String, Object> result = new LinkedHashMap<>();
    result.put("id", id);
    result.put("deleted", true);
    return result;
  }
}
