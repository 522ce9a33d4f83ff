package com.icora.intentmcp.tools;

import com.icora.intentmcp.engine.IntentLifecycleEngine;
import com.icora.intentmcp.model.IntentFilter;
import com.icora.intentmcp.model.IntentState;
import com.icora.intentmcp.model.IntentSummary;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ListIntentsTool extends AbstractIntentTool {
  public static final String NAME = "list_intents";

  public ListIntentsTool(IntentLifecycleEngine engine) {
    super(engine);
  }

  @Override
  protected ToolDefinition buildDefinition() {
    return ToolDefinition.named(NAME)
        .description("List intents, optionally filtered by state and by a name fragment.")
        .argument(
            ToolProperty.builder()
                .name("state")
                .description("Only intents in this state.")
                .type(ToolProperty.Type.STRING)
                .enumValues(IntentState.labels())
                .build())
        .argument(
            new ToolProperty(
                "nameContains",
                "Case-insensitive fragment the intent name must contain.",
                false,
                ToolProperty.Type.STRING))
        .build();
  }

  @Override
  public Object execute(ToolArguments args) {
    String state = args.optionalString("state");
    IntentFilter filter =
        IntentFilter.of(
            state == null
                ? EnumSet.noneOf(IntentState.class)
                : EnumSet.of(IntentState.fromLabel(state)),
            args.optionalString("nameContains"));
    List<IntentSummary> intents = engine.list(filter).stream().map(IntentSummary::of).toList();

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("count", intents.size());
    result.put("intents", intents);
    return result;
  }
}
