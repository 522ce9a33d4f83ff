package com.icora.intentmcp.mcp;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.icora.intentmcp.engine.IntentLifecycleEngine;
import com.icora.intentmcp.exception.NotFoundException;
import com.icora.intentmcp.model.IntentState;
import com.icora.intentmcp.testing.Intents;
import com.icora.intentmcp.tools.ToolRegistry;
import com.icora.intentmcp.utility.JacksonUtility;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("McpServer tool specifications")
class McpServerTest {

  @Mock private IntentLifecycleEngine engine;

  private List<McpServerFeatures.SyncToolSpecification> specs;

  @BeforeEach
  void setUp() {
    specs = new McpServer(new BaseConfiguration(), new ToolRegistry(engine)).toolSpecifications();
  }

  private McpServerFeatures.SyncToolSpecification spec(String name) {
    return specs.stream().filter(s -> s.tool().name().equals(name)).findFirst().orElseThrow();
  }

  private static String text(McpSchema.CallToolResult result) {
    return ((McpSchema.TextContent) result.content().get(0)).text();
  }

  @Test
  void everyToolIsPublishedWithItsSchema() {
    assertEquals(8, specs.size());

    McpSchema.JsonSchema create = spec("create_intent").tool().inputSchema();
    assertEquals("object", create.type());
    assertEquals(List.of("name", "description", "specification"), create.required());
    assertEquals(Boolean.FALSE, create.additionalProperties());

    McpSchema.JsonSchema list = spec("list_intents").tool().inputSchema();
    assertTrue(list.required() == null || list.required().isEmpty());
    assertTrue(list.properties().containsKey("state"));
  }

  @Test
  void callIsRoutedThroughRegistry() {
    when(engine.get("intent-1")).thenReturn(Intents.inState("intent-1", IntentState.ACTIVE, "r1"));

    McpSchema.CallToolResult result =
        spec("get_intent")
            .callHandler()
            .apply(null, new McpSchema.CallToolRequest("get_intent", Map.of("id", "intent-1")));

    assertNotEquals(Boolean.TRUE, result.isError());
    Map<String, Object> json = JacksonUtility.toMap(text(result));
    assertEquals("Active", json.get("state"));
    assertEquals("r1", json.get("backendReference"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void failuresComeBackAsErrorResults() {
    when(engine.get("intent-x")).thenThrow(new NotFoundException("Intent 'intent-x' not found"));

    McpSchema.CallToolResult result =
        spec("get_intent")
            .callHandler()
            .apply(null, new McpSchema.CallToolRequest("get_intent", Map.of("id", "intent-x")));

    assertEquals(Boolean.TRUE, result.isError());
    Map<String, Object> error =
        (Map<String, Object>) JacksonUtility.toMap(text(result)).get("error");
    assertEquals("NOT_FOUND", error.get("code"));
  }
}
