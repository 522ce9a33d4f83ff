package com.icora.intentmcp.tools;

import static org.junit.jupiter.api.Assertions.*;

import com.icora.intentmcp.engine.IntentLifecycleEngine;
import com.icora.intentmcp.exception.IntentMcpErrorCode;
import com.icora.intentmcp.exception.ValidationException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ToolInputValidator")
class ToolInputValidatorTest {

  @Mock private IntentLifecycleEngine engine;

  private final ToolInputValidator validator = new ToolInputValidator();

  private List<?> violations(ToolDefinition definition, Map<String, Object> args) {
    ValidationException e =
        assertThrows(ValidationException.class, () -> validator.validate(definition, args));
    assertEquals(IntentMcpErrorCode.VALIDATION_ERROR, e.getCode());
    assertEquals(definition.name(), e.getContext().get("tool"));
    return (List<?>) e.getContext().get("violations");
  }

  @Test
  void acceptsCompleteCreateArguments() {
    ToolArguments args =
        validator.validate(
            new CreateIntentTool(engine).definition(),
            Map.of(
                "name", "4K Broadcast",
                "description", "1000 participants",
                "specification", Map.of("bandwidth", "20Gbps")));

    assertEquals("4K Broadcast", args.requireString("name"));
    assertEquals(Map.of("bandwidth", "20Gbps"), args.requireObject("specification"));
  }

  @Test
  @DisplayName("all violations are reported together")
  void collectsEveryViolation() {
    Map<String, Object> args = new HashMap<>();
    args.put("name", 42);
    args.put("specification", Map.of());
    args.put("priority", "high");

    List<?> violations = violations(new CreateIntentTool(engine).definition(), args);

    assertTrue(violations.contains("'name' must be a string"));
    assertTrue(violations.contains("'description' is required"));
    assertTrue(violations.contains("'specification' must have at least 1 entry"));
    assertTrue(violations.contains("'priority' is not an accepted argument"));
  }

  @Test
  void blankIdIsRejected() {
    List<?> violations = violations(new SubmitIntentTool(engine).definition(), Map.of("id", " "));
    assertEquals(List.of("'id' must not be blank"), violations);
  }

  @Test
  void nullArgumentsAreTreatedAsEmpty() {
    List<?> violations = violations(new GetIntentTool(engine).definition(), null);
    assertEquals(List.of("'id' is required"), violations);
  }

  @Test
  void stateMustBeAKnownLabel() {
    ToolDefinition list = new ListIntentsTool(engine).definition();

    assertDoesNotThrow(() -> validator.validate(list, Map.of("state", "Active")));
    List<?> violations = violations(list, Map.of("state", "Running"));
    assertTrue(violations.get(0).toString().startsWith("'state' must be one of"));
  }

  @Test
  void specificationIsFreeForm() {
    ToolArguments args =
        validator.validate(
            new UpdateIntentTool(engine).definition(),
            Map.of("id", "intent-1", "specification", Map.of("any", Map.of("nested", true))));
    assertTrue(args.has("specification"));
    assertFalse(args.has("name"));
  }

  @Test
  void schemaIsAnObjectWithRequiredList() {
    Map<String, Object> schema = new CreateIntentTool(engine).definition().schema().toJsonSchema();

    assertEquals("object", schema.get("type"));
    assertEquals(List.of("name", "description", "specification"), schema.get("required"));
    assertEquals(false, schema.get("additionalProperties"));
  }
}
