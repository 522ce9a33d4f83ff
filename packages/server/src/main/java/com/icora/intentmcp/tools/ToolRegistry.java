package com.icora.intentmcp.tools;

import com.icora.intentmcp.engine.IntentLifecycleEngine;
import com.icora.intentmcp.exception.IntentMcpException;
import com.icora.intentmcp.exception.ValidationException;
import com.icora.intentmcp.logging.LoggingService;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * The fixed, versioned tool set. Every call goes through schema validation before the tool, and
 * every outcome, failures included, comes back as a structured {@link ToolCallResult}.
 */
public class ToolRegistry {
  private static final Logger log = LoggingService.getLogger(ToolRegistry.class);

  public static final String TOOLSET_VERSION = "1.0.0";

  private final Map<String, Tool> tools;
  private final ToolInputValidator validator = new ToolInputValidator();

  public ToolRegistry(IntentLifecycleEngine engine) {
    this(
        List.of(
            new CreateIntentTool(engine),
            new SubmitIntentTool(engine),
            new GetIntentTool(engine),
            new ListIntentsTool(engine),
            new UpdateIntentTool(engine),
            new TerminateIntentTool(engine),
            new DeleteIntentTool(engine),
            new CheckIntentStatusTool(engine)));
  }

  ToolRegistry(List<Tool> tools) {
    Map<String, Tool> byName = new LinkedHashMap<>();
    for (Tool tool : tools) {
      if (byName.putIfAbsent(tool.name(), tool) != null) {
        throw new IllegalArgumentException("Duplicate tool name: " + tool.name());
      }
    }
    this.tools = Collections.unmodifiableMap(byName);
  }

  public Collection<Tool> tools() {
    return tools.values();
  }

  public Optional<Tool> find(String name) {
    return Optional.ofNullable(tools.get(name));
  }

  public ToolCallResult call(String name, Map<String, Object> arguments) {
    long start = System.nanoTime();
    try (MDC.MDCCloseable ignored = LoggingService.toolContext(name)) {
      Tool tool =
          find(name)
              .orElseThrow(
                  () ->
                      new ValidationException(
                          "Unknown tool '%s'".formatted(name),
                          Map.of("available", List.copyOf(tools.keySet()))));
      ToolArguments args = validator.validate(tool.definition(), arguments);
      ToolCallResult result = ToolCallResult.success(tool.execute(args));
      log.info("Tool {} succeeded in {} ms", name, elapsedMs(start));
      return result;
    } catch (IntentMcpException e) {
      log.info("Tool {} failed in {} ms: {}", name, elapsedMs(start), e.toString());
      return ToolCallResult.failure(e);
    } catch (RuntimeException e) {
      log.error("Tool {} failed unexpectedly", name, e);
      return ToolCallResult.failure(e);
    }
  }

  private static long elapsedMs(long start) {
    return (System.nanoTime() - start) / 1_000_000L;
  }
}
