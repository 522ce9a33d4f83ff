package com.icora.intentmcp.tools;

public interface Tool {
  String name();

  String summary();

  ToolDefinition definition();

  /**
   * Run the tool with arguments already validated against {@link #definition()}. The returned
   * object is serialized to JSON as the tool result.
   */
  Object execute(ToolArguments args);
}
