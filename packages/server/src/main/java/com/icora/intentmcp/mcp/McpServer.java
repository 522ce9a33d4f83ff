package com.icora.intentmcp.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.icora.intentmcp.auth.BearerTokenFilter;
import com.icora.intentmcp.tools.Tool;
import com.icora.intentmcp.tools.ToolCallResult;
import com.icora.intentmcp.tools.ToolProperty;
import com.icora.intentmcp.tools.ToolRegistry;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.HttpServletStreamableServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import jakarta.servlet.DispatcherType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.FilterHolder;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Exposes the {@link ToolRegistry} over MCP Streamable HTTP using the official MCP SDK.
 *
 * <p>Configuration keys:
 *
 * <ul>
 *   <li><b>http.mcp.endpoint</b> (string) – servlet path; default: "/mcp"
 *   <li><b>http.mcp.disallow-delete</b> (boolean) – reject HTTP DELETE; default: false
 *   <li><b>http.mcp.auth.required</b> (boolean) – require a bearer token; default: true
 *   <li><b>http.mcp.server.name</b> (string) – server name reported to clients; default:
 *       "icora-intent-mcp"
 *   <li><b>http.mcp.server.version</b> (string) – reported version; default: the toolset version
 * </ul>
 */
public class McpServer implements AutoCloseable {

  private static final org.slf4j.Logger log =
      com.icora.intentmcp.logging.LoggingService.getLogger(McpServer.class);

  private final Configuration configuration;
  private final ToolRegistry toolRegistry;
  private HttpServletStreamableServerTransportProvider servletTransport;
  private McpSyncServer mcpServer;

  public McpServer(Configuration configuration, ToolRegistry toolRegistry) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
    this.toolRegistry = Objects.requireNonNull(toolRegistry, "toolRegistry");
  }

  /** Register the MCP servlet (and the bearer filter) on the shared context handler. */
  public void register(ServletContextHandler contextHandler) {
    String endpoint = normalizeEndpoint(configuration.getString("http.mcp.endpoint", "/mcp"));
    boolean disallowDelete = configuration.getBoolean("http.mcp.disallow-delete", false);
    boolean authRequired = configuration.getBoolean("http.mcp.auth.required", true);

    String serverName = configuration.getString("http.mcp.server.name", "icora-intent-mcp");
    String serverVersion =
        configuration.getString("http.mcp.server.version", ToolRegistry.TOOLSET_VERSION);

    var json = new JacksonMcpJsonMapper(new ObjectMapper());
    servletTransport =
        HttpServletStreamableServerTransportProvider.builder()
            .jsonMapper(json)
            .mcpEndpoint(endpoint)
            .disallowDelete(disallowDelete)
            .build();

    mcpServer =
        io.modelcontextprotocol.server.McpServer.sync(servletTransport)
            .serverInfo(serverName, serverVersion)
            .capabilities(McpSchema.ServerCapabilities.builder().tools(true).logging().build())
            .tools(toolSpecifications())
            .build();

    if (authRequired) {
      contextHandler.addFilter(
          new FilterHolder(new BearerTokenFilter()), endpoint, EnumSet.of(DispatcherType.REQUEST));
    } else {
      log.warn("MCP endpoint {} accepts unauthenticated requests", endpoint);
    }
    contextHandler.addServlet(new ServletHolder(servletTransport), endpoint);

    log.info(
        "MCP servlet registered at {} with {} tools (toolset {})",
        endpoint,
        toolRegistry.tools().size(),
        ToolRegistry.TOOLSET_VERSION);
  }

  List<McpServerFeatures.SyncToolSpecification> toolSpecifications() {
    List<McpServerFeatures.SyncToolSpecification> specs = new ArrayList<>();
    for (Tool tool : toolRegistry.tools()) {
      ToolProperty schema = tool.definition().schema();
      specs.add(
          McpServerFeatures.SyncToolSpecification.builder()
              .tool(
                  McpSchema.Tool.builder()
                      .name(tool.name())
                      .description(tool.summary())
                      .inputSchema(
                          new McpSchema.JsonSchema(
                              "object",
                              schema.propertiesAsJsonSchema(),
                              schema.requiredNames(),
                              schema.isAdditionalProperties(),
                              Collections.emptyMap(),
                              Collections.emptyMap()))
                      .build())
              .callHandler(
                  (srv, request) -> {
                    ToolCallResult result = toolRegistry.call(tool.name(), request.arguments());
                    return new McpSchema.CallToolResult(result.json(), result.isError());
                  })
              .build());
    }
    return specs;
  }

  /** Clean up MCP transport/resources. */
  @Override
  public void close() {
    try {
      if (mcpServer != null) {
        mcpServer.closeGracefully();
      }
    } finally {
      mcpServer = null;
      if (servletTransport != null) {
        try {
          servletTransport.destroy();
        } finally {
          servletTransport = null;
        }
      }
    }
  }

  private static String normalizeEndpoint(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) return "/mcp";
    return endpoint.startsWith("/") ? endpoint : "/" + endpoint;
  }
}
