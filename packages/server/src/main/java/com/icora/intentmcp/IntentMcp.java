package com.icora.intentmcp;

import com.icora.intentmcp.actuator.ActuatorService;
import com.icora.intentmcp.backend.BackendClient;
import com.icora.intentmcp.backend.BackendClientFactory;
import com.icora.intentmcp.engine.EngineSettings;
import com.icora.intentmcp.engine.IntentLifecycleEngine;
import com.icora.intentmcp.engine.LoggingLifecycleListener;
import com.icora.intentmcp.exception.StateException;
import com.icora.intentmcp.http.EmbeddedJettyServer;
import com.icora.intentmcp.mcp.McpServer;
import com.icora.intentmcp.mock.MockTmf921Server;
import com.icora.intentmcp.store.IntentStore;
import com.icora.intentmcp.store.IntentStoreFactory;
import com.icora.intentmcp.tools.ToolRegistry;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

/**
 * Application context: builds and wires every component explicitly, owns their lifecycle.
 *
 * <p>In {@code server} mode the HTTP server hosts the MCP endpoint, the actuator and, when {@code
 * backend.mock.enabled} is set, the mock TMF921 backend. In {@code mock-backend} mode it hosts only
 * the mock and the actuator.
 */
public class IntentMcp {

  private static final org.slf4j.Logger log =
      com.icora.intentmcp.logging.LoggingService.getLogger(IntentMcp.class);

  private final StartupParameters startupParameters;
  private final Clock clock;
  private Configuration configuration;
  private EmbeddedJettyServer httpServer;
  private MockTmf921Server mockBackend;
  private IntentStore intentStore;
  private BackendClient backendClient;
  private IntentLifecycleEngine engine;
  private ToolRegistry toolRegistry;
  private McpServer mcpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public IntentMcp(String[] applicationArgs) {
    this(new StartupParameters(applicationArgs), null, Clock.systemUTC());
  }

  /** Use a pre-built configuration instead of loading {@code --config-file}. */
  public IntentMcp(StartupParameters startupParameters, Configuration configuration, Clock clock) {
    this.startupParameters = startupParameters;
    this.configuration = configuration;
    this.clock = clock;
  }

  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    if (configuration == null) {
      configuration = new ConfigurationProvider(startupParameters.configFile()).config();
    }
    // Apply logging levels from application.yaml as early as possible
    com.icora.intentmcp.logging.LoggingService.applyConfiguration(configuration);

    this.httpServer = new EmbeddedJettyServer(configuration);
    httpServer.prepare();

    try {
      int port = httpServer.bind();
      boolean mockOnly = StartupParameters.MODE_MOCK_BACKEND.equals(startupParameters.mode());

      if (mockOnly || configuration.getBoolean("backend.mock.enabled", false)) {
        mockBackend = new MockTmf921Server(configuration, clock);
        mockBackend.register(httpServer.getContextHandler());
        if (!mockOnly && !configuration.containsKey("backend.base-url")) {
          String baseUrl = "http://localhost:%d%s".formatted(port, mockBackend.contextPath());
          log.info("Routing backend calls to the embedded mock at {}", baseUrl);
          configuration.setProperty("backend.base-url", baseUrl);
        }
      }

      if (!mockOnly) {
        intentStore = IntentStoreFactory.create(configuration);
        backendClient = BackendClientFactory.create(configuration, clock);
        engine =
            new IntentLifecycleEngine(
                intentStore, backendClient, EngineSettings.fromConfiguration(configuration), clock);
        engine.addListener(new LoggingLifecycleListener());
        toolRegistry = new ToolRegistry(engine);

        mcpServer = new McpServer(configuration, toolRegistry);
        mcpServer.register(httpServer.getContextHandler());
      }
      new ActuatorService(engine).register(httpServer.getContextHandler());

      // Start Jetty (non-blocking)
      httpServer.start();
      log.info("Intent MCP started in {} mode on port {}", startupParameters.mode(), port);
    } catch (RuntimeException e) {
      shutdown();
      throw new StateException(
          "Could not start intent MCP in " + startupParameters.mode() + " mode", e);
    }
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "intent-mcp-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        closeQuietly(mcpServer);
        closeQuietly(httpServer);
        closeQuietly(engine);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Failed to close {}", closeable.getClass().getSimpleName(), e);
      }
    }
  }

  public Configuration configuration() {
    if (configuration == null) {
      throw new StateException("IntentMcp not initialized. Call initialize() first.");
    }
    return configuration;
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  public MockTmf921Server mockBackend() {
    return mockBackend;
  }

  public IntentLifecycleEngine engine() {
    return engine;
  }

  public ToolRegistry toolRegistry() {
    return toolRegistry;
  }
}
