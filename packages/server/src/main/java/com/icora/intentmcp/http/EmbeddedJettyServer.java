package com.icora.intentmcp.http;

import com.icora.intentmcp.exception.ConfigException;
import com.icora.intentmcp.exception.ExceptionUtil;
import com.icora.intentmcp.exception.IoException;
import com.icora.intentmcp.logging.LoggingService;
import java.io.IOException;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.slf4j.Logger;

/**
 * The single Jetty 12 instance of the process. The MCP endpoint, the health endpoint and the mock
 * backend register their servlets on {@link #getContextHandler()} between {@link #prepare()} and
 * {@link #start()}.
 *
 * <p>Reads {@code http.hostname} (default {@code 0.0.0.0}, all interfaces) and {@code http.port}
 * (default 8080; 0 picks a free port, known after {@link #bind()}).
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(EmbeddedJettyServer.class);

  static final int DEFAULT_PORT = 8080;
  static final String ANY_HOST = "0.0.0.0";

  private final Configuration configuration;
  private Server server;
  private ServerConnector connector;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Configuration configuration) {
    this.configuration = Objects.requireNonNull(configuration, "configuration");
  }

  /** Build the server and its root context. Calling it again is a no-op. */
  public synchronized void prepare() {
    if (server != null) {
      return;
    }
    int port = configuredPort();
    String host = configuredHost();

    Server s = new Server();
    ServerConnector c = new ServerConnector(s);
    if (!ANY_HOST.equals(host)) {
      c.setHost(host);
    }
    c.setPort(port);
    s.addConnector(c);

    ServletContextHandler root = new ServletContextHandler();
    root.setContextPath("/");
    s.setHandler(root);

    this.server = s;
    this.connector = c;
    this.contextHandler = root;
    log.debug("Jetty prepared for {}:{}", host, port);
  }

  /**
   * Open the listening socket before {@link #start()}, so that components wired afterwards can be
   * told the real port.
   */
  public synchronized int bind() {
    prepare();
    try {
      connector.open();
    } catch (IOException e) {
      throw new IoException(
          "Could not listen on %s:%d".formatted(configuredHost(), configuredPort()), e);
    }
    return connector.getLocalPort();
  }

  public synchronized void start() {
    if (server == null) {
      log.warn("start() without prepare(), preparing now");
      prepare();
    }
    if (server.isStarted()) {
      return;
    }
    try {
      server.start();
    } catch (Exception e) {
      throw ExceptionUtil.translate(
          e,
          cause ->
              new IoException(
                  "Jetty did not start, is %s:%d already in use?"
                      .formatted(configuredHost(), configuredPort()),
                  cause));
    }
    log.info("HTTP listening on port {}", getPort());
  }

  /** Stop and forget the server; a later {@link #prepare()} builds a fresh one. */
  public synchronized void stop() {
    if (server == null) {
      return;
    }
    try {
      server.stop();
    } catch (Exception e) {
      // Shutdown carries on with the other components.
      log.error("Jetty did not stop cleanly", e);
    } finally {
      server = null;
      connector = null;
      contextHandler = null;
    }
  }

  /** Bound port once listening, otherwise the configured one. */
  public synchronized int getPort() {
    if (connector != null && connector.getLocalPort() > 0) {
      return connector.getLocalPort();
    }
    return configuredPort();
  }

  public synchronized ServletContextHandler getContextHandler() {
    return contextHandler;
  }

  @Override
  public void close() {
    stop();
  }

  private int configuredPort() {
    int port;
    try {
      port = configuration.getInt("http.port", DEFAULT_PORT);
    } catch (RuntimeException e) {
      throw new ConfigException("http.port must be a number", e);
    }
    if (port < 0 || port > 65535) {
      throw new ConfigException("http.port out of range: " + port);
    }
    return port;
  }

  private String configuredHost() {
    String host = configuration.getString("http.hostname", ANY_HOST);
    if (host == null || host.isBlank()) {
      throw new ConfigException("http.hostname must not be blank");
    }
    return host.trim();
  }
}
