package com.icora.intentmcp;

import com.icora.intentmcp.logging.LoggingService;
import org.slf4j.Logger;

/** Command line entry point; see {@link StartupParameters} for the accepted options. */
public final class IntentMcpApp {
  private static final Logger log = LoggingService.getLogger(IntentMcpApp.class);

  /** Exit status for a bad command line. */
  static final int EXIT_USAGE = 2;

  /** Exit status for a failure while starting up. */
  static final int EXIT_STARTUP = 1;

  private IntentMcpApp() {}

  public static void main(String[] args) {
    IntentMcp app;
    try {
      app = new IntentMcp(args);
    } catch (IllegalArgumentException e) {
      log.error("Invalid command line: {}", e.getMessage());
      System.exit(EXIT_USAGE);
      return;
    }
    try {
      app.initialize();
    } catch (RuntimeException e) {
      log.error("Intent MCP server did not start", e);
      System.exit(EXIT_STARTUP);
      return;
    }
    app.waitShutdownSignal();
  }
}
