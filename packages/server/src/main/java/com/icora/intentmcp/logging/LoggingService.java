package com.icora.intentmcp.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * SLF4J logger access for the server, plus the two things logback.xml cannot know about: level
 * overrides from {@code logging.level.*} in application.yaml, and the MDC keys that tag log lines
 * with the tool and intent being worked on.
 */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  /** Logger that receives one line per intent state change. */
  public static final String LIFECYCLE_LOGGER = "intent.lifecycle";

  public static final String MDC_TOOL = "tool";
  public static final String MDC_INTENT = "intentId";

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  public static Logger lifecycleLogger() {
    return LoggerFactory.getLogger(LIFECYCLE_LOGGER);
  }

  /** Tag log lines of the current thread with the tool being called, until closed. */
  public static MDC.MDCCloseable toolContext(String toolName) {
    return MDC.putCloseable(MDC_TOOL, toolName);
  }

  /** Tag log lines of the current thread with the intent being transitioned, until closed. */
  public static MDC.MDCCloseable intentContext(String intentId) {
    return MDC.putCloseable(MDC_INTENT, intentId);
  }

  /**
   * Apply {@code logging.level.<logger>: <LEVEL>} entries; {@code root} addresses the root logger.
   * Unknown levels are skipped with a warning.
   *
   * @return the levels that were applied, keyed by logger name
   */
  public static Map<String, Level> applyConfiguration(Configuration cfg) {
    Map<String, Level> applied = new LinkedHashMap<>();
    if (cfg == null || !(LoggerFactory.getILoggerFactory() instanceof LoggerContext ctx)) {
      return applied;
    }
    Configuration levels = cfg.subset("logging.level");
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String key = keys.next();
      String value = levels.getString(key, null);
      Level level = value == null ? null : Level.toLevel(value.trim(), null);
      if (level == null) {
        log.warn("Ignoring logging.level.{}: '{}' is not a log level", key, value);
        continue;
      }
      String name = "root".equalsIgnoreCase(key) ? Logger.ROOT_LOGGER_NAME : key;
      ctx.getLogger(name).setLevel(level);
      applied.put(name, level);
    }
    if (!applied.isEmpty()) {
      log.debug("Applied log levels {}", applied);
    }
    return applied;
  }
}
