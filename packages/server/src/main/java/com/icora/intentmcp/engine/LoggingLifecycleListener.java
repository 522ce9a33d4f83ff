package com.icora.intentmcp.engine;

import com.icora.intentmcp.logging.LoggingService;
import com.icora.intentmcp.utility.JacksonUtility;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Writes each lifecycle event as one JSON line to the {@value LoggingService#LIFECYCLE_LOGGER}
 * logger; events carrying a {@code lastError} are logged at WARN.
 */
public class LoggingLifecycleListener implements IntentLifecycleListener {
  private final Logger log;

  public LoggingLifecycleListener() {
    this(LoggingService.lifecycleLogger());
  }

  LoggingLifecycleListener(Logger log) {
    this.log = log;
  }

  @Override
  public void onTransition(IntentTransition t) {
    boolean failed = t.lastError != null;
    if (failed ? !log.isWarnEnabled() : !log.isInfoEnabled()) return;
    Map<String, Object> json = new LinkedHashMap<>();
    json.put("intentId", t.intentId);
    json.put("event", t.event);
    json.put("from", t.from);
    json.put("to", t.to);
    json.put("backendReference", t.backendReference);
    json.put("lastError", t.lastError);
    json.put("at", t.at);
    String tool = MDC.get(LoggingService.MDC_TOOL);
    if (tool != null) {
      json.put("tool", tool);
    }
    if (failed) {
      log.warn("{}", JacksonUtility.toJson(json));
    } else {
      log.info("{}", JacksonUtility.toJson(json));
    }
  }
}
