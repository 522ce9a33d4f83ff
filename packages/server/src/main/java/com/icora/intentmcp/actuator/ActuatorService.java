package com.icora.intentmcp.actuator;

import com.icora.intentmcp.engine.IntentLifecycleEngine;
import com.icora.intentmcp.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Health endpoint in the style of Spring Boot's actuator, at {@code /actuator/health}.
 *
 * <p>Response body: {@code {"status":"UP","intents":3,"backend":"UP"}}. Without an engine (mock
 * backend mode) only the status is reported.
 */
public class ActuatorService {
  private static final org.slf4j.Logger log =
      com.icora.intentmcp.logging.LoggingService.getLogger(ActuatorService.class);

  public static final String PATH = "/actuator/health";

  private final IntentLifecycleEngine engine;

  public ActuatorService(IntentLifecycleEngine engine) {
    this.engine = engine;
  }

  /** Register the actuator servlet with the shared Jetty context handler. */
  public void register(ServletContextHandler contextHandler) {
    contextHandler.addServlet(new ServletHolder(new ActuatorServlet()), PATH);
    log.info("Actuator health endpoint registered at {}", PATH);
  }

  Map<String, Object> health() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "UP");
    if (engine != null) {
      body.put("intents", engine.count());
      body.put("backend", engine.backendReachable() ? "UP" : "DOWN");
    }
    return body;
  }

  private class ActuatorServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      resp.setStatus(200);
      resp.setContentType("application/json");
      try (PrintWriter out = resp.getWriter()) {
        out.println(JacksonUtility.toJson(health()));
      }
    }
  }
}
