package com.icora.intentmcp.mock;

import com.fasterxml.jackson.core.type.TypeReference;
import com.icora.intentmcp.auth.BearerCredential;
import com.icora.intentmcp.backend.BackendClientFactory;
import com.icora.intentmcp.backend.Tmf921BackendClient;
import com.icora.intentmcp.exception.AuthenticationException;
import com.icora.intentmcp.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * In-process mock of a TMF921 Intent Management API, served from the shared Jetty context.
 *
 * <p>Routes, relative to {@code backend.mock.context-path} (default {@code /mock-tmf921}):
 *
 * <ul>
 *   <li>{@code POST /intents}: create; 201 with {@code Location}, or 200 when the {@code
 *       Idempotency-Key} was seen before
 *   <li>{@code GET /intents/{id}}: status {@code created}, {@code active} once {@code
 *       backend.mock.activation-delay-ms} has elapsed, {@code terminated} after a delete
 *   <li>{@code DELETE /intents/{id}}
 *   <li>{@code POST /auth/keycloak_realm/protocol/openid-connect/token}: password grant
 *   <li>{@code GET /health}, {@code GET /__admin/mappings}
 * </ul>
 *
 * Intent routes require a well-formed bearer token. Misbehaviour is programmed through {@link
 * #faults()}.
 */
public class MockTmf921Server {
  private static final org.slf4j.Logger log =
      com.icora.intentmcp.logging.LoggingService.getLogger(MockTmf921Server.class);
  private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

  private final String contextPath;
  private final Duration activationDelay;
  private final long tokenExpiresIn;
  private final String expectedUsername;
  private final String expectedPassword;
  private final Clock clock;
  private final MockFaults faults = new MockFaults();
  private final Map<String, MockIntent> intents = new ConcurrentHashMap<>();
  private final Map<String, MockIntent> idempotencyKeys = new ConcurrentHashMap<>();
  private final AtomicInteger submissions = new AtomicInteger();

  public MockTmf921Server(Configuration cfg, Clock clock) {
    this.contextPath =
        normalizeContextPath(cfg.getString("backend.mock.context-path", "/mock-tmf921"));
    this.activationDelay = Duration.ofMillis(cfg.getLong("backend.mock.activation-delay-ms", 0L));
    this.tokenExpiresIn = cfg.getLong("backend.mock.token-expires-in", 3600L);
    this.expectedUsername = cfg.getString("backend.mock.username", null);
    this.expectedPassword = cfg.getString("backend.mock.password", null);
    this.clock = clock;
  }

  private static String normalizeContextPath(String contextPath) {
    if (contextPath == null || !contextPath.startsWith("/")) {
      throw new IllegalArgumentException("Invalid context path: " + contextPath);
    }
    return contextPath.endsWith("/")
        ? contextPath.substring(0, contextPath.length() - 1)
        : contextPath;
  }

  public String contextPath() {
    return contextPath;
  }

  public MockFaults faults() {
    return faults;
  }

  /** Number of distinct intents created, idempotent replays excluded. */
  public int createdCount() {
    return intents.size();
  }

  /** Number of POST /intents requests that reached the create logic. */
  public int submissionCount() {
    return submissions.get();
  }

  /** Name the backend entity was created with, if it exists. */
  public Optional<String> entityName(String reference) {
    return Optional.ofNullable(intents.get(reference)).map(i -> i.name);
  }

  /** Current status string of a backend entity, if it exists. */
  public Optional<String> entityStatus(String reference) {
    return Optional.ofNullable(intents.get(reference)).map(this::status);
  }

  /** Register the mock servlets on the shared Jetty context. */
  public void register(ServletContextHandler handler) {
    handler.addServlet(new ServletHolder(new HealthServlet()), contextPath + "/health");
    handler.addServlet(new ServletHolder(new MappingsServlet()), contextPath + "/__admin/mappings");
    handler.addServlet(
        new ServletHolder(new TokenServlet()),
        contextPath + BackendClientFactory.DEFAULT_TOKEN_PATH);
    handler.addServlet(new ServletHolder(new IntentsServlet()), contextPath + "/intents/*");
    log.info("Mock TMF921 servlets registered under {}/*", contextPath);
  }

  private class HealthServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("status", "healthy");
      body.put("service", "mock-tmf921");
      body.put("intents", intents.size());
      body.put("timestamp", clock.instant().toString());
      sendJson(resp, 200, body);
    }
  }

  private class MappingsServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      List<Map<String, Object>> mappings = new ArrayList<>();
      mappings.add(mapping("oauth-mapping", "POST", BackendClientFactory.DEFAULT_TOKEN_PATH, 200));
      mappings.add(mapping("intent-create", "POST", "/intents", 201));
      mappings.add(mapping("intent-get", "GET", "/intents/{id}", 200));
      mappings.add(mapping("intent-delete", "DELETE", "/intents/{id}", 200));
      mappings.add(mapping("health", "GET", "/health", 200));
      sendJson(resp, 200, Map.of("mappings", mappings, "meta", Map.of("total", mappings.size())));
    }

    private Map<String, Object> mapping(String id, String method, String path, int status) {
      Map<String, Object> m = new LinkedHashMap<>();
      m.put("id", id);
      m.put("request", Map.of("method", method, "urlPath", path));
      m.put("response", Map.of("status", status));
      return m;
    }
  }

  private class TokenServlet extends HttpServlet {
    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      String grantType = req.getParameter("grant_type");
      if (!"password".equals(grantType)) {
        sendError(resp, 400, "unsupported_grant_type", "Only password grant type is supported");
        return;
      }
      for (String field : new String[] {"username", "password", "client_id"}) {
        String v = req.getParameter(field);
        if (v == null || v.isBlank()) {
          sendError(resp, 400, "invalid_request", "Missing form field " + field);
          return;
        }
      }
      if (expectedUsername != null
          && (!expectedUsername.equals(req.getParameter("username"))
              || !String.valueOf(expectedPassword).equals(req.getParameter("password")))) {
        sendError(resp, 401, "invalid_grant", "Invalid user credentials");
        return;
      }

      Map<String, Object> token = new LinkedHashMap<>();
      token.put("access_token", "mock_token_" + randomHex(16));
      token.put("expires_in", tokenExpiresIn);
      token.put("refresh_expires_in", 1800);
      token.put("refresh_token", "mock_refresh_" + randomHex(16));
      token.put("token_type", "Bearer");
      token.put("session_state", "session_" + randomHex(8));
      token.put("scope", "email profile");
      resp.setHeader("Cache-Control", "no-store");
      resp.setHeader("Pragma", "no-cache");
      sendJson(resp, 200, token);
    }
  }

  private class IntentsServlet extends HttpServlet {
    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      if (!preflight(req, resp)) return;
      if (reference(req) != null) {
        sendError(resp, 405, "method_not_allowed", "POST is only accepted on /intents");
        return;
      }
      submissions.incrementAndGet();

      Map<String, Object> body;
      try {
        body = JacksonUtility.getJsonMapper().readValue(req.getInputStream(), MAP_TYPE);
      } catch (IOException e) {
        sendError(resp, 400, "validation_error", "Request body is not a JSON object");
        return;
      }
      if (body == null) {
        sendError(resp, 400, "validation_error", "Request body is empty");
        return;
      }
      String problem = validate(body);
      if (problem != null) {
        sendError(resp, 400, "validation_error", problem);
        return;
      }
      String rejection = faults.takeRejection();
      if (rejection != null) {
        sendError(resp, 400, "intent_rejected", rejection);
        return;
      }

      String key = req.getHeader(Tmf921BackendClient.IDEMPOTENCY_HEADER);
      if (key == null || key.isBlank()) {
        Object externalId = body.get("externalId");
        key = externalId == null ? null : externalId.toString();
      }
      String selfBase = req.getRequestURL().toString().replaceAll("/+$", "");

      MockIntent created = new MockIntent("intent-" + randomHex(10), body, clock.instant());
      if (key != null) {
        // The key maps to the entity itself, so a replay never depends on intents being updated.
        MockIntent existing = idempotencyKeys.putIfAbsent(key, created);
        if (existing != null) {
          log.debug("Idempotent replay of {} -> {}", key, existing.id);
          sendJson(resp, 200, existing.toJson(selfBase, status(existing)));
          return;
        }
      }
      intents.put(created.id, created);
      log.info("Mock backend created {} ({})", created.id, created.name);
      resp.setHeader("Location", selfBase + "/" + created.id);
      sendJson(resp, 201, created.toJson(selfBase, status(created)));
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      if (!preflight(req, resp)) return;
      String ref = reference(req);
      String selfBase = collectionUrl(req, ref);
      if (ref == null) {
        List<Map<String, Object>> all = new ArrayList<>();
        intents.values().forEach(i -> all.add(i.toJson(selfBase, status(i))));
        sendJson(resp, 200, all);
        return;
      }
      MockIntent intent = intents.get(ref);
      if (intent == null) {
        sendError(resp, 404, "not_found", "Intent " + ref + " not found");
        return;
      }
      sendJson(resp, 200, intent.toJson(selfBase, status(intent)));
    }

    @Override
    protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      if (!preflight(req, resp)) return;
      String ref = reference(req);
      MockIntent intent = ref == null ? null : intents.get(ref);
      if (intent == null) {
        sendError(resp, 404, "not_found", "Intent " + ref + " not found");
        return;
      }
      intent.terminated = true;
      log.info("Mock backend terminated {}", ref);
      sendJson(resp, 200, intent.toJson(collectionUrl(req, ref), status(intent)));
    }

    /** Bearer check and injected faults; false when a response was already sent. */
    private boolean preflight(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      try {
        BearerCredential.fromAuthorizationHeader(req.getHeader("Authorization"));
      } catch (AuthenticationException e) {
        sendError(resp, 401, "unauthorized", e.getMessage());
        return false;
      }
      Duration delay = faults.responseDelay();
      if (!delay.isZero()) {
        try {
          Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
      int failure = faults.takeFailure();
      if (failure != 0) {
        log.debug("Injected HTTP {} for {} {}", failure, req.getMethod(), req.getRequestURI());
        sendError(resp, failure, "injected_failure", "Injected failure");
        return false;
      }
      return true;
    }

    private String reference(HttpServletRequest req) {
      String pathInfo = req.getPathInfo();
      if (pathInfo == null || pathInfo.equals("/")) return null;
      return pathInfo.substring(1).replaceAll("/+$", "");
    }

    private String collectionUrl(HttpServletRequest req, String ref) {
      String url = req.getRequestURL().toString().replaceAll("/+$", "");
      return ref == null ? url : url.substring(0, url.length() - ref.length() - 1);
    }
  }

  private String status(MockIntent intent) {
    if (intent.terminated) return "terminated";
    String forced = faults.forcedStatus(intent.id);
    if (forced != null) return forced;
    Instant activeAt = intent.createdAt.plus(activationDelay);
    return clock.instant().isBefore(activeAt) ? "created" : "active";
  }

  static String validate(Map<String, Object> body) {
    if (!(body.get("name") instanceof String name) || name.isBlank()) {
      return "name is required";
    }
    if (!(body.get("description") instanceof String)) {
      return "description is required";
    }
    if (!(body.get("deliveryExpectations") instanceof List<?> expectations)
        || expectations.isEmpty()) {
      return "deliveryExpectations must be a non-empty array";
    }
    for (Object e : expectations) {
      if (!(e instanceof Map<?, ?> m)
          || !(m.get("target") instanceof String)
          || !(m.get("params") instanceof Map)) {
        return "each delivery expectation needs a target and params";
      }
    }
    Object properties = body.get("propertyExpectations");
    if (properties != null && !(properties instanceof List)) {
      return "propertyExpectations must be an array";
    }
    return null;
  }

  private static final class MockIntent {
    final String id;
    final String name;
    final Map<String, Object> request;
    final Instant createdAt;
    volatile boolean terminated;

    MockIntent(String id, Map<String, Object> request, Instant createdAt) {
      this.id = id;
      this.name = String.valueOf(request.get("name"));
      this.request = request;
      this.createdAt = createdAt;
    }

    Map<String, Object> toJson(String collectionUrl, String status) {
      Map<String, Object> json = new LinkedHashMap<>();
      json.put("id", id);
      json.put("name", name);
      json.put("description", request.get("description"));
      json.put("type", "Intent");
      json.put("status", status);
      json.put("createdAt", createdAt.toString());
      if (request.get("externalId") != null) {
        json.put("externalId", request.get("externalId"));
      }
      json.put("deliveryExpectations", request.get("deliveryExpectations"));
      json.put("_links", Map.of("self", Map.of("href", collectionUrl + "/" + id)));
      return json;
    }
  }

  private static String randomHex(int length) {
    byte[] bytes = new byte[(length + 1) / 2];
    ThreadLocalRandom.current().nextBytes(bytes);
    return HexFormat.of().formatHex(bytes).substring(0, length);
  }

  private void sendJson(HttpServletResponse resp, int code, Object response) throws IOException {
    String json = JacksonUtility.toJson(response);
    log.debug("Sending response ({}):\n{}", code, json);
    resp.setStatus(code);
    resp.setContentType("application/json");
    try (PrintWriter out = resp.getWriter()) {
      out.println(json);
    }
  }

  private void sendError(HttpServletResponse resp, int code, String error, String description)
      throws IOException {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", error);
    body.put("error_description", description);
    body.put("timestamp", clock.instant().toString());
    sendJson(resp, code, body);
  }
}
