package com.icora.intentmcp.mock;

import static org.junit.jupiter.api.Assertions.*;

import com.icora.intentmcp.backend.Tmf921BackendClient;
import com.icora.intentmcp.http.OkHttpFactory;
import com.icora.intentmcp.testing.Intents;
import com.icora.intentmcp.testing.MockBackendHarness;
import com.icora.intentmcp.testing.MutableClock;
import com.icora.intentmcp.utility.JacksonUtility;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MockTmf921Server")
class MockTmf921ServerTest {
  private static final MediaType JSON = MediaType.get("application/json");

  private static final MutableClock clock = new MutableClock(Intents.T0);
  private static MockBackendHarness backend;

  private final OkHttpClient http =
      OkHttpFactory.create(Duration.ofSeconds(2), Duration.ofSeconds(5));

  @BeforeAll
  static void startBackend() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("backend.mock.activation-delay-ms", 60_000);
    backend = MockBackendHarness.start(cfg, clock);
  }

  @AfterAll
  static void stopBackend() {
    backend.close();
  }

  @BeforeEach
  void reset() {
    backend.mock().faults().reset();
  }

  private Request.Builder request(String path) {
    return new Request.Builder()
        .url(backend.baseUrl() + path)
        .header("Authorization", "Bearer test-token");
  }

  private static Map<String, Object> validBody(String name) {
    return Map.of(
        "name", name,
        "description", "d",
        "deliveryExpectations",
            List.of(Map.of("target", "_:service", "params", Map.of("targetDescription", "x"))));
  }

  private Map<String, Object> post(Map<String, Object> body, int expectedStatus)
      throws IOException {
    Request req =
        request("/intents").post(RequestBody.create(JacksonUtility.toJson(body), JSON)).build();
    try (Response resp = http.newCall(req).execute()) {
      assertEquals(expectedStatus, resp.code());
      return JacksonUtility.toMap(resp.body().string());
    }
  }

  @Test
  void intentsBecomeActiveAfterActivationDelay() throws IOException {
    Map<String, Object> created = post(validBody("delayed"), 201);
    assertEquals("created", created.get("status"));
    String id = (String) created.get("id");
    assertTrue(id.matches("intent-[0-9a-f]{10}"));

    clock.advance(Duration.ofMinutes(2));

    try (Response resp = http.newCall(request("/intents/" + id).get().build()).execute()) {
      assertEquals(200, resp.code());
      assertEquals("active", JacksonUtility.toMap(resp.body().string()).get("status"));
    }
  }

  @Test
  void invalidBodyIsRejected() throws IOException {
    Map<String, Object> error = post(Map.of("name", "no expectations", "description", "d"), 400);
    assertEquals("validation_error", error.get("error"));
  }

  @Test
  void requestsWithoutBearerAreUnauthorized() throws IOException {
    Request req = new Request.Builder().url(backend.baseUrl() + "/intents").get().build();
    try (Response resp = http.newCall(req).execute()) {
      assertEquals(401, resp.code());
    }
  }

  @Test
  void injectedFailuresAreConsumedInOrder() throws IOException {
    backend.mock().faults().failNext(1, 502);

    post(validBody("after failure"), 502);
    post(validBody("after failure"), 201);
  }

  @Test
  void healthAndMappingsNeedNoCredentials() throws IOException {
    Request health = new Request.Builder().url(backend.baseUrl() + "/health").get().build();
    try (Response resp = http.newCall(health).execute()) {
      assertEquals("healthy", JacksonUtility.toMap(resp.body().string()).get("status"));
    }
    Request mappings =
        new Request.Builder().url(backend.baseUrl() + "/__admin/mappings").get().build();
    try (Response resp = http.newCall(mappings).execute()) {
      assertEquals(200, resp.code());
      assertTrue(JacksonUtility.toMap(resp.body().string()).containsKey("mappings"));
    }
  }

  @Test
  void validateChecksDeliveryExpectations() {
    assertNull(MockTmf921Server.validate(validBody("ok")));
    assertEquals(
        "deliveryExpectations must be a non-empty array",
        MockTmf921Server.validate(
            Map.of("name", "n", "description", "d", "deliveryExpectations", List.of())));
    assertEquals(
        "each delivery expectation needs a target and params",
        MockTmf921Server.validate(
            Map.of("name", "n", "description", "d", "deliveryExpectations", List.of("x"))));
  }

  @Test
  @DisplayName("parallel POSTs with one idempotency key create a single entity")
  void concurrentPostsWithSameKeyCreateOnce() throws Exception {
    int before = backend.mock().createdCount();
    int callers = 8;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(callers);
    try {
      List<Future<Map<String, Object>>> responses = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        responses.add(
            pool.submit(
                () -> {
                  start.await(5, TimeUnit.SECONDS);
                  Request req =
                      request("/intents")
                          .header(Tmf921BackendClient.IDEMPOTENCY_HEADER, "intent-same-key")
                          .post(
                              RequestBody.create(
                                  JacksonUtility.toJson(validBody("same-key")), JSON))
                          .build();
                  try (Response resp = http.newCall(req).execute()) {
                    assertTrue(resp.code() == 200 || resp.code() == 201);
                    return JacksonUtility.toMap(resp.body().string());
                  }
                }));
      }
      start.countDown();

      Set<Object> ids = new HashSet<>();
      for (Future<Map<String, Object>> response : responses) {
        ids.add(response.get(10, TimeUnit.SECONDS).get("id"));
      }

      assertEquals(1, ids.size());
      assertEquals(before + 1, backend.mock().createdCount());
    } finally {
      pool.shutdownNow();
    }
  }
}
