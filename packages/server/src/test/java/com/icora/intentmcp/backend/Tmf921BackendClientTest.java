package com.icora.intentmcp.backend;

import static org.junit.jupiter.api.Assertions.*;

import com.icora.intentmcp.auth.StaticTokenProvider;
import com.icora.intentmcp.http.OkHttpFactory;
import com.icora.intentmcp.model.Intent;
import com.icora.intentmcp.testing.Intents;
import com.icora.intentmcp.testing.MockBackendHarness;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Tmf921BackendClient against the mock backend")
class Tmf921BackendClientTest {

  private static MockBackendHarness backend;

  private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
  private Tmf921BackendClient client;

  @BeforeAll
  static void startBackend() {
    backend = MockBackendHarness.start();
  }

  @AfterAll
  static void stopBackend() {
    backend.close();
  }

  @BeforeEach
  void setUp() {
    backend.mock().faults().reset();
    client = clientFor(authenticatedHttp(), backend.baseUrl());
  }

  private Tmf921BackendClient clientFor(OkHttpClient http, HttpUrl baseUrl) {
    return new Tmf921BackendClient(
        http,
        baseUrl,
        "/intents",
        "/health",
        new RetryPolicy(3, Duration.ofMillis(100), 2.0, Duration.ofSeconds(1)),
        sleeps::add);
  }

  private static OkHttpClient authenticatedHttp() {
    return OkHttpFactory.create(
        Duration.ofSeconds(2), Duration.ofSeconds(5), new StaticTokenProvider("test-token"));
  }

  private static Intent draft(String id) {
    return Intents.draft(id, "4K Broadcast");
  }

  @Test
  void submitCreatesIntentAtBackend() {
    BackendResult result = client.submit(draft("intent-submit-1"));

    assertTrue(result.isAccepted(), result.toString());
    assertTrue(result.reference().startsWith("intent-"));
    assertNotEquals("intent-submit-1", result.reference());
    assertEquals(BackendState.ACTIVE, result.state());
    assertEquals(201, result.httpStatus());
    assertTrue(sleeps.isEmpty());
  }

  @Test
  @DisplayName("submitting the same intent twice creates one backend intent")
  void submitIsIdempotent() {
    int before = backend.mock().createdCount();

    BackendResult first = client.submit(draft("intent-idem-1"));
    BackendResult second = client.submit(draft("intent-idem-1"));

    assertEquals(first.reference(), second.reference());
    assertEquals(200, second.httpStatus());
    assertEquals(before + 1, backend.mock().createdCount());
  }

  @Test
  void transientFailuresAreRetried() {
    backend.mock().faults().failNext(2, 503);

    BackendResult result = client.submit(draft("intent-retry-1"));

    assertTrue(result.isAccepted(), result.toString());
    assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
  }

  @Test
  void exhaustedRetriesAreUnavailable() {
    backend.mock().faults().failNext(3, 503);

    BackendResult result = client.submit(draft("intent-retry-2"));

    assertEquals(BackendResult.Kind.UNAVAILABLE, result.kind());
    assertEquals(503, result.httpStatus());
    assertEquals(2, sleeps.size());
  }

  @Test
  void rejectionIsNotRetried() {
    int before = backend.mock().submissionCount();
    backend.mock().faults().rejectNextSubmission("Requested bandwidth exceeds capacity");

    BackendResult result = client.submit(draft("intent-reject-1"));

    assertEquals(BackendResult.Kind.REJECTED, result.kind());
    assertEquals("Requested bandwidth exceeds capacity", result.reason());
    assertEquals(before + 1, backend.mock().submissionCount());
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void statusAndCancelRoundTrip() {
    String ref = client.submit(draft("intent-cancel-1")).reference();

    assertEquals(BackendState.ACTIVE, client.fetchStatus(ref).state());

    BackendResult cancel = client.cancel(ref);
    assertTrue(cancel.isAccepted());
    assertEquals(BackendState.TERMINATED, client.fetchStatus(ref).state());
  }

  @Test
  void forcedStatusIsReported() {
    String ref = client.submit(draft("intent-forced-1")).reference();
    backend.mock().faults().forceStatus(ref, "failed");

    assertEquals(BackendState.FAILED, client.fetchStatus(ref).state());
  }

  @Test
  void unknownReferenceIsRejectedWith404() {
    BackendResult status = client.fetchStatus("intent-does-not-exist");

    assertEquals(BackendResult.Kind.REJECTED, status.kind());
    assertEquals(404, status.httpStatus());
    assertTrue(client.cancel("intent-does-not-exist").isAccepted());
  }

  @Test
  void missingBearerIsRejected() {
    OkHttpClient plain = OkHttpFactory.create(Duration.ofSeconds(2), Duration.ofSeconds(5));
    Tmf921BackendClient anonymous = clientFor(plain, backend.baseUrl());

    BackendResult result = anonymous.submit(draft("intent-anon-1"));

    assertEquals(BackendResult.Kind.REJECTED, result.kind());
    assertEquals(401, result.httpStatus());
  }

  @Test
  void pingReportsHealth() {
    assertTrue(client.ping());

    Tmf921BackendClient nowhere =
        clientFor(authenticatedHttp(), HttpUrl.get("http://127.0.0.1:1/mock-tmf921"));
    assertFalse(nowhere.ping());
  }

  @Test
  void unreachableBackendIsUnavailable() {
    Tmf921BackendClient nowhere =
        clientFor(authenticatedHttp(), HttpUrl.get("http://127.0.0.1:1/mock-tmf921"));

    BackendResult result = nowhere.submit(draft("intent-down-1"));

    assertEquals(BackendResult.Kind.UNAVAILABLE, result.kind());
    assertEquals(0, result.httpStatus());
    assertEquals(2, sleeps.size());
  }

  @Test
  void resolveJoinsPaths() {
    HttpUrl base = HttpUrl.get("http://localhost:8080/mock-tmf921");
    assertEquals(
        "http://localhost:8080/mock-tmf921/intents",
        Tmf921BackendClient.resolve(base, "/intents/").toString());
    assertEquals(base, Tmf921BackendClient.resolve(base, ""));
  }
}
