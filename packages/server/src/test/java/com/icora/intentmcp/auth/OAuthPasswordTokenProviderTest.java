package com.icora.intentmcp.auth;

import static org.junit.jupiter.api.Assertions.*;

import com.icora.intentmcp.backend.BackendClientFactory;
import com.icora.intentmcp.exception.AuthenticationException;
import com.icora.intentmcp.http.OkHttpFactory;
import com.icora.intentmcp.testing.Intents;
import com.icora.intentmcp.testing.MockBackendHarness;
import com.icora.intentmcp.testing.MutableClock;
import java.time.Clock;
import java.time.Duration;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("OAuthPasswordTokenProvider against the mock token endpoint")
class OAuthPasswordTokenProviderTest {

  private static MockBackendHarness backend;
  private static HttpUrl tokenUrl;

  private final OkHttpClient http =
      OkHttpFactory.create(Duration.ofSeconds(2), Duration.ofSeconds(5));
  private final MutableClock clock = new MutableClock(Intents.T0);

  @BeforeAll
  static void startBackend() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("backend.mock.username", "icora-agent");
    cfg.setProperty("backend.mock.password", "s3cret");
    cfg.setProperty("backend.mock.token-expires-in", 120);
    backend = MockBackendHarness.start(cfg, Clock.systemUTC());
    tokenUrl =
        backend
            .baseUrl()
            .newBuilder()
            .addPathSegments(BackendClientFactory.DEFAULT_TOKEN_PATH.substring(1))
            .build();
  }

  @AfterAll
  static void stopBackend() {
    backend.close();
  }

  private OAuthPasswordTokenProvider provider(String password) {
    return new OAuthPasswordTokenProvider(
        http, tokenUrl, "icora-agent", password, "intent-mcp", null, clock);
  }

  @Test
  void tokenIsCachedUntilShortlyBeforeExpiry() {
    OAuthPasswordTokenProvider provider = provider("s3cret");

    String first = provider.accessToken();
    assertTrue(first.startsWith("mock_token_"));
    assertEquals(first, provider.accessToken());

    Duration lifetime = Duration.ofSeconds(120).minus(OAuthPasswordTokenProvider.EXPIRY_MARGIN);
    clock.advance(lifetime.minusSeconds(1));
    assertEquals(first, provider.accessToken());

    clock.advance(Duration.ofSeconds(2));
    assertNotEquals(first, provider.accessToken());
  }

  @Test
  void invalidateForcesNewToken() {
    OAuthPasswordTokenProvider provider = provider("s3cret");
    String first = provider.accessToken();

    provider.invalidate();

    assertNotEquals(first, provider.accessToken());
  }

  @Test
  void wrongCredentialsAreUnauthenticated() {
    AuthenticationException e =
        assertThrows(AuthenticationException.class, () -> provider("wrong").accessToken());
    assertEquals(401, e.getContext().get("status"));
  }

  @Test
  void unreachableEndpointIsUnauthenticated() {
    OAuthPasswordTokenProvider provider =
        new OAuthPasswordTokenProvider(
            http,
            HttpUrl.get("http://127.0.0.1:1/token"),
            "icora-agent",
            "s3cret",
            "intent-mcp",
            null,
            clock);
    assertThrows(AuthenticationException.class, provider::accessToken);
  }
}
