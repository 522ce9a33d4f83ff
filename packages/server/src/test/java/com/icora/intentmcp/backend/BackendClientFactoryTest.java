package com.icora.intentmcp.backend;

import static org.junit.jupiter.api.Assertions.*;

import com.icora.intentmcp.auth.OAuthPasswordTokenProvider;
import com.icora.intentmcp.auth.StaticTokenProvider;
import com.icora.intentmcp.exception.ConfigException;
import java.time.Clock;
import java.time.Duration;
import okhttp3.HttpUrl;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BackendClientFactory")
class BackendClientFactoryTest {

  private static final HttpUrl BASE = HttpUrl.get("http://localhost:8080/mock-tmf921");
  private static final Duration TIMEOUT = Duration.ofSeconds(1);

  private static Object provider(BaseConfiguration cfg) {
    return BackendClientFactory.tokenProvider(cfg, BASE, TIMEOUT, TIMEOUT, Clock.systemUTC());
  }

  @Test
  void authTypes() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("backend.auth.type", "none");
    assertNull(provider(cfg));

    cfg.setProperty("backend.auth.type", "static");
    cfg.setProperty("backend.auth.token", "abc123");
    assertInstanceOf(StaticTokenProvider.class, provider(cfg));

    cfg.setProperty("backend.auth.type", "oauth-password");
    cfg.setProperty("backend.auth.username", "icora-agent");
    cfg.setProperty("backend.auth.password", "pw");
    cfg.setProperty("backend.auth.client-id", "intent-mcp");
    assertInstanceOf(OAuthPasswordTokenProvider.class, provider(cfg));
  }

  @Test
  void misconfigurationIsReported() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("backend.auth.type", "kerberos");
    assertThrows(ConfigException.class, () -> provider(cfg));

    cfg.setProperty("backend.auth.type", "oauth-password");
    assertThrows(ConfigException.class, () -> provider(cfg));

    cfg.setProperty("backend.auth.type", "static");
    assertThrows(ConfigException.class, () -> provider(cfg));

    cfg.setProperty("backend.base-url", "not a url");
    assertThrows(ConfigException.class, () -> BackendClientFactory.baseUrl(cfg));
  }

  @Test
  void defaultBaseUrlPointsAtEmbeddedMock() {
    assertEquals(BASE, BackendClientFactory.baseUrl(new BaseConfiguration()));

    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("backend.auth.token", "abc123");
    assertInstanceOf(
        Tmf921BackendClient.class, BackendClientFactory.create(cfg, Clock.systemUTC()));
  }
}
