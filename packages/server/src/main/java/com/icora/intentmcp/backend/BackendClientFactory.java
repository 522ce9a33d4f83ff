package com.icora.intentmcp.backend;

import com.icora.intentmcp.auth.OAuthPasswordTokenProvider;
import com.icora.intentmcp.auth.StaticTokenProvider;
import com.icora.intentmcp.auth.TokenProvider;
import com.icora.intentmcp.exception.ConfigException;
import com.icora.intentmcp.http.OkHttpFactory;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/** Builds the configured {@link BackendClient} from the {@code backend.*} keys. */
public final class BackendClientFactory {
  private static final org.slf4j.Logger log =
      com.icora.intentmcp.logging.LoggingService.getLogger(BackendClientFactory.class);

  public static final String DEFAULT_TOKEN_PATH =
      "/auth/keycloak_realm/protocol/openid-connect/token";

  private BackendClientFactory() {}

  public static BackendClient create(Configuration cfg, Clock clock) {
    HttpUrl baseUrl = baseUrl(cfg);
    Duration connectTimeout = Duration.ofMillis(cfg.getLong("backend.connect-timeout-ms", 5000L));
    Duration readTimeout = Duration.ofMillis(cfg.getLong("backend.read-timeout-ms", 10000L));

    TokenProvider tokenProvider = tokenProvider(cfg, baseUrl, connectTimeout, readTimeout, clock);
    OkHttpClient httpClient =
        tokenProvider == null
            ? OkHttpFactory.create(connectTimeout, readTimeout)
            : OkHttpFactory.create(connectTimeout, readTimeout, tokenProvider);

    log.info("Backend client targets {}", baseUrl);
    return new Tmf921BackendClient(
        httpClient,
        baseUrl,
        cfg.getString("backend.paths.intents", "/intents"),
        cfg.getString("backend.paths.health", "/health"),
        RetryPolicy.fromConfiguration(cfg),
        RetryPolicy.THREAD_SLEEPER);
  }

  static HttpUrl baseUrl(Configuration cfg) {
    String value = cfg.getString("backend.base-url", "http://localhost:8080/mock-tmf921");
    HttpUrl url = value == null ? null : HttpUrl.parse(value.trim());
    if (url == null) {
      throw new ConfigException("backend.base-url is not a valid http(s) URL: " + value);
    }
    return url;
  }

  /** {@code null} when {@code backend.auth.type} is {@code none}. */
  static TokenProvider tokenProvider(
      Configuration cfg,
      HttpUrl baseUrl,
      Duration connectTimeout,
      Duration readTimeout,
      Clock clock) {
    String type = cfg.getString("backend.auth.type", "static").trim().toLowerCase(Locale.ROOT);
    switch (type) {
      case "none":
        return null;
      case "static":
        return new StaticTokenProvider(cfg.getString("backend.auth.token", null));
      case "oauth-password":
        HttpUrl tokenUrl =
            Tmf921BackendClient.resolve(
                baseUrl, cfg.getString("backend.auth.token-path", DEFAULT_TOKEN_PATH));
        return new OAuthPasswordTokenProvider(
            OkHttpFactory.create(connectTimeout, readTimeout),
            tokenUrl,
            required(cfg, "backend.auth.username"),
            required(cfg, "backend.auth.password"),
            required(cfg, "backend.auth.client-id"),
            cfg.getString("backend.auth.client-secret", null),
            clock);
      default:
        throw new ConfigException(
            "Unsupported backend.auth.type '%s', expected none, static or oauth-password"
                .formatted(type));
    }
  }

  private static String required(Configuration cfg, String key) {
    String v = cfg.getString(key, null);
    if (v == null || v.isBlank()) {
      throw new ConfigException("Missing required configuration key " + key);
    }
    return v.trim();
  }
}
