package com.icora.intentmcp.auth;

import com.icora.intentmcp.exception.AuthenticationException;
import com.icora.intentmcp.utility.JacksonUtility;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * OAuth2 resource-owner password grant against a Keycloak-style token endpoint.
 *
 * <p>The token is cached until 30 seconds before its advertised expiry. Concurrent callers share a
 * single refresh.
 */
public class OAuthPasswordTokenProvider implements TokenProvider {
  private static final org.slf4j.Logger log =
      com.icora.intentmcp.logging.LoggingService.getLogger(OAuthPasswordTokenProvider.class);

  static final Duration EXPIRY_MARGIN = Duration.ofSeconds(30);
  private static final long DEFAULT_EXPIRES_IN = 300L;

  private final OkHttpClient httpClient;
  private final HttpUrl tokenUrl;
  private final String username;
  private final String password;
  private final String clientId;
  private final String clientSecret;
  private final Clock clock;

  private String cachedToken;
  private Instant refreshAfter = Instant.MIN;

  public OAuthPasswordTokenProvider(
      OkHttpClient httpClient,
      HttpUrl tokenUrl,
      String username,
      String password,
      String clientId,
      String clientSecret,
      Clock clock) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.tokenUrl = Objects.requireNonNull(tokenUrl, "tokenUrl");
    this.username = Objects.requireNonNull(username, "username");
    this.password = Objects.requireNonNull(password, "password");
    this.clientId = Objects.requireNonNull(clientId, "clientId");
    this.clientSecret = clientSecret;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public synchronized String accessToken() {
    Instant now = clock.instant();
    if (cachedToken != null && now.isBefore(refreshAfter)) {
      return cachedToken;
    }
    log.debug("Requesting access token from {}", tokenUrl);
    FormBody.Builder form =
        new FormBody.Builder()
            .add("grant_type", "password")
            .add("username", username)
            .add("password", password)
            .add("client_id", clientId);
    if (clientSecret != null && !clientSecret.isBlank()) {
      form.add("client_secret", clientSecret);
    }
    Request request = new Request.Builder().url(tokenUrl).post(form.build()).build();

    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        throw new AuthenticationException(
            "Token endpoint returned HTTP " + response.code(),
            Map.of("tokenUrl", tokenUrl.toString(), "status", response.code()));
      }
      Map<String, Object> json = JacksonUtility.toMap(text);
      Object token = json.get("access_token");
      if (token == null || !BearerCredential.isWellFormed(token.toString())) {
        throw new AuthenticationException("Token endpoint response carries no usable access_token");
      }
      long expiresIn = DEFAULT_EXPIRES_IN;
      if (json.get("expires_in") instanceof Number n) {
        expiresIn = n.longValue();
      }
      cachedToken = token.toString();
      refreshAfter = now.plusSeconds(expiresIn).minus(EXPIRY_MARGIN);
      log.info("Obtained backend access token, valid for {}s", expiresIn);
      return cachedToken;
    } catch (IOException e) {
      throw new AuthenticationException("Failed to reach token endpoint " + tokenUrl, e);
    }
  }

  @Override
  public synchronized void invalidate() {
    cachedToken = null;
    refreshAfter = Instant.MIN;
  }
}
