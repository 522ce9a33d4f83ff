package com.icora.intentmcp.auth;

import com.icora.intentmcp.exception.ConfigException;

/** Fixed token from configuration ({@code backend.auth.token}). */
public class StaticTokenProvider implements TokenProvider {
  private final String token;

  public StaticTokenProvider(String token) {
    if (!BearerCredential.isWellFormed(token)) {
      throw new ConfigException("backend.auth.token is missing or not a valid bearer token");
    }
    this.token = token;
  }

  @Override
  public String accessToken() {
    return token;
  }
}
