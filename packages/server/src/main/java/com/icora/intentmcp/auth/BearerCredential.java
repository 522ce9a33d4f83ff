package com.icora.intentmcp.auth;

import com.icora.intentmcp.exception.AuthenticationException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * RFC 6750 bearer credential handling. Only the token syntax is checked here; verifying the token
 * against an identity provider is out of this server's hands.
 */
public final class BearerCredential {
  public static final String SCHEME = "Bearer";

  // token68 = 1*( ALPHA / DIGIT / "-" / "." / "_" / "~" / "+" / "/" ) *"="
  private static final Pattern TOKEN68 = Pattern.compile("^[A-Za-z0-9\\-._~+/]+=*$");

  private BearerCredential() {}

  public static boolean isWellFormed(String token) {
    return token != null && TOKEN68.matcher(token).matches();
  }

  /**
   * Extract the token from an {@code Authorization} header value.
   *
   * @throws AuthenticationException when the header is missing, uses another scheme, or carries a
   *     malformed token
   */
  public static String fromAuthorizationHeader(String header) {
    if (header == null || header.isBlank()) {
      throw new AuthenticationException("Missing Authorization header");
    }
    String value = header.trim();
    int space = value.indexOf(' ');
    if (space < 0 || !value.substring(0, space).toLowerCase(Locale.ROOT).equals("bearer")) {
      throw new AuthenticationException("Authorization header must use the Bearer scheme");
    }
    String token = value.substring(space + 1).trim();
    if (!isWellFormed(token)) {
      throw new AuthenticationException("Bearer token is malformed");
    }
    return token;
  }

  public static String toAuthorizationHeader(String token) {
    if (!isWellFormed(token)) {
      throw new AuthenticationException("Bearer token is malformed");
    }
    return SCHEME + " " + token;
  }
}
