package com.icora.intentmcp.auth;

/** Source of bearer tokens attached to backend requests. */
public interface TokenProvider {

  /** Current access token. Throws {@code AuthenticationException} when none can be obtained. */
  String accessToken();

  /** Drop any cached token so the next call fetches a fresh one. */
  default void invalidate() {}
}
