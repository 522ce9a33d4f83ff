package com.icora.intentmcp.auth;

import static org.junit.jupiter.api.Assertions.*;

import com.icora.intentmcp.exception.AuthenticationException;
import com.icora.intentmcp.exception.ConfigException;
import com.icora.intentmcp.exception.IntentMcpErrorCode;
import org.junit.jupiter.api.Test;

class BearerCredentialTest {

  @Test
  void extractsToken() {
    assertEquals("abc.def-123", BearerCredential.fromAuthorizationHeader("Bearer abc.def-123"));
    assertEquals("tok==", BearerCredential.fromAuthorizationHeader("bearer   tok=="));
  }

  @Test
  void missingHeaderIsUnauthenticated() {
    AuthenticationException e =
        assertThrows(
            AuthenticationException.class, () -> BearerCredential.fromAuthorizationHeader(null));
    assertEquals(IntentMcpErrorCode.UNAUTHENTICATED, e.getCode());
    assertEquals("Missing Authorization header", e.getMessage());
  }

  @Test
  void otherSchemesAndMalformedTokensAreRejected() {
    assertThrows(
        AuthenticationException.class,
        () -> BearerCredential.fromAuthorizationHeader("Basic dXNlcjpwYXNz"));
    assertThrows(
        AuthenticationException.class,
        () -> BearerCredential.fromAuthorizationHeader("Bearer has spaces"));
    assertThrows(
        AuthenticationException.class, () -> BearerCredential.fromAuthorizationHeader("Bearer "));
  }

  @Test
  void wellFormedness() {
    assertTrue(BearerCredential.isWellFormed("mock_token_0123abcd"));
    assertFalse(BearerCredential.isWellFormed(""));
    assertFalse(BearerCredential.isWellFormed("a b"));
    assertFalse(BearerCredential.isWellFormed(null));
  }

  @Test
  void staticProviderValidatesToken() {
    String token = new StaticTokenProvider("t0k").accessToken();
    assertEquals("Bearer t0k", BearerCredential.toAuthorizationHeader(token));
    assertThrows(ConfigException.class, () -> new StaticTokenProvider(null));
    assertThrows(ConfigException.class, () -> new StaticTokenProvider("two words"));
  }
}
