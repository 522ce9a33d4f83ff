package com.icora.intentmcp.auth;

import com.icora.intentmcp.exception.AuthenticationException;
import com.icora.intentmcp.exception.ErrorDetails;
import com.icora.intentmcp.utility.JacksonUtility;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/** Rejects requests without a well-formed bearer credential with a structured 401. */
public class BearerTokenFilter implements Filter {
  private static final org.slf4j.Logger log =
      com.icora.intentmcp.logging.LoggingService.getLogger(BearerTokenFilter.class);

  @Override
  public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
      throws IOException, ServletException {
    HttpServletRequest req = (HttpServletRequest) request;
    HttpServletResponse resp = (HttpServletResponse) response;
    try {
      BearerCredential.fromAuthorizationHeader(req.getHeader("Authorization"));
    } catch (AuthenticationException e) {
      log.debug("Rejecting {} {}: {}", req.getMethod(), req.getRequestURI(), e.getMessage());
      resp.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
      resp.setHeader("WWW-Authenticate", "Bearer realm=\"intent-mcp\"");
      resp.setContentType("application/json");
      resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
      resp.getWriter().write(JacksonUtility.toJson(ErrorDetails.of(e).asEnvelope()));
      return;
    }
    chain.doFilter(request, response);
  }
}
