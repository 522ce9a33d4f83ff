package com.icora.intentmcp.http;

import com.icora.intentmcp.auth.BearerCredential;
import com.icora.intentmcp.auth.TokenProvider;
import java.io.IOException;
import okhttp3.*;
import org.jetbrains.annotations.NotNull;

/**
 * Adds {@code Authorization: Bearer} to every request. A 401 invalidates the cached token and the
 * request is replayed once with a fresh one.
 */
public class BearerAuthInterceptor implements Interceptor {
  private final TokenProvider tokenProvider;

  public BearerAuthInterceptor(TokenProvider tokenProvider) {
    this.tokenProvider = tokenProvider;
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request original = chain.request();
    Response response = chain.proceed(authorize(original));
    if (response.code() != 401) {
      return response;
    }
    response.close();
    tokenProvider.invalidate();
    return chain.proceed(authorize(original));
  }

  private Request authorize(Request request) {
    return request
        .newBuilder()
        .header(
            "Authorization", BearerCredential.toAuthorizationHeader(tokenProvider.accessToken()))
        .build();
  }
}
