package com.icora.intentmcp.http;

import com.icora.intentmcp.auth.TokenProvider;
import java.time.Duration;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  /** Client for the token endpoint: timeouts and logging, no bearer. */
  public static OkHttpClient create(Duration connectTimeout, Duration readTimeout) {
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeout)
        .readTimeout(readTimeout)
        .writeTimeout(readTimeout)
        // Retries are owned by the backend client's retry policy.
        .retryOnConnectionFailure(false)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }

  public static OkHttpClient create(
      Duration connectTimeout, Duration readTimeout, TokenProvider tokenProvider) {
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeout)
        .readTimeout(readTimeout)
        .writeTimeout(readTimeout)
        .retryOnConnectionFailure(false)
        .addInterceptor(new BearerAuthInterceptor(tokenProvider))
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
