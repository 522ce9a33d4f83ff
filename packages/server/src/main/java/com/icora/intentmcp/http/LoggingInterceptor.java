package com.icora.intentmcp.http;

import com.icora.intentmcp.logging.LoggingService;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

/**
 * One DEBUG line per backend exchange with status and latency. At TRACE the JSON bodies follow;
 * token request bodies are never printed since they carry the password grant.
 */
public class LoggingInterceptor implements Interceptor {
  private static final Logger log = LoggingService.getLogger(LoggingInterceptor.class);
  private static final long MAX_LOGGED_BODY = 16 * 1024L;

  @NotNull
  @Override
  public Response intercept(@NotNull Chain chain) throws IOException {
    Request request = chain.request();
    String key = request.header("Idempotency-Key");
    if (log.isTraceEnabled()) {
      log.trace("{} {} body: {}", request.method(), request.url(), describe(request));
    }

    long started = System.nanoTime();
    Response response;
    try {
      response = chain.proceed(request);
    } catch (IOException e) {
      log.debug(
          "{} {} failed after {} ms: {}",
          request.method(),
          request.url(),
          TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started),
          e.toString());
      throw e;
    }

    log.debug(
        "{} {}{} -> {} in {} ms",
        request.method(),
        request.url(),
        key == null ? "" : " [key " + key + "]",
        response.code(),
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
    if (log.isTraceEnabled()) {
      String body = response.peekBody(MAX_LOGGED_BODY).string();
      log.trace("{} response body: {}", response.code(), body);
    }
    return response;
  }

  private static String describe(Request request) throws IOException {
    RequestBody body = request.body();
    if (body == null) {
      return "(none)";
    }
    if (request.url().encodedPath().endsWith("/token")) {
      return "(redacted token request)";
    }
    Buffer buffer = new Buffer();
    body.writeTo(buffer);
    return buffer.readUtf8();
  }
}
