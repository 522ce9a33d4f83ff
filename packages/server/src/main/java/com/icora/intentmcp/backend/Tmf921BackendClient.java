package com.icora.intentmcp.backend;

import com.icora.intentmcp.exception.AuthenticationException;
import com.icora.intentmcp.model.Intent;
import com.icora.intentmcp.utility.JacksonUtility;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * {@link BackendClient} for a TMF921 Intent Management API.
 *
 * <ul>
 *   <li>{@code POST {intents-path}} with {@code Idempotency-Key: <intent id>}
 *   <li>{@code GET {intents-path}/{ref}}
 *   <li>{@code DELETE {intents-path}/{ref}}
 *   <li>{@code GET {health-path}}
 * </ul>
 *
 * Transport failures and retryable statuses are retried per {@link RetryPolicy}; everything else
 * is mapped once by {@link BackendResponseMapper}.
 */
public class Tmf921BackendClient implements BackendClient {
  private static final org.slf4j.Logger log =
      com.icora.intentmcp.logging.LoggingService.getLogger(Tmf921BackendClient.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  public static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

  @FunctionalInterface
  private interface ResponseMapping {
    BackendResult map(int httpStatus, String body, Response response);
  }

  private final OkHttpClient httpClient;
  private final HttpUrl intentsUrl;
  private final HttpUrl healthUrl;
  private final RetryPolicy retryPolicy;
  private final RetryPolicy.Sleeper sleeper;
  private final BackendResponseMapper mapper;
  private final Tmf921PayloadBuilder payloadBuilder;

  public Tmf921BackendClient(
      OkHttpClient httpClient,
      HttpUrl baseUrl,
      String intentsPath,
      String healthPath,
      RetryPolicy retryPolicy,
      RetryPolicy.Sleeper sleeper) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.intentsUrl = resolve(baseUrl, intentsPath);
    this.healthUrl = resolve(baseUrl, healthPath);
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.mapper = new BackendResponseMapper();
    this.payloadBuilder = new Tmf921PayloadBuilder();
  }

  static HttpUrl resolve(HttpUrl baseUrl, String path) {
    String segments = path == null ? "" : path.replaceAll("^/+", "").replaceAll("/+$", "");
    HttpUrl.Builder b = baseUrl.newBuilder();
    if (!segments.isEmpty()) {
      b.addPathSegments(segments);
    }
    return b.build();
  }

  @Override
  public BackendResult submit(Intent intent) {
    String json = JacksonUtility.toJson(payloadBuilder.build(intent));
    Request request =
        new Request.Builder()
            .url(intentsUrl)
            .header(IDEMPOTENCY_HEADER, intent.id())
            .header("Accept", "application/json")
            .post(RequestBody.create(json, JSON))
            .build();
    return execute(
        "submit",
        intent.id(),
        request,
        (code, body, response) -> mapper.mapSubmit(code, body, response.header("Location")));
  }

  @Override
  public BackendResult fetchStatus(String backendReference) {
    Request request =
        new Request.Builder()
            .url(intentsUrl.newBuilder().addPathSegment(backendReference).build())
            .header("Accept", "application/json")
            .get()
            .build();
    return execute(
        "fetchStatus",
        backendReference,
        request,
        (code, body, response) -> mapper.mapStatus(backendReference, code, body));
  }

  @Override
  public BackendResult cancel(String backendReference) {
    Request request =
        new Request.Builder()
            .url(intentsUrl.newBuilder().addPathSegment(backendReference).build())
            .delete()
            .build();
    return execute(
        "cancel",
        backendReference,
        request,
        (code, body, response) -> mapper.mapCancel(backendReference, code, body));
  }

  @Override
  public boolean ping() {
    Request request = new Request.Builder().url(healthUrl).get().build();
    try (Response response = httpClient.newCall(request).execute()) {
      return response.isSuccessful();
    } catch (IOException | AuthenticationException e) {
      log.debug("Backend health check failed: {}", e.getMessage());
      return false;
    }
  }

  private BackendResult execute(
      String operation, String subject, Request request, ResponseMapping mapping) {
    BackendResult last = null;
    for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
      if (attempt > 1) {
        Duration delay = retryPolicy.delayBeforeAttempt(attempt);
        log.debug("Retrying {} for {} in {} ms", operation, subject, delay.toMillis());
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return BackendResult.unavailable("Interrupted while waiting to retry " + operation, 0);
        }
      }
      if (Thread.currentThread().isInterrupted()) {
        return last != null
            ? last
            : BackendResult.notSent("Interrupted before calling the backend");
      }

      try (Response response = httpClient.newCall(request).execute()) {
        ResponseBody responseBody = response.body();
        String body = responseBody == null ? "" : responseBody.string();
        last = mapping.map(response.code(), body, response);
      } catch (IOException e) {
        last = mapper.transportFailure(e);
      } catch (AuthenticationException e) {
        // Token endpoint trouble is not something another attempt here would fix.
        log.warn("Backend {} for {} aborted: {}", operation, subject, e.getMessage());
        String reason = "Backend authentication failed: " + e.getMessage();
        return last == null ? BackendResult.notSent(reason) : BackendResult.unavailable(reason, 0);
      }

      if (!last.isRetryable()) {
        log.debug("Backend {} for {} -> {}", operation, subject, last);
        return last;
      }
      log.warn(
          "Backend {} for {} failed (attempt {}/{}): {}",
          operation,
          subject,
          attempt,
          retryPolicy.maxAttempts(),
          last.reason());
    }
    return last;
  }
}
