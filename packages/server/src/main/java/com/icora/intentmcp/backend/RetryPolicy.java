package com.icora.intentmcp.backend;

import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/**
 * Bounded exponential backoff. Attempt 1 runs immediately; attempt {@code n > 1} waits {@code
 * initialDelay * multiplier^(n-2)}, capped at {@code maxDelay}.
 */
public final class RetryPolicy {

  /** Abstraction over {@link Thread#sleep(long)} so tests can run without real delays. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  public static final Sleeper THREAD_SLEEPER = d -> Thread.sleep(d.toMillis());

  private final int maxAttempts;
  private final Duration initialDelay;
  private final double multiplier;
  private final Duration maxDelay;

  public RetryPolicy(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = maxAttempts;
    this.initialDelay = initialDelay.isNegative() ? Duration.ZERO : initialDelay;
    this.multiplier = Math.max(1.0d, multiplier);
    this.maxDelay = maxDelay.compareTo(this.initialDelay) < 0 ? this.initialDelay : maxDelay;
  }

  public static RetryPolicy defaults() {
    return new RetryPolicy(3, Duration.ofMillis(200), 2.0d, Duration.ofSeconds(2));
  }

  public static RetryPolicy fromConfiguration(Configuration cfg) {
    return new RetryPolicy(
        cfg.getInt("backend.retry.max-attempts", 3),
        Duration.ofMillis(cfg.getLong("backend.retry.initial-delay-ms", 200L)),
        cfg.getDouble("backend.retry.multiplier", 2.0d),
        Duration.ofMillis(cfg.getLong("backend.retry.max-delay-ms", 2000L)));
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public Duration delayBeforeAttempt(int attempt) {
    if (attempt <= 1) {
      return Duration.ZERO;
    }
    double factor = Math.pow(multiplier, attempt - 2);
    long millis = (long) Math.min(initialDelay.toMillis() * factor, (double) maxDelay.toMillis());
    return Duration.ofMillis(millis);
  }

  /** Transport-level statuses worth another attempt; all other 4xx are terminal. */
  public static boolean isRetryableStatus(int httpStatus) {
    return httpStatus == 408 || httpStatus == 429 || httpStatus >= 500;
  }
}
