package com.icora.intentmcp.backend;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  @Test
  void delaysGrowExponentiallyUpToCap() {
    RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(200), 2.0, Duration.ofMillis(500));

    assertEquals(Duration.ZERO, policy.delayBeforeAttempt(1));
    assertEquals(Duration.ofMillis(200), policy.delayBeforeAttempt(2));
    assertEquals(Duration.ofMillis(400), policy.delayBeforeAttempt(3));
    assertEquals(Duration.ofMillis(500), policy.delayBeforeAttempt(4));
    assertEquals(Duration.ofMillis(500), policy.delayBeforeAttempt(5));
  }

  @Test
  void retryableStatuses() {
    assertTrue(RetryPolicy.isRetryableStatus(503));
    assertTrue(RetryPolicy.isRetryableStatus(500));
    assertTrue(RetryPolicy.isRetryableStatus(429));
    assertTrue(RetryPolicy.isRetryableStatus(408));
    assertFalse(RetryPolicy.isRetryableStatus(400));
    assertFalse(RetryPolicy.isRetryableStatus(404));
    assertFalse(RetryPolicy.isRetryableStatus(201));
  }

  @Test
  void readsConfiguration() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.setProperty("backend.retry.max-attempts", 4);
    cfg.setProperty("backend.retry.initial-delay-ms", 50);

    RetryPolicy policy = RetryPolicy.fromConfiguration(cfg);

    assertEquals(4, policy.maxAttempts());
    assertEquals(Duration.ofMillis(50), policy.delayBeforeAttempt(2));
    assertEquals(3, RetryPolicy.fromConfiguration(new BaseConfiguration()).maxAttempts());
  }
}
