package com.icora.intentmcp.engine;

import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/** Tunables read from the {@code engine.*} keys. */
public final class EngineSettings {
  static final int DEFAULT_BACKEND_THREADS = 16;

  private final Duration lockTimeout;
  private final Duration backendTimeout;
  private final boolean confirmOnSubmit;
  private final int backendThreads;

  public EngineSettings(Duration lockTimeout, Duration backendTimeout, boolean confirmOnSubmit) {
    this(lockTimeout, backendTimeout, confirmOnSubmit, DEFAULT_BACKEND_THREADS);
  }

  public EngineSettings(
      Duration lockTimeout, Duration backendTimeout, boolean confirmOnSubmit, int backendThreads) {
    if (backendThreads < 1) {
      throw new IllegalArgumentException("engine.backend-threads must be at least 1");
    }
    this.lockTimeout = lockTimeout;
    this.backendTimeout = backendTimeout;
    this.confirmOnSubmit = confirmOnSubmit;
    this.backendThreads = backendThreads;
  }

  public static EngineSettings defaults() {
    return new EngineSettings(Duration.ofSeconds(5), Duration.ofSeconds(30), true);
  }

  public static EngineSettings fromConfiguration(Configuration cfg) {
    return new EngineSettings(
        Duration.ofMillis(cfg.getLong("engine.lock-timeout-ms", 5000L)),
        Duration.ofMillis(cfg.getLong("engine.backend-timeout-ms", 30000L)),
        cfg.getBoolean("engine.confirm-on-submit", true),
        cfg.getInt("engine.backend-threads", DEFAULT_BACKEND_THREADS));
  }

  /** Longest a transition waits for another one on the same intent before signalling Conflict. */
  public Duration lockTimeout() {
    return lockTimeout;
  }

  /** Upper bound for a single backend operation, retries included. */
  public Duration backendTimeout() {
    return backendTimeout;
  }

  /** Whether an accepted submission is immediately followed by a status check. */
  public boolean confirmOnSubmit() {
    return confirmOnSubmit;
  }

  /** Worker threads for backend calls; calls beyond the pool and its queue are not sent. */
  public int backendThreads() {
    return backendThreads;
  }
}
