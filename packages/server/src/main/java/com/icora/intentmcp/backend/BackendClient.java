package com.icora.intentmcp.backend;

import com.icora.intentmcp.model.Intent;

/**
 * Typed access to the downstream intent-management API.
 *
 * <p>Implementations never throw for backend-side failures; every outcome, including transport
 * errors after the retry budget is spent, comes back as a {@link BackendResult}. Submissions use
 * the intent id as idempotency key, so a retried submission never creates a second entity.
 */
public interface BackendClient {

  BackendResult submit(Intent intent);

  BackendResult fetchStatus(String backendReference);

  BackendResult cancel(String backendReference);

  /** Lightweight reachability check used by health reporting. */
  boolean ping();
}
