package com.icora.intentmcp.engine;

/** Events that drive an intent through its lifecycle. */
public enum LifecycleEvent {
  /** Record creation. Not governed by the transition table, only published to listeners. */
  CREATE,
  SUBMIT,
  UPDATE,
  TERMINATE,
  DELETE,
  /** Status check; reconciliation follows with one of the backend-reported events below. */
  QUERY,
  CONFIRM_ACTIVE,
  REJECT,
  BACKEND_PENDING,
  BACKEND_TERMINATED,
  BACKEND_UNAVAILABLE
}
