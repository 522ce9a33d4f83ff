package com.icora.intentmcp.backend;

/** Backend-agnostic view of the status the intent-management API reports for an entity. */
public enum BackendState {
  /** Accepted but not yet in service (TMF921 "created", "acknowledged", "inProgress", ...). */
  PENDING,
  ACTIVE,
  TERMINATED,
  FAILED,
  /** The backend answered with a status this client does not know how to interpret. */
  UNRECOGNIZED
}
