package com.icora.intentmcp.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable intent record. Every change produces a new instance via {@link #toBuilder()}, so a
 * reader holding a reference always sees a whole record.
 */
public final class Intent {
  private final String id;
  private final String name;
  private final String description;
  private final Map<String, Object> specification;
  private final IntentState state;
  private final String backendReference;
  private final Instant createdAt;
  private final Instant updatedAt;
  private final String lastError;
  private final boolean submissionPending;

  @JsonCreator
  public Intent(
      @JsonProperty("id") String id,
      @JsonProperty("name") String name,
      @JsonProperty("description") String description,
      @JsonProperty("specification") Map<String, Object> specification,
      @JsonProperty("state") IntentState state,
      @JsonProperty("backendReference") String backendReference,
      @JsonProperty("createdAt") Instant createdAt,
      @JsonProperty("updatedAt") Instant updatedAt,
      @JsonProperty("lastError") String lastError,
      @JsonProperty("submissionPending") Boolean submissionPending) {
    this.id = Objects.requireNonNull(id, "id");
    this.name = Objects.requireNonNull(name, "name");
    this.description = description == null ? "" : description;
    this.specification =
        specification == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(specification));
    this.state = Objects.requireNonNull(state, "state");
    this.backendReference = backendReference;
    this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
    this.lastError = lastError;
    this.submissionPending = Boolean.TRUE.equals(submissionPending);
  }

  @JsonProperty("id")
  public String id() {
    return id;
  }

  @JsonProperty("name")
  public String name() {
    return name;
  }

  @JsonProperty("description")
  public String description() {
    return description;
  }

  @JsonProperty("specification")
  public Map<String, Object> specification() {
    return specification;
  }

  @JsonProperty("state")
  public IntentState state() {
    return state;
  }

  @JsonProperty("backendReference")
  public String backendReference() {
    return backendReference;
  }

  @JsonProperty("createdAt")
  public Instant createdAt() {
    return createdAt;
  }

  @JsonProperty("updatedAt")
  public Instant updatedAt() {
    return updatedAt;
  }

  @JsonProperty("lastError")
  public String lastError() {
    return lastError;
  }

  /**
   * A submission was sent but its outcome is not known: the backend may hold an entity for this
   * intent under its idempotency key. Only another submit settles it.
   */
  @JsonProperty("submissionPending")
  public boolean submissionPending() {
    return submissionPending;
  }

  public boolean hasBackendReference() {
    return backendReference != null && !backendReference.isBlank();
  }

  public Builder toBuilder() {
    return new Builder()
        .id(id)
        .name(name)
        .description(description)
        .specification(specification)
        .state(state)
        .backendReference(backendReference)
        .createdAt(createdAt)
        .updatedAt(updatedAt)
        .lastError(lastError)
        .submissionPending(submissionPending);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Intent that)) return false;
    return id.equals(that.id)
        && name.equals(that.name)
        && description.equals(that.description)
        && specification.equals(that.specification)
        && state == that.state
        && Objects.equals(backendReference, that.backendReference)
        && createdAt.equals(that.createdAt)
        && updatedAt.equals(that.updatedAt)
        && Objects.equals(lastError, that.lastError)
        && submissionPending == that.submissionPending;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, state, updatedAt);
  }

  @Override
  public String toString() {
    return "Intent{id=%s, name=%s, state=%s, backendReference=%s, updatedAt=%s}"
        .formatted(id, name, state, backendReference, updatedAt);
  }

  public static final class Builder {
    private String id;
    private String name;
    private String description;
    private Map<String, Object> specification;
    private IntentState state;
    private String backendReference;
    private Instant createdAt;
    private Instant updatedAt;
    private String lastError;
    private boolean submissionPending;

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder specification(Map<String, Object> specification) {
      this.specification = specification;
      return this;
    }

    public Builder state(IntentState state) {
      this.state = state;
      return this;
    }

    public Builder backendReference(String backendReference) {
      this.backendReference = backendReference;
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public Builder lastError(String lastError) {
      this.lastError = lastError;
      return this;
    }

    public Builder submissionPending(boolean submissionPending) {
      this.submissionPending = submissionPending;
      return this;
    }

    public Intent build() {
      return new Intent(
          id,
          name,
          description,
          specification,
          state,
          backendReference,
          createdAt,
          updatedAt,
          lastError,
          submissionPending);
    }
  }
}
