package com.icora.intentmcp.backend;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.InterruptedIOException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("BackendResponseMapper")
class BackendResponseMapperTest {

  private final BackendResponseMapper mapper = new BackendResponseMapper();

  @ParameterizedTest
  @CsvSource({
    "created, PENDING",
    "acknowledged, PENDING",
    "inProgress, PENDING",
    "feasibilityChecked, PENDING",
    "active, ACTIVE",
    "FULFILLED, ACTIVE",
    "in_service, ACTIVE",
    "terminated, TERMINATED",
    "cancelled, TERMINATED",
    "rejected, FAILED",
    "notFulfilled, FAILED",
    "hibernating, UNRECOGNIZED"
  })
  void normalizesStatus(String raw, BackendState expected) {
    assertEquals(expected, mapper.normalizeStatus(raw));
  }

  @Test
  void nullStatusIsUnrecognized() {
    assertEquals(BackendState.UNRECOGNIZED, mapper.normalizeStatus(null));
  }

  @Nested
  @DisplayName("submit")
  class Submit {

    @Test
    void createdWithIdAndStatus() {
      BackendResult r =
          mapper.mapSubmit(201, "{\"id\":\"intent-abc\",\"status\":\"active\"}", null);

      assertTrue(r.isAccepted());
      assertEquals("intent-abc", r.reference());
      assertEquals(BackendState.ACTIVE, r.state());
      assertEquals(201, r.httpStatus());
    }

    @Test
    void referenceFallsBackToLocationHeader() {
      BackendResult r = mapper.mapSubmit(202, "", "http://backend/intents/intent-xyz/");

      assertTrue(r.isAccepted());
      assertEquals("intent-xyz", r.reference());
      assertEquals(BackendState.PENDING, r.state());
    }

    @Test
    void acceptedWithoutAnyReferenceIsUnknown() {
      BackendResult r = mapper.mapSubmit(201, "{}", null);
      assertEquals(BackendResult.Kind.UNKNOWN, r.kind());
    }

    @Test
    void serverErrorIsRetryable() {
      BackendResult r = mapper.mapSubmit(503, "{\"error\":\"busy\"}", null);

      assertEquals(BackendResult.Kind.UNAVAILABLE, r.kind());
      assertTrue(r.isRetryable());
      assertFalse(r.isInconclusive());
      assertTrue(r.reason().contains("503"));
    }

    @Test
    void clientErrorIsRejectedWithBackendReason() {
      BackendResult r =
          mapper.mapSubmit(
              400,
              "{\"error\":\"validation_error\",\"error_description\":\"name is required\"}",
              null);

      assertEquals(BackendResult.Kind.REJECTED, r.kind());
      assertFalse(r.isRetryable());
      assertEquals("name is required", r.reason());
      assertEquals(400, r.httpStatus());
    }

    @Test
    void redirectIsUnknown() {
      assertEquals(BackendResult.Kind.UNKNOWN, mapper.mapSubmit(302, null, null).kind());
    }
  }

  @Test
  void statusNotFoundIsRejectedWith404() {
    BackendResult r = mapper.mapStatus("intent-1", 404, "{\"error\":\"not_found\"}");

    assertEquals(BackendResult.Kind.REJECTED, r.kind());
    assertEquals(404, r.httpStatus());
  }

  @Test
  void statusOkCarriesNormalizedState() {
    BackendResult r = mapper.mapStatus("intent-1", 200, "{\"status\":\"terminated\"}");

    assertEquals(BackendState.TERMINATED, r.state());
    assertEquals("intent-1", r.reference());
  }

  @Test
  void cancelOfMissingIntentCountsAsCancelled() {
    BackendResult r = mapper.mapCancel("intent-1", 404, null);

    assertTrue(r.isAccepted());
    assertEquals(BackendState.TERMINATED, r.state());
  }

  @Test
  void transportFailuresAreUnavailable() {
    BackendResult timeout = mapper.transportFailure(new InterruptedIOException("timeout"));
    BackendResult refused = mapper.transportFailure(new IOException("Connection refused"));

    assertEquals(BackendResult.Kind.UNAVAILABLE, timeout.kind());
    assertTrue(timeout.reason().startsWith("Backend timeout"));
    assertTrue(refused.reason().contains("Connection refused"));
    assertEquals(0, refused.httpStatus());
  }

  @Test
  @DisplayName("only a request that may have reached the backend is inconclusive")
  void inconclusiveOutcomes() {
    assertTrue(mapper.transportFailure(new InterruptedIOException("timeout")).isInconclusive());
    assertTrue(mapper.mapSubmit(302, null, null).isInconclusive());
    assertFalse(BackendResult.notSent("all workers busy").isInconclusive());
    assertTrue(BackendResult.notSent("all workers busy").isRetryable());
    assertFalse(mapper.mapSubmit(400, "{}", null).isInconclusive());
  }
}
