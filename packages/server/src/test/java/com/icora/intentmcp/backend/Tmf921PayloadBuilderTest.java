package com.icora.intentmcp.backend;

import static org.junit.jupiter.api.Assertions.*;

import com.icora.intentmcp.model.Intent;
import com.icora.intentmcp.testing.Intents;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class Tmf921PayloadBuilderTest {

  private final Tmf921PayloadBuilder builder = new Tmf921PayloadBuilder();

  private Intent withSpec(Map<String, Object> spec) {
    return Intents.draft("intent-42", "4K Broadcast").toBuilder().specification(spec).build();
  }

  @Test
  @SuppressWarnings("unchecked")
  void minimalSpecificationGetsDefaults() {
    Map<String, Object> payload = builder.build(withSpec(Map.of("bandwidth", "20Gbps")));

    assertEquals("4K Broadcast", payload.get("name"));
    assertEquals("test intent", payload.get("description"));
    assertEquals("Intent", payload.get("type"));
    assertEquals("intent-42", payload.get("externalId"));

    List<Map<String, Object>> delivery =
        (List<Map<String, Object>>) payload.get("deliveryExpectations");
    assertEquals(1, delivery.size());
    assertEquals(Tmf921PayloadBuilder.SERVICE_TARGET, delivery.get(0).get("target"));
    assertEquals(
        "cat:EventWirelessAccess",
        ((Map<String, Object>) delivery.get(0).get("params")).get("targetDescription"));

    List<Map<String, Object>> properties =
        (List<Map<String, Object>>) payload.get("propertyExpectations");
    assertEquals(Map.of("bandwidth", "20Gbps"), properties.get(0).get("params"));

    Map<String, Object> expression = (Map<String, Object>) payload.get("expression");
    assertTrue(((Map<String, Object>) expression.get("context")).containsKey("icm"));
    assertTrue(((Map<String, Object>) expression.get("idan")).containsKey("EventLiveBroadcast"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void serviceAreaBecomesGeoPoints() {
    Map<String, Object> spec = new LinkedHashMap<>();
    spec.put("serviceArea", List.of(Map.of("longitude", 13.4, "latitude", 52.5)));

    Map<String, Object> payload = builder.build(withSpec(spec));

    List<Map<String, Object>> properties =
        (List<Map<String, Object>>) payload.get("propertyExpectations");
    assertEquals(1, properties.size());
    Map<String, Object> params = (Map<String, Object>) properties.get(0).get("params");
    List<Map<String, Object>> area = (List<Map<String, Object>>) params.get("elb:areaOfService");
    assertEquals(13.4, area.get(0).get("geo:longitude"));
    assertEquals(52.5, area.get(0).get("geo:latitude"));
  }

  @Test
  void explicitExpectationsAndIntentTypeAreHonoured() {
    Map<String, Object> spec = new LinkedHashMap<>();
    spec.put("intentType", "Custom");
    spec.put(
        "deliveryExpectations",
        List.of(Map.of("target", "_:slice", "params", Map.of("targetDescription", "x"))));
    spec.put("validFor", Map.of("startDateTime", "2025-07-01T00:00:00Z"));

    Map<String, Object> payload = builder.build(withSpec(spec));

    assertEquals(
        List.of(Map.of("target", "_:slice", "params", Map.of("targetDescription", "x"))),
        payload.get("deliveryExpectations"));
    assertEquals(Map.of("startDateTime", "2025-07-01T00:00:00Z"), payload.get("validFor"));
    assertFalse(payload.containsKey("expression"));
    assertFalse(payload.containsKey("propertyExpectations"));
  }
}
