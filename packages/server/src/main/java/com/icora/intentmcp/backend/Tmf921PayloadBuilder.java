package com.icora.intentmcp.backend;

import com.icora.intentmcp.model.Intent;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the TMF921 create-intent body from an intent's free-form specification.
 *
 * <p>Recognized specification keys: {@code intentType}, {@code deliveryExpectations}, {@code
 * validFor}, {@code propertyExpectations} and {@code serviceArea} (list of {@code {longitude,
 * latitude}} points). Every other key is forwarded as a {@code _:service} property expectation.
 */
public class Tmf921PayloadBuilder {
  public static final String DEFAULT_INTENT_TYPE = "EventLiveBroadcast";
  static final String SERVICE_TARGET = "_:service";

  public Map<String, Object> build(Intent intent) {
    Map<String, Object> spec = new LinkedHashMap<>(intent.specification());
    Object intentType = spec.remove("intentType");
    Object delivery = spec.remove("deliveryExpectations");
    Object validFor = spec.remove("validFor");
    Object properties = spec.remove("propertyExpectations");
    Object serviceArea = spec.remove("serviceArea");

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("name", intent.name());
    payload.put("description", intent.description());
    payload.put("type", "Intent");
    payload.put("externalId", intent.id());

    if (delivery instanceof Collection<?> c && !c.isEmpty()) {
      payload.put("deliveryExpectations", new ArrayList<>(c));
    } else {
      payload.put("deliveryExpectations", List.of(defaultDeliveryExpectation()));
    }

    if (validFor instanceof Map<?, ?>) {
      payload.put("validFor", validFor);
    }

    List<Object> propertyExpectations = new ArrayList<>();
    if (properties instanceof Collection<?> c) {
      propertyExpectations.addAll(c);
    }
    if (serviceArea instanceof Collection<?> points && !points.isEmpty()) {
      propertyExpectations.add(
          expectation(Map.of("elb:areaOfService", areaOfService(points))));
    }
    if (!spec.isEmpty()) {
      propertyExpectations.add(expectation(spec));
    }
    if (!propertyExpectations.isEmpty()) {
      payload.put("propertyExpectations", propertyExpectations);
    }

    String type = intentType == null ? DEFAULT_INTENT_TYPE : intentType.toString();
    if (DEFAULT_INTENT_TYPE.equals(type)) {
      payload.put("expression", eventLiveBroadcastExpression());
    }
    return payload;
  }

  private static Map<String, Object> defaultDeliveryExpectation() {
    return Map.of(
        "target", SERVICE_TARGET, "params", Map.of("targetDescription", "cat:EventWirelessAccess"));
  }

  private static Map<String, Object> expectation(Map<String, Object> params) {
    Map<String, Object> e = new LinkedHashMap<>();
    e.put("target", SERVICE_TARGET);
    e.put("params", new LinkedHashMap<>(params));
    return e;
  }

  // Well-formed points become geo pairs; anything else is passed through for the backend to judge.
  private static List<Object> areaOfService(Collection<?> points) {
    List<Object> area = new ArrayList<>();
    for (Object point : points) {
      if (point instanceof Map<?, ?> m && m.containsKey("longitude") && m.containsKey("latitude")) {
        Map<String, Object> geo = new LinkedHashMap<>();
        geo.put("geo:longitude", m.get("longitude"));
        geo.put("geo:latitude", m.get("latitude"));
        area.add(geo);
      } else {
        area.add(point);
      }
    }
    return area;
  }

  private static Map<String, Object> eventLiveBroadcastExpression() {
    Map<String, Object> context = new LinkedHashMap<>();
    context.put("icm", "http://www.models.tmforum.org/tio/v1.0/IntentCommonModel#");
    context.put("cat", "http://www.operator.com/Catalog#");
    context.put("idan", "http://www.idan-tmforum-catalyst.org/IntentDrivenAutonomousNetworks#");
    context.put("geo", "https://tmforum.org/2020/07/geographicPoint#");

    Map<String, Object> broadcast = new LinkedHashMap<>();
    broadcast.put("@type", "icm:Intent");
    broadcast.put("icm:intentOwner", "idan:ABCEvents");
    broadcast.put("icm:hasExpectation", List.of());

    Map<String, Object> expression = new LinkedHashMap<>();
    expression.put("context", context);
    expression.put("idan", Map.of(DEFAULT_INTENT_TYPE, broadcast));
    return expression;
  }
}
