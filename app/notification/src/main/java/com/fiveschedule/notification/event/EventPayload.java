/*
 * Where: event bus model
 * What: one published event as it travels across the transport
 * Why: handlers receive an immutable snapshot independent of the producer
 */
package com.fiveschedule.notification.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record EventPayload(EventType eventType, String userId, Map<String, Object> data, Instant timestamp) {

  public EventPayload {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(timestamp, "timestamp");
    // LinkedHashMap keeps producer key order and tolerates null values, unlike Map.copyOf
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }
}
