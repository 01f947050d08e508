package com.fiveschedule.notification.sse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** One frame of an SSE stream: {@code event: <name>} followed by {@code data: <json>}. */
public record ServerEvent(String name, Map<String, Object> data) {

  public static final String CONNECTED = "connected";
  public static final String HEARTBEAT = "heartbeat";

  public ServerEvent {
    Objects.requireNonNull(name, "name");
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }
}
