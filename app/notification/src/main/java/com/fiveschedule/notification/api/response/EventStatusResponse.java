/*
 * Where: event API model
 * What: diagnostics for the event bus and the SSE registry
 * Why: health checks see transport availability and live stream counts in one call
 */
package com.fiveschedule.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EventStatusResponse(EventBusStatus eventBus, SseManagerStatus sseManager) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record EventBusStatus(boolean available, boolean running, Map<String, Integer> handlersCount) {
    public EventBusStatus {
      handlersCount = Collections.unmodifiableMap(new LinkedHashMap<>(handlersCount));
    }
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record SseManagerStatus(int connectionsCount, int usersCount) {}
}
