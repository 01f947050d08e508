/*
 * Where: SSE fan-out
 * What: subscribes to user-facing event types and forwards them to the user's open streams
 * Why: this is the bridge from the event bus to live clients
 */
package com.fiveschedule.notification.sse;

import com.fiveschedule.notification.event.EventBinding;
import com.fiveschedule.notification.event.EventBus;
import com.fiveschedule.notification.event.EventPayload;
import com.fiveschedule.notification.event.EventType;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SseEventForwarder {

  private static final Logger logger = LoggerFactory.getLogger(SseEventForwarder.class);

  static final List<EventType> FORWARDED_TYPES =
      List.of(
          EventType.NOTIFICATION_CREATED,
          EventType.NOTIFICATION_SENT,
          EventType.SCHEDULE_REMINDER,
          EventType.DEADLINE_ALERT,
          EventType.DAILY_SUMMARY);

  private final EventBus eventBus;
  private final SseConnectionManager connectionManager;
  private final List<EventBinding> bindings;

  public SseEventForwarder(EventBus eventBus, SseConnectionManager connectionManager) {
    this.eventBus = eventBus;
    this.connectionManager = connectionManager;
    this.bindings = FORWARDED_TYPES.stream().map(type -> new EventBinding(type, this::forward)).toList();
  }

  @PostConstruct
  public void register() {
    eventBus.subscribeAll(bindings);
    logger.info("sse forwarder registered types={}", FORWARDED_TYPES);
  }

  @PreDestroy
  public void unregister() {
    bindings.forEach(eventBus::unsubscribe);
  }

  void forward(EventPayload payload) {
    final int delivered =
        connectionManager.sendEvent(payload.userId(), payload.eventType().wireName(), payload.data());
    logger.debug(
        "sse forwarded type={} userId={} delivered={}",
        payload.eventType(),
        payload.userId(),
        delivered);
  }
}
