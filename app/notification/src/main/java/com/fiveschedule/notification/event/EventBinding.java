package com.fiveschedule.notification.event;

import java.util.Objects;

/** Explicit pairing of an event type with the handler registered for it. */
public record EventBinding(EventType eventType, EventHandler handler) {

  public EventBinding {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(handler, "handler");
  }
}
