package com.fiveschedule.notification.event;

/** Callback invoked on the listener thread for every received event of a subscribed type. */
@FunctionalInterface
public interface EventHandler {
  void handle(EventPayload payload);
}
