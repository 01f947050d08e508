/*
 * Where: event bus model
 * What: closed set of domain event topics and their wire names
 * Why: producers and the listener agree on one topic vocabulary
 */
package com.fiveschedule.notification.event;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum EventType {
  NOTIFICATION_CREATED("notification:created"),
  NOTIFICATION_SENT("notification:sent"),
  NOTIFICATION_CHECKED("notification:checked"),
  SCHEDULE_CREATED("schedule:created"),
  SCHEDULE_UPDATED("schedule:updated"),
  SCHEDULE_DELETED("schedule:deleted"),
  SCHEDULE_REMINDER("schedule:reminder"),
  LECTURE_CREATED("lecture:created"),
  LECTURE_UPDATED("lecture:updated"),
  LECTURE_DELETED("lecture:deleted"),
  USER_LOGIN("user:login"),
  USER_LOGOUT("user:logout"),
  DAILY_SUMMARY("system:daily_summary"),
  DEADLINE_ALERT("system:deadline_alert");

  private static final Map<String, EventType> BY_WIRE_NAME =
      Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(EventType::wireName, Function.identity()));

  private final String wireName;

  EventType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static Optional<EventType> fromWireName(String wireName) {
    if (wireName == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
  }
}
