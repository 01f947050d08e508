package com.fiveschedule.notification.api;

public class ScheduleNotFoundException extends RuntimeException {
  public ScheduleNotFoundException(String reference) {
    super("schedule not found: " + reference);
  }
}
