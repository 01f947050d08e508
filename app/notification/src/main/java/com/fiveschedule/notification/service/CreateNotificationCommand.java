package com.fiveschedule.notification.service;

import java.time.Instant;
import java.util.UUID;

/**
 * Input of {@link NotificationService#create}. The schedule is given by id or by a title
 * fragment; the time either absolutely or as minutes before the schedule start.
 */
public record CreateNotificationCommand(
    UUID scheduleId, String scheduleTitle, String message, Instant notifyAt, Integer minutesBefore) {}
