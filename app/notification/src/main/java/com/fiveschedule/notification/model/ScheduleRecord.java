package com.fiveschedule.notification.model;

import java.time.Instant;
import java.util.UUID;

/** Columns of a user's schedule entry needed to resolve and time notifications. */
public record ScheduleRecord(UUID scheduleId, String userId, String title, Instant startAt, Instant endAt) {}
