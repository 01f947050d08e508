/*
 * Where: notification domain model
 * What: snapshot of one notifications row
 * Why: shared by the reconciler, the CRUD service and the background jobs
 */
package com.fiveschedule.notification.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationRecord(
        UUID notificationId,
        String userId,
        UUID scheduleId,
        String message,
        Instant notifyAt,
        boolean sent,
        boolean checked,
        Instant createdAt,
        Instant sentAt) {

    public static NotificationRecord newPending(
            String userId, UUID scheduleId, String message, Instant notifyAt, Instant createdAt) {
        return new NotificationRecord(
                UUID.randomUUID(), userId, scheduleId, message, notifyAt, false, false, createdAt, null);
    }
}
