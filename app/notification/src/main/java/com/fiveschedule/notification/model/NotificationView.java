/*
 * Where: notification domain model
 * What: the JSON shape of a notification returned to clients and cached
 * Why: the pending-list cache must replay exactly what the first response carried
 */
package com.fiveschedule.notification.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.UUID;

@JsonPropertyOrder({
  "notification_id", "user_id", "schedule_id", "message", "notify_at", "is_sent", "is_checked"
})
public record NotificationView(
    @JsonProperty("notification_id") UUID notificationId,
    @JsonProperty("user_id") String userId,
    @JsonProperty("schedule_id") UUID scheduleId,
    @JsonProperty("message") String message,
    @JsonProperty("notify_at") Instant notifyAt,
    @JsonProperty("is_sent") boolean sent,
    @JsonProperty("is_checked") boolean checked) {

  public static NotificationView from(NotificationRecord record) {
    return new NotificationView(
        record.notificationId(),
        record.userId(),
        record.scheduleId(),
        record.message(),
        record.notifyAt(),
        record.sent(),
        record.checked());
  }
}
