/*
 * Where: event bus producers
 * What: builds and publishes the payloads of notification and reminder events
 * Why: every producer emits the same field names for the same event type
 */
package com.fiveschedule.notification.event;

import com.fiveschedule.notification.model.NotificationRecord;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NotificationEvents {

  private final EventBus eventBus;

  public boolean created(NotificationRecord record) {
    return eventBus.publish(EventType.NOTIFICATION_CREATED, record.userId(), notificationData(record));
  }

  public boolean sent(NotificationRecord record) {
    return eventBus.publish(EventType.NOTIFICATION_SENT, record.userId(), notificationData(record));
  }

  public boolean checked(String userId, Collection<UUID> notificationIds, int updatedCount) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("notification_ids", notificationIds.stream().map(UUID::toString).toList());
    data.put("updated_count", updatedCount);
    return eventBus.publish(EventType.NOTIFICATION_CHECKED, userId, data);
  }

  public boolean scheduleReminder(
      String userId, UUID scheduleId, String title, Instant startAt, NotificationRecord notification) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("schedule_id", scheduleId.toString());
    data.put("title", title);
    data.put("start_at", startAt == null ? null : startAt.toString());
    data.put("notification_id", notification.notificationId().toString());
    data.put("message", notification.message());
    data.put("notify_at", notification.notifyAt().toString());
    return eventBus.publish(EventType.SCHEDULE_REMINDER, userId, data);
  }

  /** Sample event for checking a client's stream end to end. */
  public boolean test(String userId, String message, Instant now) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("notification_id", null);
    data.put("schedule_id", null);
    data.put("message", message);
    data.put("notify_at", now.toString());
    data.put("tags", List.of("test"));
    return eventBus.publish(EventType.NOTIFICATION_CREATED, userId, data);
  }

  private Map<String, Object> notificationData(NotificationRecord record) {
    // LinkedHashMap: schedule_id may be null
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("notification_id", record.notificationId().toString());
    data.put("schedule_id", record.scheduleId() == null ? null : record.scheduleId().toString());
    data.put("message", record.message());
    data.put("notify_at", record.notifyAt().toString());
    data.put("is_sent", record.sent());
    data.put("is_checked", record.checked());
    return data;
  }
}
