/*
 * Where: background tasks
 * What: schedule-reminder and batch-create jobs for notifications, submitted on the HIGH queue
 * Why: both touch several rows and publish events, so they run off the request thread
 */
package com.fiveschedule.notification.task;

import com.fiveschedule.notification.api.InvalidNotificationRequestException;
import com.fiveschedule.notification.api.ScheduleNotFoundException;
import com.fiveschedule.notification.cache.UserCacheInvalidator;
import com.fiveschedule.notification.event.NotificationEvents;
import com.fiveschedule.notification.model.NotificationRecord;
import com.fiveschedule.notification.model.ScheduleRecord;
import com.fiveschedule.notification.repository.NotificationRepository;
import com.fiveschedule.notification.repository.ScheduleRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Component
@RequiredArgsConstructor
public class NotificationTasks {

  private static final Logger logger = LoggerFactory.getLogger(NotificationTasks.class);

  public static final String REMINDER_TASK = "notification.schedule_reminder";
  public static final String BATCH_CREATE_TASK = "notification.batch_create";
  public static final int DEFAULT_REMINDER_MINUTES = 30;
  static final String DEFAULT_BATCH_MESSAGE = "You have an upcoming notification";

  private final TaskRunner taskRunner;
  private final ScheduleRepository scheduleRepository;
  private final NotificationRepository notificationRepository;
  private final UserCacheInvalidator cacheInvalidator;
  private final NotificationEvents notificationEvents;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /** One entry of a batch create. */
  public record BatchItem(UUID scheduleId, String message, Instant notifyAt) {}

  public String submitScheduleReminder(String userId, UUID scheduleId, Integer minutesBefore) {
    if (scheduleId == null) {
      throw new InvalidNotificationRequestException("schedule_id is required");
    }
    final int minutes = minutesBefore == null ? DEFAULT_REMINDER_MINUTES : minutesBefore;
    if (minutes < 0) {
      throw new InvalidNotificationRequestException("minutes_before must not be negative");
    }
    return taskRunner.submit(
        REMINDER_TASK, TaskPriority.HIGH, userId, () -> scheduleReminder(userId, scheduleId, minutes));
  }

  public String submitBatchCreate(String userId, List<BatchItem> items) {
    if (items == null || items.isEmpty()) {
      throw new InvalidNotificationRequestException("notifications must not be empty");
    }
    for (BatchItem item : items) {
      if (item == null || item.notifyAt() == null) {
        throw new InvalidNotificationRequestException("notify_at is required for every notification");
      }
    }
    final List<BatchItem> copy = List.copyOf(items);
    return taskRunner.submit(BATCH_CREATE_TASK, TaskPriority.HIGH, userId, () -> batchCreate(userId, copy));
  }

  Map<String, Object> scheduleReminder(String userId, UUID scheduleId, int minutesBefore) {
    final ScheduleRecord schedule =
        scheduleRepository
            .findByIdAndUserId(scheduleId, userId)
            .orElseThrow(
                () ->
                    new PermanentTaskException(
                        "schedule not found",
                        new ScheduleNotFoundException(scheduleId.toString())));
    final Instant anchor = schedule.startAt() != null ? schedule.startAt() : schedule.endAt();
    if (anchor == null) {
      throw new PermanentTaskException(
          "schedule has no start or end time",
          new InvalidNotificationRequestException("schedule has no time " + scheduleId));
    }
    final Instant notifyAt = anchor.minus(Duration.ofMinutes(minutesBefore));
    final String message = "'" + schedule.title() + "' starts in " + minutesBefore + " minutes";
    final NotificationRecord record =
        NotificationRecord.newPending(userId, scheduleId, message, notifyAt, Instant.now(clock));
    notificationRepository.insert(record);
    cacheInvalidator.invalidatePendingNotifications(userId);
    notificationEvents.scheduleReminder(userId, scheduleId, schedule.title(), schedule.startAt(), record);
    logger.info(
        "schedule reminder created userId={} scheduleId={} notificationId={} notifyAt={}",
        userId,
        scheduleId,
        record.notificationId(),
        notifyAt);

    final Map<String, Object> result = new LinkedHashMap<>();
    result.put("notification_id", record.notificationId().toString());
    result.put("notify_at", notifyAt.toString());
    return result;
  }

  Map<String, Object> batchCreate(String userId, List<BatchItem> items) {
    for (BatchItem item : items) {
      if (item.scheduleId() != null
          && scheduleRepository.findByIdAndUserId(item.scheduleId(), userId).isEmpty()) {
        throw new PermanentTaskException(
            "schedule not found",
            new ScheduleNotFoundException(item.scheduleId().toString()));
      }
    }
    final Instant now = Instant.now(clock);
    final List<NotificationRecord> records = new ArrayList<>();
    for (BatchItem item : items) {
      final String message =
          item.message() == null || item.message().isBlank() ? DEFAULT_BATCH_MESSAGE : item.message();
      records.add(NotificationRecord.newPending(userId, item.scheduleId(), message, item.notifyAt(), now));
    }
    // all or nothing, so a retried attempt never leaves duplicates behind
    new TransactionTemplate(transactionManager)
        .executeWithoutResult(status -> records.forEach(notificationRepository::insert));
    cacheInvalidator.invalidatePendingNotifications(userId);
    records.forEach(notificationEvents::created);
    logger.info("notifications batch created userId={} count={}", userId, records.size());

    final Map<String, Object> result = new LinkedHashMap<>();
    result.put("created_count", records.size());
    result.put(
        "notification_ids",
        records.stream().map(record -> record.notificationId().toString()).toList());
    return result;
  }
}
