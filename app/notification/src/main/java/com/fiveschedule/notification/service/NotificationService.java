/*
 * Where: notification service layer
 * What: create, list, check and delete for a user's notifications
 * Why: each mutation keeps the pending snapshot and the live streams consistent with the table
 */
package com.fiveschedule.notification.service;

import com.fiveschedule.notification.api.InvalidNotificationRequestException;
import com.fiveschedule.notification.api.NotificationNotFoundException;
import com.fiveschedule.notification.api.ScheduleNotFoundException;
import com.fiveschedule.notification.cache.UserCacheInvalidator;
import com.fiveschedule.notification.event.NotificationEvents;
import com.fiveschedule.notification.model.NotificationRecord;
import com.fiveschedule.notification.model.ScheduleRecord;
import com.fiveschedule.notification.repository.NotificationRepository;
import com.fiveschedule.notification.repository.ScheduleRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);

  static final int DEFAULT_LIST_LIMIT = 20;
  static final int MAX_LIST_LIMIT = 100;
  static final int MAX_MESSAGE_LENGTH = 1000;

  private final NotificationRepository notificationRepository;
  private final ScheduleRepository scheduleRepository;
  private final UserCacheInvalidator cacheInvalidator;
  private final NotificationEvents notificationEvents;
  private final Clock clock;

  public NotificationRecord create(String userId, CreateNotificationCommand command) {
    requireUser(userId);
    if (command == null) {
      throw new InvalidNotificationRequestException("request is required");
    }
    final String message = command.message();
    if (message == null || message.isBlank()) {
      throw new InvalidNotificationRequestException("message is required");
    }
    if (message.length() > MAX_MESSAGE_LENGTH) {
      throw new InvalidNotificationRequestException("message is too long");
    }
    if (command.minutesBefore() != null && command.minutesBefore() < 0) {
      throw new InvalidNotificationRequestException("minutes_before must not be negative");
    }

    final Optional<ScheduleRecord> schedule = resolveSchedule(userId, command);
    final Instant notifyAt = resolveNotifyAt(command, schedule.orElse(null));
    final NotificationRecord record =
        NotificationRecord.newPending(
            userId,
            schedule.map(ScheduleRecord::scheduleId).orElse(null),
            message,
            notifyAt,
            Instant.now(clock));
    notificationRepository.insert(record);
    // the next poll must not replay a snapshot taken before this row existed
    cacheInvalidator.invalidatePendingNotifications(userId);
    notificationEvents.created(record);
    logger.info(
        "notification created id={} userId={} notifyAt={}",
        record.notificationId(),
        userId,
        notifyAt);
    return record;
  }

  public List<NotificationRecord> list(String userId, Integer limit, boolean includeChecked) {
    requireUser(userId);
    return notificationRepository.findByUserId(userId, clampLimit(limit), includeChecked);
  }

  /**
   * Marks the given notifications as checked. Ids that do not exist or belong to another user are
   * skipped. Unsent notifications may be checked as well.
   *
   * @return number of rows updated
   */
  public int check(String userId, Collection<UUID> notificationIds) {
    requireUser(userId);
    if (notificationIds == null || notificationIds.isEmpty()) {
      return 0;
    }
    final Set<UUID> ids = new LinkedHashSet<>(notificationIds);
    final int updated = notificationRepository.markChecked(userId, ids);
    if (updated > 0) {
      notificationEvents.checked(userId, ids, updated);
    }
    logger.info("notifications checked userId={} requested={} updated={}", userId, ids.size(), updated);
    return updated;
  }

  public void delete(String userId, UUID notificationId) {
    requireUser(userId);
    final int deleted = notificationRepository.deleteByIdAndUserId(notificationId, userId);
    if (deleted == 0) {
      throw new NotificationNotFoundException(notificationId);
    }
    cacheInvalidator.invalidatePendingNotifications(userId);
    logger.info("notification deleted id={} userId={}", notificationId, userId);
  }

  private Optional<ScheduleRecord> resolveSchedule(String userId, CreateNotificationCommand command) {
    if (command.scheduleId() != null) {
      return Optional.of(
          scheduleRepository
              .findByIdAndUserId(command.scheduleId(), userId)
              .orElseThrow(() -> new ScheduleNotFoundException(command.scheduleId().toString())));
    }
    final String title = command.scheduleTitle();
    if (title != null && !title.isBlank()) {
      return Optional.of(
          scheduleRepository
              .findFirstByTitleFragment(userId, title.trim())
              .orElseThrow(() -> new ScheduleNotFoundException(title.trim())));
    }
    return Optional.empty();
  }

  @VisibleForTesting
  Instant resolveNotifyAt(CreateNotificationCommand command, ScheduleRecord schedule) {
    if (command.minutesBefore() == null) {
      if (command.notifyAt() == null) {
        throw new InvalidNotificationRequestException("notify_at or minutes_before is required");
      }
      return command.notifyAt();
    }
    if (schedule == null) {
      throw new InvalidNotificationRequestException("minutes_before requires a schedule");
    }
    final Instant anchor = schedule.startAt() != null ? schedule.startAt() : schedule.endAt();
    if (anchor == null) {
      throw new InvalidNotificationRequestException("schedule has no start or end time");
    }
    return anchor.minus(Duration.ofMinutes(command.minutesBefore()));
  }

  private int clampLimit(Integer limit) {
    if (limit == null) {
      return DEFAULT_LIST_LIMIT;
    }
    if (limit < 1) {
      throw new InvalidNotificationRequestException("limit must be positive");
    }
    return Math.min(limit, MAX_LIST_LIMIT);
  }

  private void requireUser(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new InvalidNotificationRequestException("user id is required");
    }
  }
}
