/*
 * Where: notification service layer
 * What: claims due notifications, snapshots them in the cache and publishes NOTIFICATION_SENT
 * Why: polling clients and the background pass must never deliver the same row twice
 *
 * A cache hit replays the previous claim unchanged for the TTL window so several tabs of one
 * user see the same set. Without the cache every poll claims straight from the database, which
 * is still correct, only slower.
 */
package com.fiveschedule.notification.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fiveschedule.notification.cache.CacheKeys;
import com.fiveschedule.notification.cache.CacheStore;
import com.fiveschedule.notification.config.CacheProperties;
import com.fiveschedule.notification.event.NotificationEvents;
import com.fiveschedule.notification.model.NotificationRecord;
import com.fiveschedule.notification.model.NotificationView;
import com.fiveschedule.notification.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationReconciler {

  private static final Logger logger = LoggerFactory.getLogger(NotificationReconciler.class);
  private static final TypeReference<List<NotificationView>> VIEW_LIST = new TypeReference<>() {};

  private final NotificationRepository notificationRepository;
  private final CacheStore cacheStore;
  private final NotificationEvents notificationEvents;
  private final CacheProperties cacheProperties;
  private final RealtimeMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public PendingNotifications getPending(String userId) {
    return getPending(userId, Instant.now(clock));
  }

  public PendingNotifications getPending(String userId, Instant now) {
    final String cacheKey = CacheKeys.notificationsPending(userId);
    final Optional<String> cached = cacheStore.get(cacheKey);
    if (cached.isPresent()) {
      final Optional<List<NotificationView>> replay = parse(cached.get(), cacheKey);
      if (replay.isPresent()) {
        return new PendingNotifications(replay.get(), cached.get(), true);
      }
    }

    final List<NotificationRecord> claimed =
        notificationRepository.claimDueForUser(userId, now).stream()
            .sorted(Comparator.comparing(NotificationRecord::notifyAt))
            .toList();
    final List<NotificationView> views = claimed.stream().map(NotificationView::from).toList();
    final String json = write(views);
    // an empty list is cached too, so a burst of polls does not hit the database, but it never
    // replaces a snapshot that a concurrent poll of the same user has just claimed
    final boolean stored =
        claimed.isEmpty()
            ? cacheStore.setIfAbsent(cacheKey, json, cacheProperties.pendingNotificationsTtl())
            : cacheStore.set(cacheKey, json, cacheProperties.pendingNotificationsTtl());
    if (!stored) {
      logger.debug("pending notification snapshot not cached userId={}", userId);
    }
    if (!claimed.isEmpty()) {
      metrics.recordClaimed(claimed.size());
      logger.info("pending notifications claimed userId={} count={}", userId, claimed.size());
      claimed.forEach(notificationEvents::sent);
    }
    return new PendingNotifications(views, json, false);
  }

  /**
   * Claims due notifications of all users, publishes NOTIFICATION_SENT for each and drops the
   * pending snapshot of every affected user.
   *
   * @return number of claimed notifications
   */
  public int reconcileDue(int limit) {
    final Instant now = Instant.now(clock);
    final List<NotificationRecord> claimed = notificationRepository.claimDue(limit, now);
    if (claimed.isEmpty()) {
      return 0;
    }
    final Set<String> users = new LinkedHashSet<>();
    for (NotificationRecord record : claimed) {
      notificationEvents.sent(record);
      users.add(record.userId());
    }
    users.forEach(userId -> cacheStore.delete(CacheKeys.notificationsPending(userId)));
    metrics.recordClaimed(claimed.size());
    logger.info("notification reconcile claimed count={} users={}", claimed.size(), users.size());
    return claimed.size();
  }

  private Optional<List<NotificationView>> parse(String json, String cacheKey) {
    try {
      return Optional.of(objectMapper.readValue(json, VIEW_LIST));
    } catch (JsonProcessingException ex) {
      logger.warn("discarding unreadable pending snapshot key={} reason={}", cacheKey, ex.getMessage());
      cacheStore.delete(cacheKey);
      return Optional.empty();
    }
  }

  private String write(List<NotificationView> views) {
    try {
      return objectMapper.writeValueAsString(views);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize pending notifications", ex);
    }
  }
}
