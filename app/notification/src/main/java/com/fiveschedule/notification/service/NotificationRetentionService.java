/*
 * Where: notification service layer
 * What: applies the retention policy to delivered and acknowledged notifications
 * Why: prevent unbounded growth while keeping anything the user has not seen
 */
package com.fiveschedule.notification.service;

import com.fiveschedule.notification.config.NotificationRetentionProperties;
import com.fiveschedule.notification.repository.NotificationRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetentionService.class);

  private final NotificationRepository notificationRepository;
  private final NotificationRetentionProperties properties;
  private final Clock clock;

  public int cleanup() {
    final Instant now = Instant.now(clock);
    final Instant threshold = now.minus(Duration.ofDays(properties.retentionDays()));
    final int staleUnsentCount = notificationRepository.countUnsentOlderThan(threshold);
    if (staleUnsentCount > 0) {
      logger.error(
          "notification retention found stale unsent records count={} threshold={}",
          staleUnsentCount,
          threshold);
    }
    final int deleted = notificationRepository.deleteSentAndCheckedOlderThan(threshold);
    logger.info("notification retention cleanup deleted notifications={} threshold={}", deleted, threshold);
    return deleted;
  }
}
