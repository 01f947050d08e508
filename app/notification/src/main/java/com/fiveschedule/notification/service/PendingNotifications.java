package com.fiveschedule.notification.service;

import com.fiveschedule.notification.model.NotificationView;
import java.util.List;

/**
 * Result of a pending-notification poll. {@code json} is the exact body to return; on a cache hit
 * it is the stored string, byte for byte.
 */
public record PendingNotifications(List<NotificationView> notifications, String json, boolean fromCache) {

  public PendingNotifications {
    notifications = List.copyOf(notifications);
  }
}
