/*
 * Where: notification API
 * What: the notification does not exist or belongs to another user
 * Why: both cases map to 404 so ids of other users are not disclosed
 */
package com.fiveschedule.notification.api;

import java.util.UUID;

public class NotificationNotFoundException extends RuntimeException {
  public NotificationNotFoundException(UUID notificationId) {
    super("notification not found: " + notificationId);
  }
}
