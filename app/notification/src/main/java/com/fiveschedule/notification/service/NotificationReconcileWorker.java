/*
 * Where: notification reconcile worker
 * What: periodically claims due notifications of all users
 * Why: connected clients hear about due notifications even when they do not poll
 */
package com.fiveschedule.notification.service;

import com.fiveschedule.notification.config.NotificationReconcileProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notification.reconcile.enabled", havingValue = "true")
public class NotificationReconcileWorker {

  private final NotificationReconciler reconciler;
  private final NotificationReconcileProperties properties;

  @Scheduled(fixedDelayString = "${notification.reconcile.poll-interval}")
  public void run() {
    // drain in batches; a short batch means nothing else is due right now
    int claimed;
    do {
      claimed = reconciler.reconcileDue(properties.batchSize());
    } while (claimed >= properties.batchSize());
  }
}
