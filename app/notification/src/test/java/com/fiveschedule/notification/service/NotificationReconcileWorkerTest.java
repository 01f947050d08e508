package com.fiveschedule.notification.service;

import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fiveschedule.notification.config.NotificationReconcileProperties;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationReconcileWorkerTest {

  @Mock private NotificationReconciler reconciler;

  @Test
  void drainsWhileBatchesComeBackFull() {
    when(reconciler.reconcileDue(10)).thenReturn(10, 10, 3);
    final NotificationReconcileWorker worker =
        new NotificationReconcileWorker(
            reconciler, new NotificationReconcileProperties(true, Duration.ofSeconds(60), 10));

    worker.run();

    verify(reconciler, times(3)).reconcileDue(10);
  }
}
