/*
 * Where: notification smoke test
 * What: boots the full context against PostgreSQL with the in-process transport
 */
package com.fiveschedule.notification;

import static org.assertj.core.api.Assertions.assertThat;

import com.fiveschedule.notification.event.EventBus;
import com.fiveschedule.notification.event.EventType;
import com.fiveschedule.notification.transport.EventTransport;
import com.fiveschedule.notification.transport.LocalEventTransport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationApplicationTests extends AbstractPostgresContainerTest {

  @Autowired private EventTransport eventTransport;
  @Autowired private EventBus eventBus;

  @Test
  void contextLoads() {
    assertThat(eventTransport).isInstanceOf(LocalEventTransport.class);
    assertThat(eventBus.isListening()).isTrue();
    assertThat(eventBus.handlerCounts())
        .containsKeys(
            EventType.NOTIFICATION_CREATED,
            EventType.NOTIFICATION_SENT,
            EventType.SCHEDULE_REMINDER,
            EventType.DEADLINE_ALERT,
            EventType.DAILY_SUMMARY);
  }
}
