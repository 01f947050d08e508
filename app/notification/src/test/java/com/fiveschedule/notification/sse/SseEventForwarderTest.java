package com.fiveschedule.notification.sse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.fiveschedule.notification.event.EventBinding;
import com.fiveschedule.notification.event.EventBus;
import com.fiveschedule.notification.event.EventPayload;
import com.fiveschedule.notification.event.EventType;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class SseEventForwarderTest {

  private final EventBus eventBus = mock(EventBus.class);
  private final SseConnectionManager connectionManager = mock(SseConnectionManager.class);

  @Test
  void registersOneBindingPerForwardedType() {
    final SseEventForwarder forwarder = new SseEventForwarder(eventBus, connectionManager);

    forwarder.register();

    @SuppressWarnings("unchecked")
    final ArgumentCaptor<List<EventBinding>> captor = ArgumentCaptor.forClass(List.class);
    verify(eventBus).subscribeAll(captor.capture());
    assertThat(captor.getValue())
        .extracting(EventBinding::eventType)
        .containsExactlyElementsOf(SseEventForwarder.FORWARDED_TYPES);
    assertThat(SseEventForwarder.FORWARDED_TYPES)
        .doesNotContain(EventType.NOTIFICATION_CHECKED, EventType.USER_LOGIN);
  }

  @Test
  void forwardUsesWireNameAsEventName() {
    final SseEventForwarder forwarder = new SseEventForwarder(eventBus, connectionManager);

    forwarder.forward(
        new EventPayload(EventType.SCHEDULE_REMINDER, "u_1", Map.of("title", "Exam"), Instant.EPOCH));

    verify(connectionManager).sendEvent("u_1", "schedule:reminder", Map.of("title", "Exam"));
  }
}
