/*
 * Where: SSE fan-out tests
 * What: events published on the bus arrive on every open stream of the user, in publish order
 */
package com.fiveschedule.notification.sse;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fiveschedule.notification.config.EventBusProperties;
import com.fiveschedule.notification.config.SseProperties;
import com.fiveschedule.notification.event.EventBus;
import com.fiveschedule.notification.event.EventPayloadCodec;
import com.fiveschedule.notification.event.EventType;
import com.fiveschedule.notification.service.RealtimeMetrics;
import com.fiveschedule.notification.transport.LocalEventTransport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SseDeliveryPipelineTest {

  private static final String USER = "u_1";
  private static final int EVENT_COUNT = 50;
  private static final long WAIT_MILLIS = 2_000;

  private LocalEventTransport transport;
  private EventBus eventBus;
  private SseConnectionManager connectionManager;
  private SseEventForwarder forwarder;

  @BeforeEach
  void setUp() {
    final RealtimeMetrics metrics = new RealtimeMetrics(new SimpleMeterRegistry());
    transport = new LocalEventTransport();
    eventBus =
        new EventBus(
            transport,
            new EventPayloadCodec(new ObjectMapper()),
            new EventBusProperties("events", Duration.ofMillis(50), Duration.ofMillis(50), false),
            metrics,
            Clock.systemUTC());
    connectionManager =
        new SseConnectionManager(new SseProperties(Duration.ofSeconds(30), Duration.ofMillis(100), 256), metrics);
    forwarder = new SseEventForwarder(eventBus, connectionManager);
    forwarder.register();
  }

  @AfterEach
  void tearDown() {
    forwarder.unregister();
    eventBus.stopListening();
  }

  @Test
  void everyOpenStreamOfUserReceivesEventsInPublishOrder() throws Exception {
    final SseConnection phone = connectionManager.connect(USER);
    final SseConnection laptop = connectionManager.connect(USER);
    final SseConnection otherUser = connectionManager.connect("u_2");
    startListening();

    for (int seq = 0; seq < EVENT_COUNT; seq++) {
      final EventType type = seq % 2 == 0 ? EventType.NOTIFICATION_SENT : EventType.SCHEDULE_REMINDER;
      assertThat(eventBus.publish(type, USER, Map.of("seq", seq))).isTrue();
    }

    final List<ServerEvent> phoneEvents = drain(phone, EVENT_COUNT);
    final List<ServerEvent> laptopEvents = drain(laptop, EVENT_COUNT);
    assertThat(sequence(phoneEvents)).isSorted().hasSize(EVENT_COUNT).doesNotHaveDuplicates();
    assertThat(sequence(laptopEvents)).isEqualTo(sequence(phoneEvents));
    assertThat(phoneEvents.get(0).name()).isEqualTo("notification:sent");
    assertThat(phoneEvents.get(1).name()).isEqualTo("schedule:reminder");
    assertThat(otherUser.queuedCount()).isZero();
  }

  @Test
  void closingOneStreamKeepsDeliveringToTheOther() throws Exception {
    final SseConnection phone = connectionManager.connect(USER);
    final SseConnection laptop = connectionManager.connect(USER);
    startListening();

    connectionManager.disconnect(USER, phone);
    eventBus.publish(EventType.NOTIFICATION_CREATED, USER, Map.of("seq", 1));

    assertThat(drain(laptop, 1)).extracting(ServerEvent::name).containsExactly("notification:created");
    assertThat(phone.queuedCount()).isZero();
  }

  @Test
  void checkedEventsAreNotForwardedToStreams() throws Exception {
    final SseConnection phone = connectionManager.connect(USER);
    startListening();

    eventBus.publish(EventType.NOTIFICATION_CHECKED, USER, Map.of("seq", 0));
    eventBus.publish(EventType.NOTIFICATION_SENT, USER, Map.of("seq", 1));

    assertThat(sequence(drain(phone, 1))).containsExactly(1);
    assertThat(phone.queuedCount()).isZero();
  }

  private void startListening() throws InterruptedException {
    eventBus.startListening();
    final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(WAIT_MILLIS);
    while (transport.subscriptionCount() == 0 && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    assertThat(transport.subscriptionCount()).isPositive();
  }

  private static List<ServerEvent> drain(SseConnection connection, int expected) throws InterruptedException {
    final List<ServerEvent> events = new ArrayList<>();
    final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(WAIT_MILLIS);
    while (events.size() < expected && System.nanoTime() < deadline) {
      final Optional<ServerEvent> next = connection.poll(Duration.ofMillis(50));
      next.ifPresent(events::add);
    }
    assertThat(events).hasSize(expected);
    return events;
  }

  private static List<Integer> sequence(List<ServerEvent> events) {
    return events.stream().map(event -> ((Number) event.data().get("seq")).intValue()).toList();
  }
}
