package com.fiveschedule.notification.sse;

import static org.assertj.core.api.Assertions.assertThat;

import com.fiveschedule.notification.config.SseProperties;
import com.fiveschedule.notification.service.RealtimeMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SseConnectionManagerTest {

  private SimpleMeterRegistry meterRegistry;
  private SseConnectionManager manager;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    manager =
        new SseConnectionManager(
            new SseProperties(Duration.ofSeconds(30), Duration.ofMillis(100), 2),
            new RealtimeMetrics(meterRegistry));
  }

  @Test
  void sendEventReachesEveryConnectionOfTheUserOnly() throws Exception {
    final SseConnection first = manager.connect("u_1");
    final SseConnection second = manager.connect("u_1");
    final SseConnection other = manager.connect("u_2");

    final int delivered = manager.sendEvent("u_1", "notification:sent", Map.of("message", "hi"));

    assertThat(delivered).isEqualTo(2);
    assertThat(first.poll(Duration.ofMillis(10))).hasValueSatisfying(
        event -> assertThat(event.name()).isEqualTo("notification:sent"));
    assertThat(second.queuedCount()).isEqualTo(1);
    assertThat(other.queuedCount()).isZero();
    assertThat(manager.sendEvent("u_unknown", "notification:sent", Map.of())).isZero();
  }

  @Test
  void disconnectRemovesOnlyThatConnectionAndEmptyUsers() {
    final SseConnection first = manager.connect("u_1");
    final SseConnection second = manager.connect("u_1");

    assertThat(manager.disconnect("u_1", first)).isTrue();
    assertThat(manager.disconnect("u_1", first)).isFalse();
    assertThat(first.isClosed()).isTrue();
    assertThat(manager.connectionCount("u_1")).isEqualTo(1);
    assertThat(manager.userCount()).isEqualTo(1);

    manager.disconnect("u_1", second);
    assertThat(manager.connectionCount()).isZero();
    assertThat(manager.userCount()).isZero();
    assertThat(meterRegistry.get("sse.connections.current").gauge().value()).isZero();
  }

  @Test
  void fullQueueDropsEventAndCountsIt() {
    final SseConnection connection = manager.connect("u_1");

    manager.sendEvent("u_1", "a", Map.of());
    manager.sendEvent("u_1", "b", Map.of());
    final int delivered = manager.sendEvent("u_1", "c", Map.of());

    assertThat(delivered).isZero();
    assertThat(connection.queuedCount()).isEqualTo(2);
    assertThat(meterRegistry.get("sse.events.dropped.total").counter().count()).isEqualTo(1.0);
  }

  @Test
  void closedConnectionStopsAcceptingEvents() {
    final SseConnection connection = manager.connect("u_1");
    connection.close();

    assertThat(manager.sendEvent("u_1", "a", Map.of())).isZero();
    assertThat(meterRegistry.get("sse.events.dropped.total").counter().count()).isZero();
  }

  @Test
  void concurrentConnectAndDisconnectKeepCountsConsistent() throws Exception {
    final ExecutorService executor = Executors.newFixedThreadPool(8);
    final CountDownLatch start = new CountDownLatch(1);
    final List<Future<?>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < 8; i++) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  for (int j = 0; j < 200; j++) {
                    final SseConnection connection = manager.connect("u_shared");
                    manager.sendEvent("u_shared", "tick", Map.of());
                    manager.disconnect("u_shared", connection);
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(manager.connectionCount()).isZero();
    assertThat(manager.userCount()).isZero();
  }
}
