/*
 * Where: configuration binding tests
 * What: Duration and nested-name binding of the realtime properties
 */
package com.fiveschedule.notification.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class NotificationPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(
              "event-bus.subject-prefix=events",
              "event-bus.poll-timeout=500ms",
              "event-bus.reconnect-delay=5s",
              "event-bus.listener-enabled=false",
              "sse.heartbeat-interval=30s",
              "sse.poll-slice=1s",
              "sse.queue-capacity=64",
              "cache.pending-notifications-ttl=30s",
              "cache.task-status-ttl=1h",
              "tasks.workers=3",
              "tasks.max-attempts=3",
              "tasks.backoff-base=2s",
              "tasks.backoff-max=60s",
              "tasks.backoff-exponent-base=2.0",
              "tasks.backoff-jitter-min=0.8",
              "tasks.backoff-jitter-max=1.2",
              "tasks.backoff-min=1s",
              "nats.enabled=true",
              "nats.url=nats://nats:4222",
              "nats.connection-timeout=2",
              "nats.reconnect-wait=2s");

  @Test
  void contextStartsAndBindsDurationFields() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final EventBusProperties eventBus = context.getBean(EventBusProperties.class);
          final SseProperties sse = context.getBean(SseProperties.class);
          final CacheProperties cache = context.getBean(CacheProperties.class);
          final TaskProperties tasks = context.getBean(TaskProperties.class);
          final NatsProperties nats = context.getBean(NatsProperties.class);

          assertThat(eventBus.pollTimeout()).isEqualTo(Duration.ofMillis(500));
          assertThat(eventBus.listenerEnabled()).isFalse();
          assertThat(sse.heartbeatInterval()).isEqualTo(Duration.ofSeconds(30));
          assertThat(sse.queueCapacity()).isEqualTo(64);
          assertThat(cache.pendingNotificationsTtl()).isEqualTo(Duration.ofSeconds(30));
          assertThat(cache.taskStatusTtl()).isEqualTo(Duration.ofHours(1));
          assertThat(tasks.workers()).isEqualTo(3);
          assertThat(tasks.backoffJitterMax()).isEqualTo(1.2);
          assertThat(nats.reconnectWait()).isEqualTo(Duration.ofSeconds(2));
        });
  }

  @Test
  void pollTimeoutAboveOneSecondFailsStartup() {
    contextRunner
        .withPropertyValues("event-bus.poll-timeout=5s")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void pollSliceLongerThanHeartbeatFailsStartup() {
    contextRunner
        .withPropertyValues("sse.poll-slice=45s")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties({
    EventBusProperties.class,
    SseProperties.class,
    CacheProperties.class,
    TaskProperties.class,
    NatsProperties.class
  })
  static class TestConfiguration {
  }
}
