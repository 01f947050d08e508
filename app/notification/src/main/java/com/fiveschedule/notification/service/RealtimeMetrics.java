/*
 * Where: notification service layer
 * What: records event bus, SSE, claim and task metrics
 * Why: degraded delivery is invisible to clients, so it has to be visible in Prometheus
 */
package com.fiveschedule.notification.service;

import com.fiveschedule.notification.event.EventType;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class RealtimeMetrics {

  private static final String METRIC_EVENT_PUBLISH_TOTAL = "event.publish.total";
  private static final String METRIC_EVENT_RECEIVED_TOTAL = "event.received.total";
  private static final String METRIC_EVENT_MALFORMED_TOTAL = "event.malformed.total";
  private static final String METRIC_EVENT_TRANSPORT_OVERFLOW_TOTAL = "event.transport.overflow.total";
  private static final String METRIC_EVENT_HANDLER_FAILURE_TOTAL = "event.handler.failure.total";
  private static final String METRIC_SSE_CONNECTIONS_CURRENT = "sse.connections.current";
  private static final String METRIC_SSE_DROPPED_TOTAL = "sse.events.dropped.total";
  private static final String METRIC_NOTIFICATION_CLAIMED_TOTAL = "notification.claimed.total";
  private static final String METRIC_TASK_TOTAL = "task.outcome.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger sseConnectionsCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter malformedCounter;
  private final Counter transportOverflowCounter;
  private final Counter sseDroppedCounter;
  private final Counter claimedCounter;

  public RealtimeMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_SSE_CONNECTIONS_CURRENT, sseConnectionsCurrent, AtomicInteger::get)
        .description("Current number of open SSE connections")
        .register(meterRegistry);
    this.malformedCounter =
        Counter.builder(METRIC_EVENT_MALFORMED_TOTAL)
            .description("Transport messages dropped because they could not be decoded")
            .register(meterRegistry);
    this.transportOverflowCounter =
        Counter.builder(METRIC_EVENT_TRANSPORT_OVERFLOW_TOTAL)
            .description("Transport messages dropped because the subscription buffer was full")
            .register(meterRegistry);
    this.sseDroppedCounter =
        Counter.builder(METRIC_SSE_DROPPED_TOTAL)
            .description("SSE events dropped because a connection queue was full")
            .register(meterRegistry);
    this.claimedCounter =
        Counter.builder(METRIC_NOTIFICATION_CLAIMED_TOTAL)
            .description("Notifications claimed as sent")
            .register(meterRegistry);
  }

  public void recordPublish(String result) {
    counter(METRIC_EVENT_PUBLISH_TOTAL, "Event publish outcomes", Tags.of("result", result))
        .increment();
  }

  public void recordReceived(EventType eventType) {
    counter(METRIC_EVENT_RECEIVED_TOTAL, "Events received by the listener",
            Tags.of("type", eventType.wireName()))
        .increment();
  }

  public void recordMalformed() {
    malformedCounter.increment();
  }

  public void recordTransportOverflow() {
    transportOverflowCounter.increment();
  }

  public void recordHandlerFailure(EventType eventType) {
    counter(METRIC_EVENT_HANDLER_FAILURE_TOTAL, "Event handler invocations that threw",
            Tags.of("type", eventType.wireName()))
        .increment();
  }

  public void updateSseConnections(int count) {
    sseConnectionsCurrent.set(Math.max(count, 0));
  }

  public void recordSseDropped() {
    sseDroppedCounter.increment();
  }

  public void recordClaimed(int count) {
    if (count > 0) {
      claimedCounter.increment(count);
    }
  }

  public void recordTaskOutcome(String taskName, String result) {
    counter(METRIC_TASK_TOTAL, "Background task outcomes",
            Tags.of("task", taskName, "result", result))
        .increment();
  }

  private Counter counter(String name, String description, Tags tags) {
    return counters.computeIfAbsent(
        name + tags,
        ignored -> Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}
