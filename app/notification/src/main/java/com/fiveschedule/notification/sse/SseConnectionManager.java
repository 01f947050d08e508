/*
 * Where: SSE fan-out
 * What: registry of open streams per user and delivery of events to all of them
 * Why: one user may keep several tabs or devices open at once
 *
 * An event for a user with no open stream is dropped. It is not queued or persisted here; the
 * pending and unchecked notification queries are how such a client catches up.
 */
package com.fiveschedule.notification.sse;

import com.fiveschedule.notification.config.SseProperties;
import com.fiveschedule.notification.service.RealtimeMetrics;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SseConnectionManager {

  private static final Logger logger = LoggerFactory.getLogger(SseConnectionManager.class);

  private final ConcurrentMap<String, CopyOnWriteArrayList<SseConnection>> connections =
      new ConcurrentHashMap<>();
  private final AtomicInteger connectionCount = new AtomicInteger(0);
  private final SseProperties properties;
  private final RealtimeMetrics metrics;

  public SseConnectionManager(SseProperties properties, RealtimeMetrics metrics) {
    this.properties = properties;
    this.metrics = metrics;
  }

  public SseConnection connect(String userId) {
    final SseConnection connection = new SseConnection(userId, properties.queueCapacity());
    // compute is atomic per key, so a concurrent disconnect cannot drop the list under us
    connections.compute(
        userId,
        (key, existing) -> {
          final CopyOnWriteArrayList<SseConnection> list =
              existing == null ? new CopyOnWriteArrayList<>() : existing;
          list.add(connection);
          return list;
        });
    metrics.updateSseConnections(connectionCount.incrementAndGet());
    logger.info("sse connected userId={} connectionId={}", userId, connection.connectionId());
    return connection;
  }

  /** Removes exactly this connection. Returns false when it was already gone. */
  public boolean disconnect(String userId, SseConnection connection) {
    connection.close();
    final boolean[] removed = {false};
    connections.computeIfPresent(
        userId,
        (key, list) -> {
          removed[0] = list.remove(connection);
          return list.isEmpty() ? null : list;
        });
    if (removed[0]) {
      metrics.updateSseConnections(connectionCount.decrementAndGet());
      logger.info("sse disconnected userId={} connectionId={}", userId, connection.connectionId());
    }
    return removed[0];
  }

  /**
   * Enqueues the event on every open stream of the user.
   *
   * @return number of streams that accepted the event
   */
  public int sendEvent(String userId, String eventName, Map<String, Object> data) {
    final List<SseConnection> targets = connections.get(userId);
    if (targets == null) {
      return 0;
    }
    final ServerEvent event = new ServerEvent(eventName, data);
    int delivered = 0;
    for (SseConnection connection : targets) {
      if (connection.offer(event)) {
        delivered++;
      } else if (!connection.isClosed()) {
        metrics.recordSseDropped();
        logger.warn(
            "sse queue full, event dropped userId={} connectionId={} event={}",
            userId,
            connection.connectionId(),
            eventName);
      }
    }
    return delivered;
  }

  public int connectionCount() {
    return connectionCount.get();
  }

  public int userCount() {
    return connections.size();
  }

  public int connectionCount(String userId) {
    final List<SseConnection> list = connections.get(userId);
    return list == null ? 0 : list.size();
  }
}
