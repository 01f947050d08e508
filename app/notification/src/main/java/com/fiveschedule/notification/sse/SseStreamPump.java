/*
 * Where: SSE fan-out
 * What: drains one connection to its client, with a connected frame first and heartbeats when idle
 * Why: proxies close silent streams, and a closed stream has to leave the registry promptly
 */
package com.fiveschedule.notification.sse;

import com.fiveschedule.notification.config.SseProperties;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SseStreamPump {

  private static final Logger logger = LoggerFactory.getLogger(SseStreamPump.class);

  private final SseConnectionManager connectionManager;
  private final SseProperties properties;
  private final Clock clock;

  /** Blocks until the client goes away or the connection is closed, then unregisters it. */
  public void run(SseConnection connection, EventWriter writer) {
    final String userId = connection.userId();
    try {
      final Map<String, Object> connected = new LinkedHashMap<>();
      connected.put("user_id", userId);
      connected.put("timestamp", Instant.now(clock).toString());
      writer.write(new ServerEvent(ServerEvent.CONNECTED, connected));

      final Duration slice = properties.pollSlice();
      Duration idle = Duration.ZERO;
      // short slices so a close from the container is noticed well within one heartbeat
      while (!connection.isClosed()) {
        final Optional<ServerEvent> next = connection.poll(slice);
        if (next.isPresent()) {
          writer.write(next.get());
          idle = Duration.ZERO;
          continue;
        }
        idle = idle.plus(slice);
        if (idle.compareTo(properties.heartbeatInterval()) >= 0) {
          writer.write(new ServerEvent(ServerEvent.HEARTBEAT, Map.of("timestamp", Instant.now(clock).toString())));
          idle = Duration.ZERO;
        }
      }
    } catch (IOException ex) {
      logger.debug("sse client gone userId={} connectionId={} reason={}",
          userId, connection.connectionId(), ex.getMessage());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } finally {
      connectionManager.disconnect(userId, connection);
    }
  }
}
