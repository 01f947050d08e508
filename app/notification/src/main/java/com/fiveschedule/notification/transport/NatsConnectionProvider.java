/*
 * Where: NATS transport
 * What: opens the shared NATS connection on first use and reopens it after it closes
 * Why: a broker outage at boot or runtime must never stop the process
 */
package com.fiveschedule.notification.transport;

import com.fiveschedule.notification.config.NatsProperties;
import io.nats.client.Connection;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class NatsConnectionProvider implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(NatsConnectionProvider.class);

  @FunctionalInterface
  interface Connector {
    Connection connect(Options options) throws IOException, InterruptedException;
  }

  private final NatsProperties properties;
  private final Connector connector;
  private final Clock clock;
  private final Object lock = new Object();
  private volatile Connection connection;
  private Instant nextAttemptAt = Instant.MIN;

  public NatsConnectionProvider(NatsProperties properties, Clock clock) {
    this(properties, Nats::connect, clock);
  }

  NatsConnectionProvider(NatsProperties properties, Connector connector, Clock clock) {
    this.properties = properties;
    this.connector = connector;
    this.clock = clock;
  }

  public Connection get() throws EventTransportException {
    Connection current = connection;
    if (current != null && current.getStatus() != Connection.Status.CLOSED) {
      return current;
    }
    synchronized (lock) {
      current = connection;
      if (current != null && current.getStatus() != Connection.Status.CLOSED) {
        return current;
      }
      Instant now = Instant.now(clock);
      // fail fast between attempts so request threads do not stall on a dead broker
      if (now.isBefore(nextAttemptAt)) {
        throw new EventTransportException("nats connect backing off url=" + properties.url());
      }
      try {
        connection = connector.connect(buildOptions());
        logger.info("nats connection opened url={}", properties.url());
        return connection;
      } catch (IOException ex) {
        nextAttemptAt = now.plus(properties.reconnectWait());
        throw new EventTransportException("nats connect failed url=" + properties.url(), ex);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new EventTransportException("nats connect interrupted url=" + properties.url(), ex);
      }
    }
  }

  public boolean isConnected() {
    Connection current = connection;
    return current != null && current.getStatus() == Connection.Status.CONNECTED;
  }

  private Options buildOptions() {
    return new Options.Builder()
        .server(properties.url())
        .connectionTimeout(Duration.ofSeconds(properties.connectionTimeout()))
        .reconnectWait(properties.reconnectWait())
        // the client keeps reconnecting on its own once the first connect succeeded
        .maxReconnects(-1)
        .build();
  }

  @Override
  public void close() {
    Connection current = connection;
    connection = null;
    if (current == null) {
      return;
    }
    try {
      current.close();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("interrupted while closing nats connection", ex);
    }
  }
}
