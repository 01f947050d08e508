package com.fiveschedule.notification.transport;

import java.time.Duration;
import java.util.Optional;

public interface TransportSubscription extends AutoCloseable {

  /**
   * Waits up to {@code timeout} for the next message body. An empty result means the timeout
   * elapsed; an exception means the subscription is no longer usable and must be reopened.
   */
  Optional<byte[]> poll(Duration timeout) throws EventTransportException, InterruptedException;

  @Override
  void close();
}
