/*
 * Where: event bus transport seam
 * What: minimal pub/sub contract the event bus needs from a broker
 * Why: lets NATS and the in-process loopback be swapped by configuration
 */
package com.fiveschedule.notification.transport;

public interface EventTransport {

  /** Cheap round trip to the broker; false when unreachable. Never throws. */
  boolean ping();

  void publish(String subject, byte[] body) throws EventTransportException;

  /**
   * Opens a subscription. Subjects are dot-separated tokens; {@code *} matches one token and
   * {@code >} matches the remaining tokens.
   */
  TransportSubscription subscribe(String subject) throws EventTransportException;
}
