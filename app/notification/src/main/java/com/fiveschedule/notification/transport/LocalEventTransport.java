/*
 * Where: event bus transport
 * What: in-process loopback broker with NATS-style subject matching
 * Why: single-node runs and tests exercise the full bus without a broker
 */
package com.fiveschedule.notification.transport;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LocalEventTransport implements EventTransport {

  private static final Logger logger = LoggerFactory.getLogger(LocalEventTransport.class);

  private final List<LocalSubscription> subscriptions = new CopyOnWriteArrayList<>();
  private final AtomicBoolean available = new AtomicBoolean(true);

  @Override
  public boolean ping() {
    return available.get();
  }

  @Override
  public void publish(String subject, byte[] body) throws EventTransportException {
    ensureAvailable();
    for (LocalSubscription subscription : subscriptions) {
      if (SubjectMatcher.matches(subscription.subject, subject)) {
        subscription.queue.add(body.clone());
      }
    }
  }

  @Override
  public TransportSubscription subscribe(String subject) throws EventTransportException {
    ensureAvailable();
    LocalSubscription subscription = new LocalSubscription(subject);
    subscriptions.add(subscription);
    logger.debug("local transport subscribed subject={}", subject);
    return subscription;
  }

  /** Simulates broker loss and recovery. Open subscriptions fail on their next poll while down. */
  public void setAvailable(boolean value) {
    available.set(value);
  }

  public int subscriptionCount() {
    return subscriptions.size();
  }

  private void ensureAvailable() throws EventTransportException {
    if (!available.get()) {
      throw new EventTransportException("local transport unavailable");
    }
  }

  private final class LocalSubscription implements TransportSubscription {

    private final String subject;
    private final BlockingQueue<byte[]> queue = new LinkedBlockingQueue<>();

    private LocalSubscription(String subject) {
      this.subject = subject;
    }

    @Override
    public Optional<byte[]> poll(Duration timeout) throws EventTransportException, InterruptedException {
      ensureAvailable();
      return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public void close() {
      subscriptions.remove(this);
    }
  }
}
