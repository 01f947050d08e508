/*
 * Where: SSE fan-out
 * What: one open stream of one user with its bounded delivery queue
 * Why: producers enqueue without blocking; the stream thread drains at the client's pace
 */
package com.fiveschedule.notification.sse;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public final class SseConnection {

  private final String connectionId = UUID.randomUUID().toString();
  private final String userId;
  private final BlockingQueue<ServerEvent> queue;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  SseConnection(String userId, int capacity) {
    this.userId = userId;
    this.queue = new LinkedBlockingQueue<>(capacity);
  }

  public String connectionId() {
    return connectionId;
  }

  public String userId() {
    return userId;
  }

  /** Returns false when the connection is closed or its queue is full. */
  boolean offer(ServerEvent event) {
    return !closed.get() && queue.offer(event);
  }

  public Optional<ServerEvent> poll(Duration timeout) throws InterruptedException {
    return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
  }

  public void close() {
    closed.set(true);
  }

  public boolean isClosed() {
    return closed.get();
  }

  public int queuedCount() {
    return queue.size();
  }

  @Override
  public String toString() {
    return "SseConnection[" + connectionId + ", userId=" + userId + "]";
  }
}
