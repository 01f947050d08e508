/*
 * Where: event bus
 * What: publishes domain events to the transport and dispatches received ones to local handlers
 * Why: producers stay decoupled from SSE delivery and any other consumer
 *
 * Delivery is best-effort. A publish while the broker is down returns false, and an event that
 * arrives for a user with no open stream is dropped. Clients recover through the pending and
 * unchecked notification queries, which read the database directly.
 */
package com.fiveschedule.notification.event;

import com.fiveschedule.notification.config.EventBusProperties;
import com.fiveschedule.notification.service.RealtimeMetrics;
import com.fiveschedule.notification.transport.EventTransport;
import com.fiveschedule.notification.transport.EventTransportException;
import com.fiveschedule.notification.transport.TransportSubscription;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class EventBus {

    private static final Logger logger = LoggerFactory.getLogger(EventBus.class);
    private static final String USER_SUBJECT_TOKEN = "user";

    private final EventTransport transport;
    private final EventPayloadCodec codec;
    private final EventBusProperties properties;
    private final RealtimeMetrics metrics;
    private final Clock clock;
    private final ConcurrentMap<EventType, CopyOnWriteArrayList<EventHandler>> handlers =
            new ConcurrentHashMap<>();
    private final ThreadFactory listenerThreadFactory = new ThreadFactoryBuilder()
            .setNameFormat("event-bus-listener-%d")
            .setDaemon(true)
            .build();
    private final Object lifecycleLock = new Object();
    private ListenerLoop listener;

    public EventBus(EventTransport transport,
            EventPayloadCodec codec,
            EventBusProperties properties,
            RealtimeMetrics metrics,
            Clock clock) {
        this.transport = transport;
        this.codec = codec;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    @PostConstruct
    void autoStart() {
        if (properties.listenerEnabled()) {
            startListening();
        }
    }

    @PreDestroy
    void shutdown() {
        stopListening();
    }

    /**
     * Broadcasts to the global subject of {@code eventType} and to the user's own subject.
     *
     * @return false when the event could not be handed to the transport; never throws
     */
    public boolean publish(EventType eventType, String userId, Map<String, Object> data) {
        byte[] body;
        try {
            body = codec.encode(new EventPayload(eventType, userId, data, Instant.now(clock)));
        } catch (MalformedEventException | RuntimeException ex) {
            logger.warn("event publish rejected type={} userId={} reason={}",
                    eventType, userId, ex.getMessage());
            metrics.recordPublish("rejected");
            return false;
        }
        try {
            transport.publish(globalSubject(eventType), body);
            transport.publish(userSubject(userId), body);
            metrics.recordPublish("success");
            return true;
        } catch (EventTransportException ex) {
            logger.warn("event publish failed type={} userId={} reason={}",
                    eventType, userId, ex.getMessage());
            metrics.recordPublish("unavailable");
            return false;
        }
    }

    /** Registers a handler. The same handler instance may be registered for several types. */
    public EventBinding subscribe(EventType eventType, EventHandler handler) {
        EventBinding binding = new EventBinding(eventType, handler);
        handlers.computeIfAbsent(eventType, ignored -> new CopyOnWriteArrayList<>()).add(handler);
        logger.debug("event handler subscribed type={} handler={}", eventType, handler);
        return binding;
    }

    public void subscribeAll(List<EventBinding> bindings) {
        for (EventBinding binding : bindings) {
            subscribe(binding.eventType(), binding.handler());
        }
    }

    /**
     * Removes one registration of {@code handler}.
     *
     * @return false when the handler was not registered for that type; nothing is changed then
     */
    public boolean unsubscribe(EventType eventType, EventHandler handler) {
        List<EventHandler> registered = handlers.get(eventType);
        return registered != null && registered.remove(handler);
    }

    public boolean unsubscribe(EventBinding binding) {
        return unsubscribe(binding.eventType(), binding.handler());
    }

    public boolean isAvailable() {
        return transport.ping();
    }

    public void startListening() {
        synchronized (lifecycleLock) {
            if (listener != null) {
                return;
            }
            listener = new ListenerLoop(listenerSubject());
            Thread thread = listenerThreadFactory.newThread(listener);
            listener.thread = thread;
            thread.start();
            logger.info("event bus listener started subject={}", listener.subject);
        }
    }

    public void stopListening() {
        ListenerLoop stopping;
        synchronized (lifecycleLock) {
            stopping = listener;
            listener = null;
        }
        if (stopping == null) {
            return;
        }
        stopping.stopSignal.countDown();
        Duration grace = properties.pollTimeout().multipliedBy(2).plusSeconds(1);
        try {
            stopping.thread.join(grace.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        if (stopping.thread.isAlive()) {
            logger.warn("event bus listener did not stop within {}", grace);
        } else {
            logger.info("event bus listener stopped");
        }
    }

    public boolean isListening() {
        synchronized (lifecycleLock) {
            return listener != null;
        }
    }

    public Map<EventType, Integer> handlerCounts() {
        Map<EventType, Integer> counts = new EnumMap<>(EventType.class);
        handlers.forEach((type, list) -> {
            if (!list.isEmpty()) {
                counts.put(type, list.size());
            }
        });
        return counts;
    }

    @VisibleForTesting
    void dispatch(byte[] body) {
        EventPayload payload;
        try {
            payload = codec.decode(body);
        } catch (MalformedEventException ex) {
            logger.warn("dropping malformed event message reason={}", ex.getMessage());
            metrics.recordMalformed();
            return;
        }
        metrics.recordReceived(payload.eventType());
        List<EventHandler> registered = handlers.get(payload.eventType());
        if (registered == null) {
            return;
        }
        // inline on the single listener thread, which keeps publish order per user
        for (EventHandler handler : registered) {
            try {
                handler.handle(payload);
            } catch (RuntimeException ex) {
                logger.warn("event handler failed type={} userId={} handler={}",
                        payload.eventType(), payload.userId(), handler, ex);
                metrics.recordHandlerFailure(payload.eventType());
            }
        }
    }

    @VisibleForTesting
    String globalSubject(EventType eventType) {
        return properties.subjectPrefix() + "." + eventType.wireName();
    }

    @VisibleForTesting
    String userSubject(String userId) {
        return properties.subjectPrefix() + "." + USER_SUBJECT_TOKEN + "." + sanitizeToken(userId);
    }

    private String listenerSubject() {
        // one token after the prefix: every event type, never the per-user subjects
        return properties.subjectPrefix() + ".*";
    }

    private static String sanitizeToken(String token) {
        return token.replaceAll("[.*>\\s]", "_");
    }

    private final class ListenerLoop implements Runnable {

        private final String subject;
        private final CountDownLatch stopSignal = new CountDownLatch(1);
        private Thread thread;

        private ListenerLoop(String subject) {
            this.subject = subject;
        }

        private boolean stopped() {
            return stopSignal.getCount() == 0;
        }

        @Override
        public void run() {
            while (!stopped()) {
                try (TransportSubscription subscription = transport.subscribe(subject)) {
                    while (!stopped()) {
                        Optional<byte[]> body = subscription.poll(properties.pollTimeout());
                        body.ifPresent(EventBus.this::dispatch);
                    }
                } catch (EventTransportException ex) {
                    logger.warn("event bus listener lost transport subject={} retryIn={} reason={}",
                            subject, properties.reconnectDelay(), ex.getMessage());
                    if (awaitStop(properties.reconnectDelay())) {
                        return;
                    }
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return;
                } catch (RuntimeException ex) {
                    // keep the loop alive; a broken subscription is reopened after the delay
                    logger.error("event bus listener failed unexpectedly subject={}", subject, ex);
                    if (awaitStop(properties.reconnectDelay())) {
                        return;
                    }
                }
            }
        }

        private boolean awaitStop(Duration delay) {
            try {
                return stopSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return true;
            }
        }
    }
}
