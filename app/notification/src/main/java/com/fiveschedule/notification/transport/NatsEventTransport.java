/*
 * Where: NATS transport
 * What: core NATS publish and dispatcher-backed subscriptions
 * Why: fire-and-forget pub/sub across service instances
 */
package com.fiveschedule.notification.transport;

import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class NatsEventTransport implements EventTransport {

    private static final Logger logger = LoggerFactory.getLogger(NatsEventTransport.class);

    private final NatsConnectionProvider connectionProvider;
    private final Duration pingTimeout;
    private final int bufferCapacity;
    private final Runnable overflowListener;

    public NatsEventTransport(NatsConnectionProvider connectionProvider, Duration pingTimeout,
            int bufferCapacity, Runnable overflowListener) {
        this.connectionProvider = connectionProvider;
        this.pingTimeout = pingTimeout;
        this.bufferCapacity = bufferCapacity;
        this.overflowListener = overflowListener;
    }

    @Override
    public boolean ping() {
        try {
            // flush waits for the server PONG, which is the cheapest real round trip
            connectionProvider.get().flush(pingTimeout);
            return true;
        } catch (EventTransportException | TimeoutException | IllegalStateException ex) {
            logger.debug("nats ping failed reason={}", ex.getMessage());
            return false;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void publish(String subject, byte[] body) throws EventTransportException {
        Connection connection = connectionProvider.get();
        Connection.Status status = connection.getStatus();
        // while reconnecting jnats buffers publishes silently; report them as failed instead
        if (status != Connection.Status.CONNECTED) {
            throw new EventTransportException("nats not connected status=" + status + " subject=" + subject);
        }
        try {
            connection.publish(subject, body);
        } catch (IllegalStateException | IllegalArgumentException ex) {
            throw new EventTransportException("nats publish failed subject=" + subject, ex);
        }
    }

    @Override
    public TransportSubscription subscribe(String subject) throws EventTransportException {
        Connection connection = connectionProvider.get();
        BlockingQueue<byte[]> buffer = new LinkedBlockingQueue<>(bufferCapacity);
        try {
            Dispatcher dispatcher = connection.createDispatcher(message -> {
                if (!buffer.offer(message.getData())) {
                    overflowListener.run();
                    logger.warn("nats buffer full, message dropped subject={} capacity={}",
                            message.getSubject(), bufferCapacity);
                }
            });
            dispatcher.subscribe(subject);
            logger.info("nats subscription opened subject={}", subject);
            return new NatsSubscription(connection, dispatcher, buffer, subject);
        } catch (IllegalStateException | IllegalArgumentException ex) {
            throw new EventTransportException("nats subscribe failed subject=" + subject, ex);
        }
    }

    private static final class NatsSubscription implements TransportSubscription {

        private final Connection connection;
        private final Dispatcher dispatcher;
        private final BlockingQueue<byte[]> buffer;
        private final String subject;

        private NatsSubscription(Connection connection, Dispatcher dispatcher, BlockingQueue<byte[]> buffer,
                String subject) {
            this.connection = connection;
            this.dispatcher = dispatcher;
            this.buffer = buffer;
            this.subject = subject;
        }

        @Override
        public Optional<byte[]> poll(Duration timeout) throws EventTransportException, InterruptedException {
            byte[] body = buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (body != null) {
                return Optional.of(body);
            }
            // DISCONNECTED/RECONNECTING recover inside the client; CLOSED never does
            if (connection.getStatus() == Connection.Status.CLOSED) {
                throw new EventTransportException("nats connection closed subject=" + subject);
            }
            return Optional.empty();
        }

        @Override
        public void close() {
            try {
                connection.closeDispatcher(dispatcher);
            } catch (IllegalStateException ex) {
                logger.debug("nats dispatcher already closed subject={}", subject);
            }
        }
    }
}
