/*
 * Where: infrastructure configuration
 * What: chooses the event transport; NATS by default, in-process loopback when nats.enabled=false
 * Why: the bus depends only on EventTransport, so deployments pick the broker by property
 */
package com.fiveschedule.notification.config;

import com.fiveschedule.notification.service.RealtimeMetrics;
import com.fiveschedule.notification.transport.EventTransport;
import com.fiveschedule.notification.transport.LocalEventTransport;
import com.fiveschedule.notification.transport.NatsConnectionProvider;
import com.fiveschedule.notification.transport.NatsEventTransport;
import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NatsConfig {

    private static final Duration PING_TIMEOUT = Duration.ofSeconds(1);
    private static final int SUBSCRIPTION_BUFFER_CAPACITY = 10_000;

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
    public NatsConnectionProvider natsConnectionProvider(NatsProperties properties, Clock clock) {
        // connects lazily; an unreachable broker at boot only degrades the bus
        return new NatsConnectionProvider(properties, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
    public EventTransport natsEventTransport(NatsConnectionProvider connectionProvider, RealtimeMetrics metrics) {
        return new NatsEventTransport(
                connectionProvider, PING_TIMEOUT, SUBSCRIPTION_BUFFER_CAPACITY, metrics::recordTransportOverflow);
    }

    @Bean
    @ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
    public EventTransport localEventTransport() {
        return new LocalEventTransport();
    }
}
