/*
 * Where: configuration binding
 * What: NATS connection settings
 * Why: switch broker endpoints per environment, or turn NATS off for single-node runs
 */
package com.fiveschedule.notification.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nats")
public record NatsProperties(
    boolean enabled, String url, Integer connectionTimeout, Duration reconnectWait) {}
