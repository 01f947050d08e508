/*
 * Where: configuration binding
 * What: background task worker count and retry backoff
 * Why: retry pressure on the database is tuned per environment
 */
package com.fiveschedule.notification.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "tasks")
@Validated
public record TaskProperties(
    @Positive int workers,
    @Positive int maxAttempts,
    @NotNull Duration backoffBase,
    @NotNull Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    @NotNull Duration backoffMin) {}
