package com.fiveschedule.notification.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "cache")
@Validated
public record CacheProperties(
    @NotNull Duration pendingNotificationsTtl,
    @NotNull Duration taskStatusTtl) {}
