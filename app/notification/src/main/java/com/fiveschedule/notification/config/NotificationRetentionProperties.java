/*
 * Where: configuration binding
 * What: retention cleanup settings
 * Why: keep the retention window and schedule tunable per environment
 */
package com.fiveschedule.notification.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.retention")
public record NotificationRetentionProperties(
                boolean enabled,
                int retentionDays,
                Duration cleanupInterval) {
}
