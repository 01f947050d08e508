/*
 * Where: configuration binding
 * What: background reconciliation schedule and batch size
 * Why: the pass is optional; polling clients already claim their own due notifications
 */
package com.fiveschedule.notification.config;

import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.reconcile")
@Validated
public record NotificationReconcileProperties(
    boolean enabled, Duration pollInterval, @Positive int batchSize) {}
