/*
 * Where: configuration binding
 * What: event bus subject naming and listener timing
 * Why: the poll timeout bounds how quickly the listener observes a stop request
 */
package com.fiveschedule.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "event-bus")
@Validated
public record EventBusProperties(
    @NotBlank String subjectPrefix,
    @NotNull Duration pollTimeout,
    @NotNull Duration reconnectDelay,
    boolean listenerEnabled) {

  private static final Duration MAX_POLL_TIMEOUT = Duration.ofSeconds(1);

  @AssertTrue(message = "event-bus.poll-timeout must be positive and at most 1s")
  public boolean isPollTimeoutBounded() {
    return isPositiveDuration(pollTimeout) && pollTimeout.compareTo(MAX_POLL_TIMEOUT) <= 0;
  }

  @AssertTrue(message = "event-bus.reconnect-delay must be positive")
  public boolean isReconnectDelayPositive() {
    return isPositiveDuration(reconnectDelay);
  }

  private boolean isPositiveDuration(Duration duration) {
    // null is reported by @NotNull
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
