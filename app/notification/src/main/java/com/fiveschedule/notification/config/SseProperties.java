/*
 * Where: configuration binding
 * What: SSE heartbeat cadence, disconnect polling slice and per-connection queue bound
 * Why: proxies drop idle streams, and an unbounded queue hides a stuck client
 */
package com.fiveschedule.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "sse")
@Validated
public record SseProperties(
    @NotNull Duration heartbeatInterval,
    @NotNull Duration pollSlice,
    @Positive int queueCapacity) {

  @AssertTrue(message = "sse.poll-slice must be positive and not longer than sse.heartbeat-interval")
  public boolean isPollSliceWithinHeartbeat() {
    if (heartbeatInterval == null || pollSlice == null) {
      return true;
    }
    return !pollSlice.isZero() && !pollSlice.isNegative() && pollSlice.compareTo(heartbeatInterval) <= 0;
  }
}
