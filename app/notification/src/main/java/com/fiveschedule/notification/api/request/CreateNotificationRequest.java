package com.fiveschedule.notification.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fiveschedule.notification.service.CreateNotificationCommand;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateNotificationRequest(
    UUID scheduleId,
    @Size(max = 255) String scheduleTitle,
    @NotBlank @Size(max = 1000) String message,
    Instant notifyAt,
    @PositiveOrZero Integer minutesBefore) {

  public CreateNotificationCommand toCommand() {
    return new CreateNotificationCommand(scheduleId, scheduleTitle, message, notifyAt, minutesBefore);
  }
}
