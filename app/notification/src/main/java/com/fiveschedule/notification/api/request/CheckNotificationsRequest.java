package com.fiveschedule.notification.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CheckNotificationsRequest(@NotNull @Size(max = 500) List<UUID> notificationIds) {

  public CheckNotificationsRequest {
    notificationIds = notificationIds == null ? null : List.copyOf(notificationIds);
  }
}
