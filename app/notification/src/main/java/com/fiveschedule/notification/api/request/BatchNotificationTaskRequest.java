package com.fiveschedule.notification.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fiveschedule.notification.task.NotificationTasks;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BatchNotificationTaskRequest(@NotEmpty @Size(max = 100) List<@Valid Item> notifications) {

  public BatchNotificationTaskRequest {
    notifications = notifications == null ? null : List.copyOf(notifications);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Item(UUID scheduleId, @Size(max = 1000) String message, @NotNull Instant notifyAt) {}

  public List<NotificationTasks.BatchItem> toItems() {
    return notifications.stream()
        .map(item -> new NotificationTasks.BatchItem(item.scheduleId(), item.message(), item.notifyAt()))
        .toList();
  }
}
