package com.fiveschedule.notification.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fiveschedule.notification.task.TaskState;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TaskAcceptedResponse(String taskId, TaskState status) {}
