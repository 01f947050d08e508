/*
 * Where: background tasks
 * What: status snapshot of one submitted task as stored in the cache
 * Why: clients poll it after a 202 instead of holding a request open
 */
package com.fiveschedule.notification.task;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TaskStatus(
    String taskId,
    String userId,
    String taskName,
    String queue,
    TaskState status,
    int attempt,
    Map<String, Object> result,
    String error,
    Instant updatedAt) {

  public TaskStatus {
    result = result == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(result));
  }

  public boolean isOwnedBy(String requester) {
    return userId != null && userId.equals(requester);
  }

  TaskStatus next(TaskState state, int nextAttempt, Map<String, Object> nextResult, String nextError, Instant now) {
    return new TaskStatus(taskId, userId, taskName, queue, state, nextAttempt, nextResult, nextError, now);
  }
}
