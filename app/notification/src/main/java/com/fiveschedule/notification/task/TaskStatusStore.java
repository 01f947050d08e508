package com.fiveschedule.notification.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fiveschedule.notification.cache.CacheKeys;
import com.fiveschedule.notification.cache.CacheStore;
import com.fiveschedule.notification.config.CacheProperties;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Task status kept in the cache with the task-status TTL; lost statuses read as unknown. */
@Component
@RequiredArgsConstructor
public class TaskStatusStore {

  private static final Logger logger = LoggerFactory.getLogger(TaskStatusStore.class);

  private final CacheStore cacheStore;
  private final CacheProperties cacheProperties;
  private final ObjectMapper objectMapper;

  public boolean save(TaskStatus status) {
    try {
      final String json = objectMapper.writeValueAsString(status);
      return cacheStore.set(CacheKeys.taskStatus(status.taskId()), json, cacheProperties.taskStatusTtl());
    } catch (JsonProcessingException ex) {
      logger.warn("task status not serializable taskId={} reason={}", status.taskId(), ex.getMessage());
      return false;
    }
  }

  public Optional<TaskStatus> find(String taskId) {
    final Optional<String> json = cacheStore.get(CacheKeys.taskStatus(taskId));
    if (json.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(json.get(), TaskStatus.class));
    } catch (JsonProcessingException ex) {
      logger.warn("task status unreadable taskId={} reason={}", taskId, ex.getMessage());
      return Optional.empty();
    }
  }
}
