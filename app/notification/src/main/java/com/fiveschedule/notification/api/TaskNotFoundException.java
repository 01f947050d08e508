package com.fiveschedule.notification.api;

public class TaskNotFoundException extends RuntimeException {
  public TaskNotFoundException(String taskId) {
    super("task not found: " + taskId);
  }
}
