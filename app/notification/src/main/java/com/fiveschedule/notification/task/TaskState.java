package com.fiveschedule.notification.task;

public enum TaskState {
  PENDING,
  PROCESSING,
  RETRYING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
