package com.fiveschedule.notification.task;

/** Queues of the task runner; lower rank is taken first. */
public enum TaskPriority {
  HIGH("high_priority", 0),
  DEFAULT("default", 1),
  LOW("low_priority", 2);

  private final String queueName;
  private final int rank;

  TaskPriority(String queueName, int rank) {
    this.queueName = queueName;
    this.rank = rank;
  }

  public String queueName() {
    return queueName;
  }

  int rank() {
    return rank;
  }
}
