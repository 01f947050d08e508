package com.fiveschedule.notification.task;

import java.util.Map;

/** Body of a background task. The returned map is stored as the task result. */
@FunctionalInterface
public interface Task {
  Map<String, Object> run() throws Exception;
}
