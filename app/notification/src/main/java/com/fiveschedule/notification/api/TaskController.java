package com.fiveschedule.notification.api;

import com.fiveschedule.notification.api.request.BatchNotificationTaskRequest;
import com.fiveschedule.notification.api.request.ScheduleReminderTaskRequest;
import com.fiveschedule.notification.api.response.TaskAcceptedResponse;
import com.fiveschedule.notification.config.RequestMdcInterceptor;
import com.fiveschedule.notification.task.NotificationTasks;
import com.fiveschedule.notification.task.TaskState;
import com.fiveschedule.notification.task.TaskStatus;
import com.fiveschedule.notification.task.TaskStatusStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskController {

  private final NotificationTasks notificationTasks;
  private final TaskStatusStore taskStatusStore;

  @PostMapping("/notifications/reminder")
  public ResponseEntity<TaskAcceptedResponse> scheduleReminder(
      @RequestHeader(RequestMdcInterceptor.USER_ID_HEADER) String userId,
      @Valid @RequestBody ScheduleReminderTaskRequest request) {
    final String taskId =
        notificationTasks.submitScheduleReminder(userId, request.scheduleId(), request.minutesBefore());
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new TaskAcceptedResponse(taskId, TaskState.PENDING));
  }

  @PostMapping("/notifications/batch")
  public ResponseEntity<TaskAcceptedResponse> batchCreate(
      @RequestHeader(RequestMdcInterceptor.USER_ID_HEADER) String userId,
      @Valid @RequestBody BatchNotificationTaskRequest request) {
    final String taskId = notificationTasks.submitBatchCreate(userId, request.toItems());
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new TaskAcceptedResponse(taskId, TaskState.PENDING));
  }

  @GetMapping("/{taskId}")
  public TaskStatus status(
      @RequestHeader(RequestMdcInterceptor.USER_ID_HEADER) String userId,
      @PathVariable("taskId") String taskId) {
    // another user's task reads as unknown
    return taskStatusStore
        .find(taskId)
        .filter(status -> status.isOwnedBy(userId))
        .orElseThrow(() -> new TaskNotFoundException(taskId));
  }
}
