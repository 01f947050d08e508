/*
 * Where: notification API
 * What: create, poll, list, check and delete for the calling user's notifications
 * Why: the poll and list endpoints are how clients catch up on anything the stream missed
 */
package com.fiveschedule.notification.api;

import com.fiveschedule.notification.api.request.CheckNotificationsRequest;
import com.fiveschedule.notification.api.request.CreateNotificationRequest;
import com.fiveschedule.notification.api.response.CheckNotificationsResponse;
import com.fiveschedule.notification.config.RequestMdcInterceptor;
import com.fiveschedule.notification.model.NotificationView;
import com.fiveschedule.notification.service.NotificationReconciler;
import com.fiveschedule.notification.service.NotificationService;
import com.fiveschedule.notification.service.PendingNotifications;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

  private final NotificationService notificationService;
  private final NotificationReconciler notificationReconciler;

  @PostMapping
  public ResponseEntity<NotificationView> create(
      @RequestHeader(RequestMdcInterceptor.USER_ID_HEADER) String userId,
      @Valid @RequestBody CreateNotificationRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(NotificationView.from(notificationService.create(userId, request.toCommand())));
  }

  /** Body is written verbatim so a cached snapshot is replayed byte for byte. */
  @GetMapping(value = "/pending", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<String> pending(
      @RequestHeader(RequestMdcInterceptor.USER_ID_HEADER) String userId) {
    final PendingNotifications pending = notificationReconciler.getPending(userId);
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_JSON)
        .header("X-Cache", pending.fromCache() ? "HIT" : "MISS")
        .body(pending.json());
  }

  @GetMapping
  public List<NotificationView> list(
      @RequestHeader(RequestMdcInterceptor.USER_ID_HEADER) String userId,
      @RequestParam(name = "limit", required = false) Integer limit,
      @RequestParam(name = "include_checked", defaultValue = "false") boolean includeChecked) {
    return notificationService.list(userId, limit, includeChecked).stream()
        .map(NotificationView::from)
        .toList();
  }

  @PostMapping("/check")
  public CheckNotificationsResponse check(
      @RequestHeader(RequestMdcInterceptor.USER_ID_HEADER) String userId,
      @Valid @RequestBody CheckNotificationsRequest request) {
    return new CheckNotificationsResponse(notificationService.check(userId, request.notificationIds()));
  }

  @DeleteMapping("/{notificationId}")
  public ResponseEntity<Void> delete(
      @RequestHeader(RequestMdcInterceptor.USER_ID_HEADER) String userId,
      @PathVariable("notificationId") UUID notificationId) {
    notificationService.delete(userId, notificationId);
    return ResponseEntity.noContent().build();
  }
}
