package com.fiveschedule.notification.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fiveschedule.notification.model.NotificationRecord;
import com.fiveschedule.notification.service.CreateNotificationCommand;
import com.fiveschedule.notification.service.NotificationReconciler;
import com.fiveschedule.notification.service.NotificationService;
import com.fiveschedule.notification.service.PendingNotifications;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(NotificationController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class NotificationControllerTest {

  private static final Instant NOTIFY_AT = Instant.parse("2026-04-01T09:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private NotificationService notificationService;
  @MockitoBean private NotificationReconciler notificationReconciler;

  @Test
  void createReturns201WithSnakeCaseBody() throws Exception {
    final NotificationRecord record =
        NotificationRecord.newPending("user-1", null, "Submit report", NOTIFY_AT, NOTIFY_AT);
    when(notificationService.create(eq("user-1"), any(CreateNotificationCommand.class))).thenReturn(record);

    mockMvc
        .perform(
            post("/api/notifications")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"message":"Submit report","notify_at":"2026-04-01T09:00:00Z"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.notification_id").value(record.notificationId().toString()))
        .andExpect(jsonPath("$.message").value("Submit report"))
        .andExpect(jsonPath("$.notify_at").value("2026-04-01T09:00:00Z"))
        .andExpect(jsonPath("$.is_sent").value(false));
  }

  @Test
  void createReturns400WhenMessageMissing() throws Exception {
    mockMvc
        .perform(
            post("/api/notifications")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"notify_at\":\"2026-04-01T09:00:00Z\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_VALIDATION_ERROR"));
  }

  @Test
  void createReturns404WhenScheduleUnknown() throws Exception {
    when(notificationService.create(eq("user-1"), any(CreateNotificationCommand.class)))
        .thenThrow(new ScheduleNotFoundException("exam"));

    mockMvc
        .perform(
            post("/api/notifications")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"message\":\"m\",\"schedule_title\":\"exam\",\"minutes_before\":10}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("SCHEDULE_NOT_FOUND"));
  }

  @Test
  void pendingReturnsStoredBodyVerbatimWithCacheHeader() throws Exception {
    final String body = "[{\"notification_id\":\"n-1\",\"message\":\"cached\"}]";
    when(notificationReconciler.getPending("user-1"))
        .thenReturn(new PendingNotifications(List.of(), body, true));

    mockMvc
        .perform(get("/api/notifications/pending").header("X-User-Id", "user-1"))
        .andExpect(status().isOk())
        .andExpect(header().string("X-Cache", "HIT"))
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(content().string(body));
  }

  @Test
  void pendingWithoutUserHeaderIsRejected() throws Exception {
    mockMvc
        .perform(get("/api/notifications/pending"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_USER_REQUIRED"));
  }

  @Test
  void pendingReturns503WhenDatabaseIsDown() throws Exception {
    when(notificationReconciler.getPending("user-1"))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    mockMvc
        .perform(get("/api/notifications/pending").header("X-User-Id", "user-1"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("SERVICE_DEGRADED"));
  }

  @Test
  void listPassesLimitAndIncludeChecked() throws Exception {
    when(notificationService.list("user-1", 5, true))
        .thenReturn(
            List.of(NotificationRecord.newPending("user-1", null, "a", NOTIFY_AT, NOTIFY_AT)));

    mockMvc
        .perform(
            get("/api/notifications")
                .header("X-User-Id", "user-1")
                .param("limit", "5")
                .param("include_checked", "true"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].message").value("a"));
  }

  @Test
  void checkReturnsUpdatedCount() throws Exception {
    final UUID id = UUID.randomUUID();
    when(notificationService.check(eq("user-1"), anyCollection())).thenReturn(1);

    mockMvc
        .perform(
            post("/api/notifications/check")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"notification_ids\":[\"" + id + "\"]}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.updated_count").value(1));
    verify(notificationService).check("user-1", List.of(id));
  }

  @Test
  void deleteReturns204AndMissingReturns404() throws Exception {
    final UUID existing = UUID.randomUUID();
    final UUID missing = UUID.randomUUID();
    doThrow(new NotificationNotFoundException(missing)).when(notificationService).delete("user-1", missing);

    mockMvc
        .perform(delete("/api/notifications/" + existing).header("X-User-Id", "user-1"))
        .andExpect(status().isNoContent());
    mockMvc
        .perform(delete("/api/notifications/" + missing).header("X-User-Id", "user-1"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_NOT_FOUND"));
  }

  @Test
  void malformedIdReturns400() throws Exception {
    mockMvc
        .perform(delete("/api/notifications/not-a-uuid").header("X-User-Id", "user-1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("NOTIFICATION_VALIDATION_ERROR"));
  }
}
