/*
 * Where: event API
 * What: SSE stream, bus diagnostics and a test publish for the calling user
 */
package com.fiveschedule.notification.api;

import com.fiveschedule.notification.api.response.EventStatusResponse;
import com.fiveschedule.notification.api.response.TestEventResponse;
import com.fiveschedule.notification.config.RequestMdcInterceptor;
import com.fiveschedule.notification.event.EventBus;
import com.fiveschedule.notification.event.EventType;
import com.fiveschedule.notification.event.NotificationEvents;
import com.fiveschedule.notification.sse.SseConnectionManager;
import com.fiveschedule.notification.sse.SseStreamService;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventController {

  static final String TEST_MESSAGE = "This is a test notification";

  private final SseStreamService sseStreamService;
  private final SseConnectionManager connectionManager;
  private final EventBus eventBus;
  private final NotificationEvents notificationEvents;
  private final Clock clock;

  @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public ResponseEntity<SseEmitter> stream(
      @RequestHeader(RequestMdcInterceptor.USER_ID_HEADER) String userId) {
    return ResponseEntity.ok()
        .cacheControl(CacheControl.noCache())
        .header("Connection", "keep-alive")
        // nginx would otherwise buffer the stream
        .header("X-Accel-Buffering", "no")
        .contentType(MediaType.TEXT_EVENT_STREAM)
        .body(sseStreamService.open(userId));
  }

  @GetMapping("/status")
  public EventStatusResponse status() {
    final Map<String, Integer> handlers = new LinkedHashMap<>();
    eventBus.handlerCounts().forEach((type, count) -> handlers.put(type.wireName(), count));
    return new EventStatusResponse(
        new EventStatusResponse.EventBusStatus(eventBus.isAvailable(), eventBus.isListening(), handlers),
        new EventStatusResponse.SseManagerStatus(
            connectionManager.connectionCount(), connectionManager.userCount()));
  }

  @PostMapping("/test")
  public TestEventResponse test(@RequestHeader(RequestMdcInterceptor.USER_ID_HEADER) String userId) {
    final boolean published = notificationEvents.test(userId, TEST_MESSAGE, Instant.now(clock));
    return new TestEventResponse(published, EventType.NOTIFICATION_CREATED.wireName());
  }
}
