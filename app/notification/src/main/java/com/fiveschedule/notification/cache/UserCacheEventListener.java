/*
 * Where: cache layer
 * What: clears a user's cached reads when a schedule or lecture of that user changes
 * Why: schedule and lecture CRUD live in other services and announce their mutations on the bus
 */
package com.fiveschedule.notification.cache;

import com.fiveschedule.notification.event.EventBinding;
import com.fiveschedule.notification.event.EventBus;
import com.fiveschedule.notification.event.EventPayload;
import com.fiveschedule.notification.event.EventType;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class UserCacheEventListener {

  private static final Logger logger = LoggerFactory.getLogger(UserCacheEventListener.class);

  static final List<EventType> MUTATION_TYPES =
      List.of(
          EventType.SCHEDULE_CREATED,
          EventType.SCHEDULE_UPDATED,
          EventType.SCHEDULE_DELETED,
          EventType.LECTURE_CREATED,
          EventType.LECTURE_UPDATED,
          EventType.LECTURE_DELETED);

  private final EventBus eventBus;
  private final UserCacheInvalidator cacheInvalidator;
  private final List<EventBinding> bindings;

  public UserCacheEventListener(EventBus eventBus, UserCacheInvalidator cacheInvalidator) {
    this.eventBus = eventBus;
    this.cacheInvalidator = cacheInvalidator;
    this.bindings = MUTATION_TYPES.stream().map(type -> new EventBinding(type, this::invalidate)).toList();
  }

  @PostConstruct
  public void register() {
    eventBus.subscribeAll(bindings);
  }

  @PreDestroy
  public void unregister() {
    bindings.forEach(eventBus::unsubscribe);
  }

  void invalidate(EventPayload payload) {
    final long deleted = cacheInvalidator.invalidateUserCache(payload.userId());
    logger.debug("user cache cleared type={} userId={} deleted={}", payload.eventType(), payload.userId(), deleted);
  }
}
