package com.fiveschedule.notification.cache;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class UserCacheInvalidator {

  private static final Logger logger = LoggerFactory.getLogger(UserCacheInvalidator.class);

  private final CacheStore cacheStore;

  public long invalidateUserCache(String userId) {
    long deleted = 0;
    for (String pattern : CacheKeys.userInvalidationPatterns(userId)) {
      deleted += cacheStore.deletePattern(pattern);
    }
    logger.debug("user cache invalidated userId={} deleted={}", userId, deleted);
    return deleted;
  }

  public boolean invalidatePendingNotifications(String userId) {
    return cacheStore.delete(CacheKeys.notificationsPending(userId));
  }
}
