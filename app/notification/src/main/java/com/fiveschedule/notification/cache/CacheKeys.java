package com.fiveschedule.notification.cache;

/**
 * Cache key formats, namespaced by purpose. Schedule, lecture and AI reads are cached by their
 * owning services under {@code schedules:*}, {@code lectures:*} and {@code ai:*}; this service only
 * clears them.
 */
public final class CacheKeys {

  private CacheKeys() {}

  public static String notificationsPending(String userId) {
    return "notifications:pending:" + userId;
  }

  public static String taskStatus(String taskId) {
    return "task:status:" + taskId;
  }

  /** Patterns covering every cached read that a mutation by {@code userId} can make stale. */
  public static String[] userInvalidationPatterns(String userId) {
    return new String[] {
      "schedules:*:" + userId,
      "notifications:*:" + userId,
      "lectures:" + userId,
      "ai:*:" + userId + ":*"
    };
  }
}
