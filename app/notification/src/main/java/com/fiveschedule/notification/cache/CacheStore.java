/*
 * Where: cache layer
 * What: best-effort key-value store with TTL
 * Why: callers treat the cache as an accelerator and never as a source of truth
 */
package com.fiveschedule.notification.cache;

import java.time.Duration;
import java.util.Optional;

public interface CacheStore {

  /** Returns the cached value, or empty on a miss or when the store is unreachable. */
  Optional<String> get(String key);

  /** Returns false when the value could not be stored. */
  boolean set(String key, String value, Duration ttl);

  /** Stores the value only when the key is absent; returns false when it exists or on failure. */
  boolean setIfAbsent(String key, String value, Duration ttl);

  /** Returns true only when a key was actually removed. */
  boolean delete(String key);

  /**
   * Deletes every key matching a glob ({@code *} wildcard).
   *
   * @return number of deleted keys; 0 when the store is unreachable
   */
  long deletePattern(String pattern);

  boolean isAvailable();
}
