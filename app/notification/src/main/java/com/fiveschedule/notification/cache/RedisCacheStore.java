/*
 * Where: cache layer
 * What: CacheStore on Redis strings with SCAN-based pattern deletion
 * Why: Redis outages must show up as misses, never as request failures
 */
package com.fiveschedule.notification.cache;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RedisCacheStore implements CacheStore {

  private static final Logger logger = LoggerFactory.getLogger(RedisCacheStore.class);
  private static final long SCAN_BATCH = 500;
  private static final String PONG = "PONG";

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate is a shared Spring-managed component and cannot be copied")
  private final StringRedisTemplate redisTemplate;

  public RedisCacheStore(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
  }

  @Override
  public Optional<String> get(String key) {
    try {
      return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    } catch (DataAccessException ex) {
      logger.warn("cache get failed key={} reason={}", key, ex.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public boolean set(String key, String value, Duration ttl) {
    try {
      redisTemplate.opsForValue().set(key, value, ttl);
      return true;
    } catch (DataAccessException ex) {
      logger.warn("cache set failed key={} reason={}", key, ex.getMessage());
      return false;
    }
  }

  @Override
  public boolean setIfAbsent(String key, String value, Duration ttl) {
    try {
      return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, value, ttl));
    } catch (DataAccessException ex) {
      logger.warn("cache set-if-absent failed key={} reason={}", key, ex.getMessage());
      return false;
    }
  }

  @Override
  public boolean delete(String key) {
    try {
      return Boolean.TRUE.equals(redisTemplate.delete(key));
    } catch (DataAccessException ex) {
      logger.warn("cache delete failed key={} reason={}", key, ex.getMessage());
      return false;
    }
  }

  @Override
  public long deletePattern(String pattern) {
    // SCAN instead of KEYS so a large keyspace does not block the server
    ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH).build();
    List<String> keys = new ArrayList<>();
    try (Cursor<String> cursor = redisTemplate.scan(options)) {
      cursor.forEachRemaining(keys::add);
      if (keys.isEmpty()) {
        return 0;
      }
      Long deleted = redisTemplate.delete(keys);
      return deleted == null ? 0 : deleted;
    } catch (DataAccessException ex) {
      logger.warn("cache delete pattern failed pattern={} reason={}", pattern, ex.getMessage());
      return 0;
    }
  }

  @Override
  public boolean isAvailable() {
    try {
      String reply = redisTemplate.execute(connection -> connection.ping(), true);
      return PONG.equalsIgnoreCase(reply);
    } catch (DataAccessException ex) {
      logger.debug("cache ping failed reason={}", ex.getMessage());
      return false;
    }
  }
}
