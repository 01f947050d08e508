/*
 * Where: notification data access
 * What: inserts, claims, lists, checks and deletes rows of the notifications table
 * Why: the claim must be one atomic statement so concurrent pollers never share a row
 */
package com.fiveschedule.notification.repository;

import static com.fiveschedule.common.JdbcTimestampUtils.toInstant;
import static com.fiveschedule.common.JdbcTimestampUtils.toTimestamp;

import com.fiveschedule.notification.model.NotificationRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private static final String COLUMNS =
      "notification_id, user_id, schedule_id, message, notify_at, is_sent, is_checked, created_at, sent_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notifications (
          notification_id,
          user_id,
          schedule_id,
          message,
          notify_at,
          is_sent,
          is_checked,
          created_at,
          sent_at
        ) VALUES (
          :notificationId,
          :userId,
          :scheduleId,
          :message,
          :notifyAt,
          :isSent,
          :isChecked,
          :createdAt,
          :sentAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("userId", record.userId())
            .addValue("scheduleId", record.scheduleId())
            .addValue("message", record.message())
            .addValue("notifyAt", toTimestamp(record.notifyAt()))
            .addValue("isSent", record.sent())
            .addValue("isChecked", record.checked())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("sentAt", toTimestamp(record.sentAt()));
    jdbcTemplate.update(sql, params);
    return record.notificationId();
  }

  /**
   * Marks every due, unsent notification of one user as sent and returns the claimed rows.
   * Rows locked by a concurrent claim are skipped, so overlapping callers get disjoint sets.
   */
  public List<NotificationRecord> claimDueForUser(String userId, Instant now) {
    final String sql =
        """
        WITH due AS (
          SELECT notification_id
          FROM notifications
          WHERE user_id = :userId
            AND is_sent = FALSE
            AND notify_at <= :now
          ORDER BY notify_at
          FOR UPDATE SKIP LOCKED
        )
        UPDATE notifications n
        SET is_sent = TRUE,
            sent_at = :now
        FROM due
        WHERE n.notification_id = due.notification_id
          AND n.is_sent = FALSE
        RETURNING n.notification_id, n.user_id, n.schedule_id, n.message, n.notify_at,
                  n.is_sent, n.is_checked, n.created_at, n.sent_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Same claim as {@link #claimDueForUser} across all users, oldest first, at most {@code limit}. */
  public List<NotificationRecord> claimDue(int limit, Instant now) {
    final String sql =
        """
        WITH due AS (
          SELECT notification_id
          FROM notifications
          WHERE is_sent = FALSE
            AND notify_at <= :now
          ORDER BY notify_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE notifications n
        SET is_sent = TRUE,
            sent_at = :now
        FROM due
        WHERE n.notification_id = due.notification_id
          AND n.is_sent = FALSE
        RETURNING n.notification_id, n.user_id, n.schedule_id, n.message, n.notify_at,
                  n.is_sent, n.is_checked, n.created_at, n.sent_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<NotificationRecord> findByUserId(String userId, int limit, boolean includeChecked) {
    final String sql =
        "SELECT " + COLUMNS
            + """

            FROM notifications
            WHERE user_id = :userId
              AND (:includeChecked OR is_checked = FALSE)
            ORDER BY notify_at DESC
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("includeChecked", includeChecked)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markChecked(String userId, Collection<UUID> notificationIds) {
    if (notificationIds.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        UPDATE notifications
        SET is_checked = TRUE
        WHERE user_id = :userId
          AND notification_id IN (:ids)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("ids", notificationIds);
    return jdbcTemplate.update(sql, params);
  }

  public int deleteByIdAndUserId(UUID notificationId, String userId) {
    final String sql =
        """
        DELETE FROM notifications
        WHERE notification_id = :notificationId
          AND user_id = :userId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("userId", userId);
    return jdbcTemplate.update(sql, params);
  }

  public int deleteSentAndCheckedOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM notifications
        WHERE notify_at < :threshold
          AND is_sent = TRUE
          AND is_checked = TRUE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public int countUnsentOlderThan(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notifications
        WHERE notify_at < :threshold
          AND is_sent = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String scheduleId = rs.getString("schedule_id");
    return new NotificationRecord(
        UUID.fromString(rs.getString("notification_id")),
        rs.getString("user_id"),
        scheduleId == null ? null : UUID.fromString(scheduleId),
        rs.getString("message"),
        toInstant(rs.getTimestamp("notify_at")),
        rs.getBoolean("is_sent"),
        rs.getBoolean("is_checked"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("sent_at")));
  }
}
