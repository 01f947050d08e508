/*
 * Where: schedule data access (read side)
 * What: looks up a user's schedules by id or by a fragment of the title
 * Why: notifications are attached to schedules and timed from their start
 */
package com.fiveschedule.notification.repository;

import static com.fiveschedule.common.JdbcTimestampUtils.toInstant;
import static com.fiveschedule.common.JdbcTimestampUtils.toTimestamp;

import com.fiveschedule.notification.model.ScheduleRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ScheduleRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<ScheduleRecord> findByIdAndUserId(UUID scheduleId, String userId) {
    final String sql =
        """
        SELECT schedule_id, user_id, title, start_at, end_at
        FROM schedules
        WHERE schedule_id = :scheduleId
          AND user_id = :userId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("scheduleId", scheduleId).addValue("userId", userId);
    final List<ScheduleRecord> rows = jdbcTemplate.query(sql, params, this::mapRow);
    return rows.stream().findFirst();
  }

  /** Case-insensitive substring match; the earliest upcoming schedule wins among several hits. */
  public Optional<ScheduleRecord> findFirstByTitleFragment(String userId, String titleFragment) {
    final String sql =
        """
        SELECT schedule_id, user_id, title, start_at, end_at
        FROM schedules
        WHERE user_id = :userId
          AND title ILIKE :pattern ESCAPE '\\'
        ORDER BY start_at NULLS LAST, title
        LIMIT 1
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("pattern", "%" + escapeLike(titleFragment) + "%");
    final List<ScheduleRecord> rows = jdbcTemplate.query(sql, params, this::mapRow);
    return rows.stream().findFirst();
  }

  public void insert(ScheduleRecord record) {
    final String sql =
        """
        INSERT INTO schedules (schedule_id, user_id, title, start_at, end_at)
        VALUES (:scheduleId, :userId, :title, :startAt, :endAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("scheduleId", record.scheduleId())
            .addValue("userId", record.userId())
            .addValue("title", record.title())
            .addValue("startAt", toTimestamp(record.startAt()))
            .addValue("endAt", toTimestamp(record.endAt()));
    jdbcTemplate.update(sql, params);
  }

  private static String escapeLike(String value) {
    return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  private ScheduleRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ScheduleRecord(
        UUID.fromString(rs.getString("schedule_id")),
        rs.getString("user_id"),
        rs.getString("title"),
        toInstant(rs.getTimestamp("start_at")),
        toInstant(rs.getTimestamp("end_at")));
  }
}
