/*
 * Where: shared utility
 * What: converts Instant values to java.sql.Timestamp for JDBC binding
 * Why: the PostgreSQL driver cannot infer a SQL type for a bare Instant parameter
 */
package com.fiveschedule.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instants are UTC; the application never binds zone-local values.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
