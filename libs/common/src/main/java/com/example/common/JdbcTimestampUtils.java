/*
 * Where: common utilities
 * What: converts between Instant and JDBC Timestamp in both directions
 * Why: the PostgreSQL driver cannot infer a SQL type for Instant, and nullable columns need null-safe mapping
 */
package com.example.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant is UTC; Timestamp.from keeps it UTC regardless of the database time zone
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
