/*
 * Where: shared utilities
 * What: converts Instant values to and from JDBC Timestamp explicitly
 * Why: the PostgreSQL driver cannot always infer the SQL type of an Instant parameter
 */
package dev.mailroom.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant is UTC; Timestamp.from keeps it UTC regardless of the session time zone.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
