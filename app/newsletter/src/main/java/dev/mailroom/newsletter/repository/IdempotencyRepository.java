/*
 * Where: newsletter data access
 * What: claim, complete, replay and release rows of the idempotency table
 * Why: the table's primary key is the only serialization point between concurrent retries
 */
package dev.mailroom.newsletter.repository;

import static dev.mailroom.common.JdbcTimestampUtils.toInstant;
import static dev.mailroom.common.JdbcTimestampUtils.toTimestamp;

import dev.mailroom.newsletter.model.IdempotencyRecord;
import dev.mailroom.newsletter.model.StoredResponse;
import java.sql.Array;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.support.AbstractSqlTypeValue;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class IdempotencyRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT owner_id, idempotency_key, response_status_code,
             response_header_names, response_header_values, response_body,
             claim_id, created_at, completed_at
      FROM idempotency
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Inserts an empty placeholder for (owner, key).
   *
   * @return {@code true} when this call created the row, {@code false} when a row already existed
   */
  public boolean insertPlaceholder(
      UUID ownerId, String idempotencyKey, UUID claimId, Instant claimedAt) {
    // A single conditional insert: the unique primary key decides the winner, never a prior read.
    final String sql =
        """
        INSERT INTO idempotency (
          owner_id,
          idempotency_key,
          claim_id,
          created_at
        ) VALUES (
          :ownerId,
          :idempotencyKey,
          :claimId,
          :claimedAt
        )
        ON CONFLICT (owner_id, idempotency_key) DO NOTHING
        """;
    final MapSqlParameterSource params =
        keyParams(ownerId, idempotencyKey)
            .addValue("claimId", claimId)
            .addValue("claimedAt", toTimestamp(claimedAt));
    return jdbcTemplate.update(sql, params) == 1;
  }

  public Optional<IdempotencyRecord> find(UUID ownerId, String idempotencyKey) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE owner_id = :ownerId
              AND idempotency_key = :idempotencyKey
            """;
    return jdbcTemplate.query(sql, keyParams(ownerId, idempotencyKey), this::mapRow).stream()
        .findFirst();
  }

  /**
   * Turns the placeholder held by {@code claimId} into a complete row.
   *
   * @return 1 on success, 0 when the row is gone, already complete or held by another claim
   */
  public int complete(
      UUID ownerId,
      String idempotencyKey,
      UUID claimId,
      StoredResponse response,
      Instant completedAt) {
    final String sql =
        """
        UPDATE idempotency
        SET response_status_code   = :statusCode,
            response_header_names  = :headerNames,
            response_header_values = :headerValues,
            response_body          = :body,
            completed_at           = :completedAt
        WHERE owner_id = :ownerId
          AND idempotency_key = :idempotencyKey
          AND response_status_code IS NULL
          AND claim_id = :claimId
        """;
    final MapSqlParameterSource params =
        keyParams(ownerId, idempotencyKey)
            .addValue("claimId", claimId)
            .addValue("statusCode", response.statusCode())
            .addValue("headerNames", sqlArray("text", response.headerNames()), Types.ARRAY)
            .addValue("headerValues", sqlArray("bytea", response.headerValues()), Types.ARRAY)
            .addValue("body", response.body())
            .addValue("completedAt", toTimestamp(completedAt));
    return jdbcTemplate.update(sql, params);
  }

  /** Removes the placeholder only while it is still incomplete and still held by {@code claimId}. */
  public int releaseClaim(UUID ownerId, String idempotencyKey, UUID claimId) {
    final String sql =
        """
        DELETE FROM idempotency
        WHERE owner_id = :ownerId
          AND idempotency_key = :idempotencyKey
          AND response_status_code IS NULL
          AND claim_id = :claimId
        """;
    return jdbcTemplate.update(sql, keyParams(ownerId, idempotencyKey).addValue("claimId", claimId));
  }

  /** Removes an incomplete placeholder whoever holds it. Complete rows are never touched. */
  public int forceRelease(UUID ownerId, String idempotencyKey) {
    final String sql =
        """
        DELETE FROM idempotency
        WHERE owner_id = :ownerId
          AND idempotency_key = :idempotencyKey
          AND response_status_code IS NULL
        """;
    return jdbcTemplate.update(sql, keyParams(ownerId, idempotencyKey));
  }

  public int deleteIncompleteClaimedBefore(Instant threshold) {
    final String sql =
        """
        DELETE FROM idempotency
        WHERE response_status_code IS NULL
          AND created_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public List<IdempotencyRecord> findIncompleteClaimedBefore(Instant threshold, int limit) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE response_status_code IS NULL
              AND created_at < :threshold
            ORDER BY created_at
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("threshold", toTimestamp(threshold))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private MapSqlParameterSource keyParams(UUID ownerId, String idempotencyKey) {
    return new MapSqlParameterSource()
        .addValue("ownerId", ownerId)
        .addValue("idempotencyKey", idempotencyKey);
  }

  private IdempotencyRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final Object statusCode = rs.getObject("response_status_code");
    StoredResponse response = null;
    if (statusCode != null) {
      response =
          new StoredResponse(
              ((Number) statusCode).shortValue(),
              readTextArray(rs, "response_header_names"),
              readByteaArray(rs, "response_header_values"),
              rs.getBytes("response_body"));
    }
    return new IdempotencyRecord(
        rs.getObject("owner_id", UUID.class),
        rs.getString("idempotency_key"),
        rs.getObject("claim_id", UUID.class),
        response,
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("completed_at")));
  }

  private String[] readTextArray(ResultSet rs, String column) throws SQLException {
    final Object[] elements = readArray(rs, column);
    final String[] values = new String[elements.length];
    for (int i = 0; i < elements.length; i++) {
      values[i] = (String) elements[i];
    }
    return values;
  }

  private byte[][] readByteaArray(ResultSet rs, String column) throws SQLException {
    final Object[] elements = readArray(rs, column);
    final byte[][] values = new byte[elements.length][];
    for (int i = 0; i < elements.length; i++) {
      values[i] = (byte[]) elements[i];
    }
    return values;
  }

  private Object[] readArray(ResultSet rs, String column) throws SQLException {
    final Array array = rs.getArray(column);
    if (array == null) {
      return new Object[0];
    }
    try {
      return (Object[]) array.getArray();
    } finally {
      array.free();
    }
  }

  private static AbstractSqlTypeValue sqlArray(String elementType, Object[] elements) {
    return new AbstractSqlTypeValue() {
      @Override
      protected Object createTypeValue(Connection connection, int sqlType, String typeName)
          throws SQLException {
        return connection.createArrayOf(elementType, elements);
      }
    };
  }
}
