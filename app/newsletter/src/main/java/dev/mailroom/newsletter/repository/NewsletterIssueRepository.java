/*
 * Where: newsletter data access
 * What: stores newsletter issues and fans them out to the delivery queue
 * Why: the queue rows are the side effect the idempotency core must produce exactly once
 */
package dev.mailroom.newsletter.repository;

import static dev.mailroom.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NewsletterIssueRepository {

  private static final String STATUS_CONFIRMED = "confirmed";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insertIssue(
      UUID issueId, String title, String textContent, String htmlContent, Instant publishedAt) {
    final String sql =
        """
        INSERT INTO newsletter_issues (
          newsletter_issue_id,
          title,
          text_content,
          html_content,
          published_at
        ) VALUES (
          :issueId,
          :title,
          :textContent,
          :htmlContent,
          :publishedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("issueId", issueId)
            .addValue("title", title)
            .addValue("textContent", textContent)
            .addValue("htmlContent", htmlContent)
            .addValue("publishedAt", toTimestamp(publishedAt));
    jdbcTemplate.update(sql, params);
  }

  /** Queues one delivery task per confirmed subscriber; returns the number of tasks queued. */
  public int enqueueDeliveryTasks(UUID issueId) {
    final String sql =
        """
        INSERT INTO issue_delivery_queue (
          newsletter_issue_id,
          subscriber_email
        )
        SELECT :issueId, email
        FROM subscriptions
        WHERE status = :status
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("issueId", issueId)
            .addValue("status", STATUS_CONFIRMED);
    return jdbcTemplate.update(sql, params);
  }
}
