/*
 * Where: newsletter service layer
 * What: publishes a newsletter issue behind the idempotency core
 * Why: a retried submit must not queue the same issue to subscribers twice
 */
package dev.mailroom.newsletter.service;

import dev.mailroom.newsletter.api.PublishNewsletterRequest;
import dev.mailroom.newsletter.idempotency.IdempotencyKey;
import dev.mailroom.newsletter.idempotency.IdempotentExecutor;
import dev.mailroom.newsletter.idempotency.SavedResponse;
import dev.mailroom.newsletter.repository.NewsletterIssueRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NewsletterPublishService {

  public static final String NEWSLETTERS_PATH = "/admin/newsletters";
  public static final String HEADER_FLASH = "X-Mailroom-Flash";
  static final String FLASH_ACCEPTED =
      "The newsletter issue has been accepted - emails will go out shortly.";

  private static final Logger logger = LoggerFactory.getLogger(NewsletterPublishService.class);

  private final IdempotentExecutor idempotentExecutor;
  private final NewsletterIssueRepository newsletterIssueRepository;
  private final Clock clock;

  public SavedResponse publish(UUID ownerId, String rawIdempotencyKey, PublishNewsletterRequest request) {
    final IdempotencyKey idempotencyKey = IdempotencyKey.parse(rawIdempotencyKey);
    return idempotentExecutor.execute(ownerId, idempotencyKey, () -> publishIssue(request));
  }

  private SavedResponse publishIssue(PublishNewsletterRequest request) {
    final UUID issueId = UUID.randomUUID();
    newsletterIssueRepository.insertIssue(
        issueId,
        request.title(),
        request.textContent(),
        request.htmlContent(),
        Instant.now(clock));
    final int queued = newsletterIssueRepository.enqueueDeliveryTasks(issueId);
    logger.info("newsletter issue queued issueId={} deliveries={}", issueId, queued);
    return SavedResponse.builder(HttpStatus.SEE_OTHER.value())
        .header(HttpHeaders.LOCATION, NEWSLETTERS_PATH)
        .header(HEADER_FLASH, FLASH_ACCEPTED)
        .build();
  }
}
