/*
 * Where: newsletter service layer
 * What: clears idempotency claims whose executor never completed them
 * Why: a crashed executor would otherwise block retries of its key forever
 */
package dev.mailroom.newsletter.service;

import dev.mailroom.newsletter.config.IdempotencyReaperProperties;
import dev.mailroom.newsletter.idempotency.IdempotencyKey;
import dev.mailroom.newsletter.idempotency.IdempotencyMetrics;
import dev.mailroom.newsletter.model.IdempotencyRecord;
import dev.mailroom.newsletter.repository.IdempotencyRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class IdempotencyReaperService {

  private static final Logger logger = LoggerFactory.getLogger(IdempotencyReaperService.class);

  private static final int LOGGED_CLAIMS_LIMIT = 20;

  private final IdempotencyRepository idempotencyRepository;
  private final IdempotencyReaperProperties reaperProperties;
  private final IdempotencyMetrics metrics;
  private final Clock clock;

  public int reapStaleClaims() {
    final Instant threshold = Instant.now(clock).minus(reaperProperties.staleAfter());
    for (IdempotencyRecord stale :
        idempotencyRepository.findIncompleteClaimedBefore(threshold, LOGGED_CLAIMS_LIMIT)) {
      logger.warn("releasing stale idempotency claim key={} ownerId={} claimId={} createdAt={}",
          stale.idempotencyKey(), stale.ownerId(), stale.claimId(), stale.createdAt());
    }
    // Only incomplete rows are eligible; saved responses are never deleted here.
    final int released = idempotencyRepository.deleteIncompleteClaimedBefore(threshold);
    metrics.recordReleased(released);
    logger.info("idempotency reaper released staleClaims={} threshold={}", released, threshold);
    return released;
  }

  /** Operator path for a single stuck claim. Returns whether an incomplete claim was removed. */
  public boolean forceRelease(UUID ownerId, IdempotencyKey idempotencyKey) {
    final int released = idempotencyRepository.forceRelease(ownerId, idempotencyKey.value());
    metrics.recordReleased(released);
    logger.warn("idempotency claim force released key={} ownerId={} released={}",
        idempotencyKey, ownerId, released);
    return released > 0;
  }
}
