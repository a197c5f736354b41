/*
 * Where: idempotency core
 * What: admits exactly one executor per (owner, key); duplicates replay or wait for it
 * Why: retries after timeouts must never run the side effect a second time
 */
package dev.mailroom.newsletter.idempotency;

import com.google.common.annotations.VisibleForTesting;
import dev.mailroom.newsletter.config.IdempotencyProperties;
import dev.mailroom.newsletter.model.IdempotencyRecord;
import dev.mailroom.newsletter.repository.IdempotencyRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

@Component
public class IdempotencyGate {

  private static final Logger logger = LoggerFactory.getLogger(IdempotencyGate.class);

  // A row can disappear between our insert and read when its holder failed and released it.
  private static final int MAX_IMMEDIATE_RETRIES = 3;

  private final IdempotencyRepository idempotencyRepository;
  private final ResponseMaterializer responseMaterializer;
  private final IdempotencyProperties properties;
  private final IdempotencyMetrics metrics;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public IdempotencyGate(
      IdempotencyRepository idempotencyRepository,
      ResponseMaterializer responseMaterializer,
      IdempotencyProperties properties,
      IdempotencyMetrics metrics,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    this.idempotencyRepository = idempotencyRepository;
    this.responseMaterializer = responseMaterializer;
    this.properties = properties;
    this.metrics = metrics;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.clock = clock;
  }

  /**
   * Claims (owner, key) or returns the response saved by an earlier execution.
   *
   * <p>While another execution holds the claim, polls with capped exponential backoff until that
   * execution completes or the configured in-flight timeout elapses.
   *
   * @throws DuplicateKeyInFlightException when the in-flight execution did not finish in time
   * @throws UnknownOwnerException when no owner with {@code ownerId} exists
   * @throws StorageUnavailableException when the store cannot be reached
   */
  public NextAction tryStart(UUID ownerId, IdempotencyKey idempotencyKey) {
    // Elapsed time comes from nanoTime so a fixed Clock cannot stall the deadline.
    final long waitStartedAt = System.nanoTime();
    final long deadline = waitStartedAt + properties.inFlightTimeout().toNanos();
    int pollAttempt = 0;
    int immediateRetries = 0;
    while (true) {
      final ClaimAttempt attempt = attemptClaim(ownerId, idempotencyKey);
      if (attempt.action() != null) {
        if (pollAttempt > 0) {
          metrics.recordInFlightWait(Duration.ofNanos(System.nanoTime() - waitStartedAt));
        }
        return attempt.action();
      }
      if (attempt.vanished() && immediateRetries < MAX_IMMEDIATE_RETRIES) {
        immediateRetries++;
        logger.debug("idempotency claim vanished, retrying key={} ownerId={}", idempotencyKey, ownerId);
        continue;
      }
      final long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        metrics.recordOutcome(IdempotencyMetrics.OUTCOME_IN_FLIGHT);
        logger.info(
            "idempotency key still in flight key={} ownerId={} polls={}",
            idempotencyKey,
            ownerId,
            pollAttempt);
        throw new DuplicateKeyInFlightException(idempotencyKey, properties.retryAfter());
      }
      pollAttempt++;
      final Duration backoff = computeBackoffDuration(pollAttempt);
      sleep(idempotencyKey, min(backoff, Duration.ofNanos(remaining)));
    }
  }

  private ClaimAttempt attemptClaim(UUID ownerId, IdempotencyKey idempotencyKey) {
    try {
      // The conditional insert and the fallback read share one transaction.
      return transactionTemplate.execute(
          status -> {
            final UUID claimId = UUID.randomUUID();
            final boolean inserted =
                idempotencyRepository.insertPlaceholder(
                    ownerId, idempotencyKey.value(), claimId, Instant.now(clock));
            if (inserted) {
              return ClaimAttempt.of(new NextAction.StartProcessing(claimId));
            }
            final Optional<IdempotencyRecord> existing =
                idempotencyRepository.find(ownerId, idempotencyKey.value());
            if (existing.isEmpty()) {
              return ClaimAttempt.VANISHED;
            }
            if (!existing.get().isComplete()) {
              return ClaimAttempt.IN_FLIGHT;
            }
            final SavedResponse saved = responseMaterializer.decode(existing.get().response());
            return ClaimAttempt.of(new NextAction.ReturnSavedResponse(saved));
          });
    } catch (DataIntegrityViolationException ex) {
      // ON CONFLICT absorbs the primary key, so the remaining constraint is the owner foreign key.
      metrics.recordOutcome(IdempotencyMetrics.OUTCOME_UNKNOWN_OWNER);
      throw new UnknownOwnerException(ownerId, ex);
    } catch (DataAccessException | TransactionException ex) {
      metrics.recordOutcome(IdempotencyMetrics.OUTCOME_STORAGE_UNAVAILABLE);
      throw new StorageUnavailableException(
          "failed to claim idempotency_key " + idempotencyKey, ex);
    }
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.initialBackoff().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffMultiplier(), attempt - 1);
    final double capped = Math.min(exp, properties.maxBackoff().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    return Duration.ofMillis(Math.max(1L, Math.min(backoffMillis, properties.maxBackoff().toMillis())));
  }

  private void sleep(IdempotencyKey idempotencyKey, Duration duration) {
    try {
      Thread.sleep(Math.max(1L, duration.toMillis()));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      final DuplicateKeyInFlightException interrupted =
          new DuplicateKeyInFlightException(idempotencyKey, properties.retryAfter());
      interrupted.addSuppressed(ex);
      throw interrupted;
    }
  }

  private static Duration min(Duration left, Duration right) {
    return left.compareTo(right) <= 0 ? left : right;
  }

  private record ClaimAttempt(NextAction action, boolean vanished) {

    static final ClaimAttempt IN_FLIGHT = new ClaimAttempt(null, false);
    static final ClaimAttempt VANISHED = new ClaimAttempt(null, true);

    static ClaimAttempt of(NextAction action) {
      return new ClaimAttempt(action, false);
    }
  }
}
