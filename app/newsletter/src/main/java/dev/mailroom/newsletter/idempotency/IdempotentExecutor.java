/*
 * Where: idempotency core
 * What: runs a side-effecting operation at most once per (owner, key) and replays its response
 * Why: clients retry after timeouts; the observable effect must still happen exactly once
 */
package dev.mailroom.newsletter.idempotency;

import dev.mailroom.newsletter.model.StoredResponse;
import dev.mailroom.newsletter.repository.IdempotencyRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class IdempotentExecutor {

  private static final Logger logger = LoggerFactory.getLogger(IdempotentExecutor.class);

  private final IdempotencyGate idempotencyGate;
  private final IdempotencyRepository idempotencyRepository;
  private final ResponseMaterializer responseMaterializer;
  private final IdempotencyMetrics metrics;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public IdempotentExecutor(
      IdempotencyGate idempotencyGate,
      IdempotencyRepository idempotencyRepository,
      ResponseMaterializer responseMaterializer,
      IdempotencyMetrics metrics,
      PlatformTransactionManager transactionManager,
      Clock clock) {
    this.idempotencyGate = idempotencyGate;
    this.idempotencyRepository = idempotencyRepository;
    this.responseMaterializer = responseMaterializer;
    this.metrics = metrics;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.clock = clock;
  }

  /**
   * Returns the saved response for (owner, key) if one exists, otherwise claims the key, runs the
   * operation and saves its response.
   *
   * <p>Database writes the operation makes through the application's DataSource commit in the same
   * transaction as the saved response, so either both become visible or neither does. Every failure
   * except a lost claim releases the claim; an {@link Error} then propagates unchanged.
   *
   * @throws DuplicateKeyInFlightException another execution holds the key past the wait timeout
   * @throws EffectExecutionFailedException the operation threw; a retry may run it again
   * @throws MalformedResponseException the operation returned a response that cannot be stored
   * @throws ClaimLostException the claim was released by someone else before completion
   * @throws StorageUnavailableException the store failed; nothing was persisted
   */
  public SavedResponse execute(
      UUID ownerId, IdempotencyKey idempotencyKey, IdempotentOperation operation) {
    final NextAction next = idempotencyGate.tryStart(ownerId, idempotencyKey);
    if (next instanceof NextAction.ReturnSavedResponse saved) {
      metrics.recordOutcome(IdempotencyMetrics.OUTCOME_REPLAYED);
      logger.info(
          "idempotent replay key={} ownerId={} status={}",
          idempotencyKey,
          ownerId,
          saved.response().statusCode());
      return saved.response();
    }
    final UUID claimId = ((NextAction.StartProcessing) next).claimId();
    metrics.recordOutcome(IdempotencyMetrics.OUTCOME_STARTED);
    logger.info("idempotency claim acquired key={} ownerId={} claimId={}", idempotencyKey, ownerId, claimId);
    return runAndComplete(ownerId, idempotencyKey, claimId, operation);
  }

  private SavedResponse runAndComplete(
      UUID ownerId, IdempotencyKey idempotencyKey, UUID claimId, IdempotentOperation operation) {
    try {
      final SavedResponse response =
          transactionTemplate.execute(
              status -> {
                final SavedResponse produced = invoke(operation);
                final StoredResponse stored = responseMaterializer.encode(produced);
                final int updated =
                    idempotencyRepository.complete(
                        ownerId, idempotencyKey.value(), claimId, stored, Instant.now(clock));
                if (updated == 0) {
                  // Rolling back here also discards the operation's own writes.
                  throw new ClaimLostException(idempotencyKey);
                }
                return produced;
              });
      metrics.recordOutcome(IdempotencyMetrics.OUTCOME_COMPLETED);
      logger.info(
          "idempotent operation completed key={} ownerId={} status={}",
          idempotencyKey,
          ownerId,
          response.statusCode());
      return response;
    } catch (OperationFailedException ex) {
      metrics.recordOutcome(IdempotencyMetrics.OUTCOME_EFFECT_FAILED);
      final EffectExecutionFailedException failure =
          new EffectExecutionFailedException(idempotencyKey, ex.getCause());
      releaseAfterFailure(ownerId, idempotencyKey, claimId, failure);
      logger.warn("idempotent operation failed key={} ownerId={}", idempotencyKey, ownerId, ex.getCause());
      throw failure;
    } catch (MalformedResponseException ex) {
      metrics.recordOutcome(IdempotencyMetrics.OUTCOME_MALFORMED);
      releaseAfterFailure(ownerId, idempotencyKey, claimId, ex);
      logger.error("idempotent operation returned a malformed response key={} ownerId={}",
          idempotencyKey, ownerId, ex);
      throw ex;
    } catch (ClaimLostException ex) {
      // The row is no longer ours; releasing it could delete another executor's claim.
      metrics.recordOutcome(IdempotencyMetrics.OUTCOME_CLAIM_LOST);
      logger.warn("idempotency claim lost before completion key={} ownerId={} claimId={}",
          idempotencyKey, ownerId, claimId);
      throw ex;
    } catch (DataAccessException | TransactionException ex) {
      metrics.recordOutcome(IdempotencyMetrics.OUTCOME_STORAGE_UNAVAILABLE);
      final StorageUnavailableException failure =
          new StorageUnavailableException(
              "failed to save response for idempotency_key " + idempotencyKey, ex);
      releaseAfterFailure(ownerId, idempotencyKey, claimId, failure);
      logger.error("idempotent response could not be saved key={} ownerId={}",
          idempotencyKey, ownerId, ex);
      throw failure;
    } catch (RuntimeException | Error ex) {
      // Rethrown unwrapped, but the claim must not outlive the failed attempt.
      metrics.recordOutcome(IdempotencyMetrics.OUTCOME_EFFECT_FAILED);
      releaseAfterFailure(ownerId, idempotencyKey, claimId, ex);
      logger.error("idempotent operation aborted key={} ownerId={}",
          idempotencyKey, ownerId, ex);
      throw ex;
    }
  }

  private SavedResponse invoke(IdempotentOperation operation) {
    try {
      return operation.run();
    } catch (Exception ex) {
      throw new OperationFailedException(ex);
    }
  }

  private void releaseAfterFailure(
      UUID ownerId, IdempotencyKey idempotencyKey, UUID claimId, Throwable failure) {
    try {
      final Integer released =
          transactionTemplate.execute(
              status -> idempotencyRepository.releaseClaim(ownerId, idempotencyKey.value(), claimId));
      logger.info("idempotency claim released key={} ownerId={} released={}",
          idempotencyKey, ownerId, released);
    } catch (DataAccessException | TransactionException ex) {
      // The placeholder stays incomplete until the reaper or an operator clears it.
      failure.addSuppressed(ex);
      logger.error("failed to release idempotency claim key={} ownerId={} claimId={}",
          idempotencyKey, ownerId, claimId, ex);
    }
  }

  /** Carries the operation's exception out of the transaction callback so it rolls back. */
  private static final class OperationFailedException extends RuntimeException {

    OperationFailedException(Exception cause) {
      super(cause);
    }
  }
}
