package dev.mailroom.newsletter.idempotency;

/**
 * The guarded operation failed. The claim has been released, so a retry with the same key runs
 * the operation again. The operation's own exception is available unchanged as the cause.
 */
public class EffectExecutionFailedException extends IdempotencyException {

  public EffectExecutionFailedException(IdempotencyKey idempotencyKey, Throwable cause) {
    super("operation for idempotency_key " + idempotencyKey + " failed", cause);
  }
}
