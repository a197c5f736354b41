package dev.mailroom.newsletter.idempotency;

/**
 * The placeholder row no longer belongs to this executor when it tries to complete it, typically
 * because a reaper or operator released the claim meanwhile.
 */
public class ClaimLostException extends IdempotencyException {

  public ClaimLostException(IdempotencyKey idempotencyKey) {
    super("claim for idempotency_key " + idempotencyKey + " was lost before completion");
  }
}
