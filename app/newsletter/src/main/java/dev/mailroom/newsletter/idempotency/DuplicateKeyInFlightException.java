/*
 * Where: idempotency core
 * What: another execution still holds the claim for the same (owner, key)
 * Why: the client should retry later instead of queueing behind the running request
 */
package dev.mailroom.newsletter.idempotency;

import java.time.Duration;

public class DuplicateKeyInFlightException extends IdempotencyException {

  private final transient IdempotencyKey idempotencyKey;
  private final Duration retryAfter;

  public DuplicateKeyInFlightException(IdempotencyKey idempotencyKey, Duration retryAfter) {
    super("request with idempotency_key " + idempotencyKey + " is already in progress");
    this.idempotencyKey = idempotencyKey;
    this.retryAfter = retryAfter;
  }

  public IdempotencyKey idempotencyKey() {
    return idempotencyKey;
  }

  public Duration retryAfter() {
    return retryAfter;
  }
}
