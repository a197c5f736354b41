/*
 * Where: newsletter domain model
 * What: one row of the idempotency table
 * Why: tells the gate whether a key is claimed-but-incomplete or complete
 */
package dev.mailroom.newsletter.model;

import java.time.Instant;
import java.util.UUID;

public record IdempotencyRecord(
    UUID ownerId,
    String idempotencyKey,
    UUID claimId,
    StoredResponse response,
    Instant createdAt,
    Instant completedAt) {

  public boolean isComplete() {
    return response != null;
  }
}
