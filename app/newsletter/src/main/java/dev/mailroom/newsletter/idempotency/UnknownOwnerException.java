package dev.mailroom.newsletter.idempotency;

import java.util.UUID;

/** The owner a key is scoped to does not exist, so no claim can be recorded for it. */
public class UnknownOwnerException extends IdempotencyException {

  private final UUID ownerId;

  public UnknownOwnerException(UUID ownerId, Throwable cause) {
    super("owner " + ownerId + " is unknown", cause);
    this.ownerId = ownerId;
  }

  public UUID ownerId() {
    return ownerId;
  }
}
