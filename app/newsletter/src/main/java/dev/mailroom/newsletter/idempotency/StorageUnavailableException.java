package dev.mailroom.newsletter.idempotency;

/** The idempotency store could not be reached or the transaction did not commit. */
public class StorageUnavailableException extends IdempotencyException {

  public StorageUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
