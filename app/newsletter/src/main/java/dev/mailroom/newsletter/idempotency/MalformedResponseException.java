package dev.mailroom.newsletter.idempotency;

/** The operation produced a response that cannot be persisted (bad status or header bytes). */
public class MalformedResponseException extends IdempotencyException {

  public MalformedResponseException(String message) {
    super(message);
  }
}
