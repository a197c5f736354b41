/*
 * Where: idempotency core
 * What: client-chosen token that scopes one logical operation within an owner's namespace
 * Why: rejects unusable keys before they reach the store
 */
package dev.mailroom.newsletter.idempotency;

public record IdempotencyKey(String value) {

  static final int MAX_LENGTH = 50;

  public IdempotencyKey {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("idempotency_key cannot be empty");
    }
    if (value.length() >= MAX_LENGTH) {
      throw new IllegalArgumentException(
          "idempotency_key must be shorter than " + MAX_LENGTH + " characters");
    }
  }

  public static IdempotencyKey parse(String value) {
    return new IdempotencyKey(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
