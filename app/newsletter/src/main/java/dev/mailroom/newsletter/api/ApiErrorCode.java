/*
 * Where: newsletter API
 * What: error codes carried in error responses
 * Why: lets clients tell a retryable in-flight conflict from other failures with the same status
 */
package dev.mailroom.newsletter.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  NOT_FOUND,
  UNKNOWN_OWNER,
  IDEMPOTENCY_KEY_IN_FLIGHT,
  EFFECT_EXECUTION_FAILED,
  STORAGE_UNAVAILABLE,
  INTERNAL_ERROR
}
