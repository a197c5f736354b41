/*
 * Where: newsletter API
 * What: maps exceptions to HTTP error responses
 * Why: keeps the error format uniform and separates retryable conflicts from server faults
 */
package dev.mailroom.newsletter.api;

import dev.mailroom.newsletter.idempotency.ClaimLostException;
import dev.mailroom.newsletter.idempotency.DuplicateKeyInFlightException;
import dev.mailroom.newsletter.idempotency.EffectExecutionFailedException;
import dev.mailroom.newsletter.idempotency.MalformedResponseException;
import dev.mailroom.newsletter.idempotency.StorageUnavailableException;
import dev.mailroom.newsletter.idempotency.UnknownOwnerException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(DuplicateKeyInFlightException.class)
  public ResponseEntity<ApiErrorResponse> handleInFlight(DuplicateKeyInFlightException ex) {
    final long retryAfterSeconds = Math.max(1L, ex.retryAfter().toSeconds());
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .header(HttpHeaders.RETRY_AFTER, Long.toString(retryAfterSeconds))
        .body(new ApiErrorResponse(ApiErrorCode.IDEMPOTENCY_KEY_IN_FLIGHT, ex.getMessage()));
  }

  @ExceptionHandler(EffectExecutionFailedException.class)
  public ResponseEntity<ApiErrorResponse> handleEffectFailure(EffectExecutionFailedException ex) {
    // The cause may carry internal detail; it goes to the log only.
    logger.error("request failed while running the idempotent operation", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(ApiErrorCode.EFFECT_EXECUTION_FAILED, ex.getMessage()));
  }

  @ExceptionHandler(UnknownOwnerException.class)
  public ResponseEntity<ApiErrorResponse> handleUnknownOwner(UnknownOwnerException ex) {
    logger.warn("request for unknown owner ownerId={}", ex.ownerId());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.UNKNOWN_OWNER, "X-User-Id is unknown"));
  }

  @ExceptionHandler(StorageUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleStorageUnavailable(StorageUnavailableException ex) {
    logger.error("idempotency store unavailable", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse(ApiErrorCode.STORAGE_UNAVAILABLE, "storage is unavailable"));
  }

  @ExceptionHandler({MalformedResponseException.class, ClaimLostException.class})
  public ResponseEntity<ApiErrorResponse> handleInternal(RuntimeException ex) {
    logger.error("idempotent request could not be completed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(ApiErrorCode.INTERNAL_ERROR, "internal error"));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    return badRequest(ex.getHeaderName() + " is required");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
