/*
 * Where: newsletter operator API
 * What: releases a stuck idempotency claim by hand
 * Why: operators need a way to unblock one key without waiting for the reaper
 */
package dev.mailroom.newsletter.api;

import dev.mailroom.newsletter.idempotency.IdempotencyKey;
import dev.mailroom.newsletter.service.IdempotencyReaperService;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/idempotency")
@RequiredArgsConstructor
public class IdempotencyAdminController {

  private final IdempotencyReaperService reaperService;

  @DeleteMapping("/claims/{owner_id}/{idempotency_key}")
  public ResponseEntity<?> release(
      @PathVariable("owner_id") UUID ownerId,
      @PathVariable("idempotency_key") String idempotencyKey) {
    if (reaperService.forceRelease(ownerId, IdempotencyKey.parse(idempotencyKey))) {
      return ResponseEntity.noContent().build();
    }
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse(ApiErrorCode.NOT_FOUND, "no incomplete claim for key"));
  }
}
