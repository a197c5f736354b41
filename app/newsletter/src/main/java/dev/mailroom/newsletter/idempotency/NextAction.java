/*
 * Where: idempotency core
 * What: outcome of a claim attempt on (owner, key)
 * Why: the caller either runs the operation or replays the saved response, never both
 */
package dev.mailroom.newsletter.idempotency;

import java.util.Objects;
import java.util.UUID;

public sealed interface NextAction
    permits NextAction.StartProcessing, NextAction.ReturnSavedResponse {

  /** This caller inserted the placeholder and now owns completing the key. */
  record StartProcessing(UUID claimId) implements NextAction {
    public StartProcessing {
      Objects.requireNonNull(claimId, "claimId");
    }
  }

  /** A completed response already exists for the key. */
  record ReturnSavedResponse(SavedResponse response) implements NextAction {
    public ReturnSavedResponse {
      Objects.requireNonNull(response, "response");
    }
  }
}
