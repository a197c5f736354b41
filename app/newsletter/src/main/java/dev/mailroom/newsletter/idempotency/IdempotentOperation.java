package dev.mailroom.newsletter.idempotency;

/**
 * Side-effecting unit of work guarded by {@link IdempotentExecutor}. It captures whatever it needs;
 * the executor only calls it once it holds the claim for the key.
 */
@FunctionalInterface
public interface IdempotentOperation {

  SavedResponse run() throws Exception;
}
