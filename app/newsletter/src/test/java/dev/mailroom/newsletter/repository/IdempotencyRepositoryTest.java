/*
 * Where: idempotency repository tests
 * What: conditional insert, guarded completion and release against real Postgres arrays
 * Why: the ON CONFLICT and text[]/bytea[] handling only behave correctly on the real dialect
 */
package dev.mailroom.newsletter.repository;

import static org.assertj.core.api.Assertions.assertThat;

import dev.mailroom.newsletter.AbstractPostgresContainerTest;
import dev.mailroom.newsletter.model.IdempotencyRecord;
import dev.mailroom.newsletter.model.StoredResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class IdempotencyRepositoryTest extends AbstractPostgresContainerTest {

  private static final String KEY = "repo-key";

  @Autowired
  private IdempotencyRepository idempotencyRepository;

  @Autowired
  private NamedParameterJdbcTemplate jdbcTemplate;

  private UUID ownerId;

  @BeforeEach
  void cleanup() {
    truncateAll(jdbcTemplate);
    ownerId = insertUser(jdbcTemplate, "repo-owner");
  }

  @Test
  void insertPlaceholderCreatesRowOnlyOnce() {
    final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    final UUID firstClaim = UUID.randomUUID();

    assertThat(idempotencyRepository.insertPlaceholder(ownerId, KEY, firstClaim, now)).isTrue();
    assertThat(idempotencyRepository.insertPlaceholder(ownerId, KEY, UUID.randomUUID(), now))
        .isFalse();

    final Optional<IdempotencyRecord> found = idempotencyRepository.find(ownerId, KEY);
    assertThat(found).isPresent();
    assertThat(found.get().isComplete()).isFalse();
    assertThat(found.get().claimId()).isEqualTo(firstClaim);
    assertThat(found.get().createdAt()).isEqualTo(now);
    assertThat(found.get().completedAt()).isNull();
  }

  @Test
  void completeStoresRepeatedHeadersAndBinaryValues() {
    final UUID claimId = UUID.randomUUID();
    idempotencyRepository.insertPlaceholder(ownerId, KEY, claimId, Instant.now());
    final StoredResponse response =
        new StoredResponse(
            (short) 200,
            new String[] {"Set-Cookie", "X-Raw", "Set-Cookie"},
            new byte[][] {
              "a=1".getBytes(StandardCharsets.US_ASCII),
              new byte[] {(byte) 0xff, 0x00, (byte) 0x80},
              "b=2".getBytes(StandardCharsets.US_ASCII)
            },
            new byte[] {0x01, (byte) 0xfe, 0x00});

    final int updated =
        idempotencyRepository.complete(ownerId, KEY, claimId, response, Instant.now());

    assertThat(updated).isEqualTo(1);
    final IdempotencyRecord stored = idempotencyRepository.find(ownerId, KEY).orElseThrow();
    assertThat(stored.isComplete()).isTrue();
    assertThat(stored.response()).isEqualTo(response);
    assertThat(stored.completedAt()).isNotNull();
  }

  @Test
  void completeWithZeroHeadersAndEmptyBody() {
    final UUID claimId = UUID.randomUUID();
    idempotencyRepository.insertPlaceholder(ownerId, KEY, claimId, Instant.now());
    final StoredResponse response =
        new StoredResponse((short) 204, new String[0], new byte[0][], new byte[0]);

    idempotencyRepository.complete(ownerId, KEY, claimId, response, Instant.now());

    final StoredResponse stored = idempotencyRepository.find(ownerId, KEY).orElseThrow().response();
    assertThat(stored.statusCode()).isEqualTo((short) 204);
    assertThat(stored.headerNames()).isEmpty();
    assertThat(stored.headerValues()).isEmpty();
    assertThat(stored.body()).isEmpty();
  }

  @Test
  void completeIgnoresForeignClaimAndCompletedRow() {
    final UUID claimId = UUID.randomUUID();
    idempotencyRepository.insertPlaceholder(ownerId, KEY, claimId, Instant.now());
    final StoredResponse response =
        new StoredResponse((short) 201, new String[0], new byte[0][], new byte[0]);

    assertThat(idempotencyRepository.complete(ownerId, KEY, UUID.randomUUID(), response, Instant.now()))
        .isZero();
    assertThat(idempotencyRepository.complete(ownerId, KEY, claimId, response, Instant.now()))
        .isEqualTo(1);
    assertThat(idempotencyRepository.complete(ownerId, KEY, claimId, response, Instant.now()))
        .isZero();
  }

  @Test
  void releaseClaimRemovesOnlyOwnIncompleteRow() {
    final UUID claimId = UUID.randomUUID();
    idempotencyRepository.insertPlaceholder(ownerId, KEY, claimId, Instant.now());

    assertThat(idempotencyRepository.releaseClaim(ownerId, KEY, UUID.randomUUID())).isZero();
    assertThat(idempotencyRepository.releaseClaim(ownerId, KEY, claimId)).isEqualTo(1);
    assertThat(idempotencyRepository.find(ownerId, KEY)).isEmpty();
  }

  @Test
  void forceReleaseNeverDeletesCompletedRows() {
    final UUID claimId = UUID.randomUUID();
    idempotencyRepository.insertPlaceholder(ownerId, KEY, claimId, Instant.now());
    idempotencyRepository.insertPlaceholder(ownerId, "other-key", UUID.randomUUID(), Instant.now());
    idempotencyRepository.complete(
        ownerId,
        KEY,
        claimId,
        new StoredResponse((short) 200, new String[0], new byte[0][], new byte[0]),
        Instant.now());

    assertThat(idempotencyRepository.forceRelease(ownerId, KEY)).isZero();
    assertThat(idempotencyRepository.forceRelease(ownerId, "other-key")).isEqualTo(1);
    assertThat(idempotencyRepository.find(ownerId, KEY)).isPresent();
  }

  @Test
  void keysAreScopedPerOwner() {
    final UUID otherOwner = insertUser(jdbcTemplate, "repo-other-owner");

    assertThat(idempotencyRepository.insertPlaceholder(ownerId, KEY, UUID.randomUUID(), Instant.now()))
        .isTrue();
    assertThat(
            idempotencyRepository.insertPlaceholder(otherOwner, KEY, UUID.randomUUID(), Instant.now()))
        .isTrue();
    assertThat(countRows(jdbcTemplate, "idempotency")).isEqualTo(2);
  }

  @Test
  void staleClaimQueriesSkipRecentAndCompletedRows() {
    final Instant now = Instant.now();
    final Instant threshold = now.minus(Duration.ofMinutes(30));
    final UUID completedClaim = UUID.randomUUID();
    idempotencyRepository.insertPlaceholder(ownerId, "stale", UUID.randomUUID(), now.minus(Duration.ofHours(2)));
    idempotencyRepository.insertPlaceholder(ownerId, "fresh", UUID.randomUUID(), now);
    idempotencyRepository.insertPlaceholder(ownerId, "done", completedClaim, now.minus(Duration.ofHours(3)));
    idempotencyRepository.complete(
        ownerId,
        "done",
        completedClaim,
        new StoredResponse((short) 200, new String[0], new byte[0][], new byte[0]),
        now.minus(Duration.ofHours(3)));

    final List<IdempotencyRecord> stale =
        idempotencyRepository.findIncompleteClaimedBefore(threshold, 10);
    assertThat(stale).extracting(IdempotencyRecord::idempotencyKey).containsExactly("stale");

    assertThat(idempotencyRepository.deleteIncompleteClaimedBefore(threshold)).isEqualTo(1);
    assertThat(idempotencyRepository.find(ownerId, "fresh")).isPresent();
    assertThat(idempotencyRepository.find(ownerId, "done")).isPresent();
    assertThat(idempotencyRepository.find(ownerId, "stale")).isEmpty();
  }
}
