/*
 * Where: newsletter reaper worker
 * What: runs the stale-claim reaper on a schedule
 * Why: clears abandoned claims without manual intervention once operators opt in
 */
package dev.mailroom.newsletter.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "mailroom.idempotency.reaper.enabled", havingValue = "true")
public class IdempotencyReaperWorker {

  private final IdempotencyReaperService reaperService;

  @Scheduled(fixedDelayString = "${mailroom.idempotency.reaper.cleanup-interval}")
  public void run() {
    reaperService.reapStaleClaims();
  }
}
