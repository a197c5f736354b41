/*
 * Where: idempotency core
 * What: records idempotency outcomes, in-flight waits and reaped claims
 * Why: makes replay rates and stuck claims visible from Prometheus
 */
package dev.mailroom.newsletter.idempotency;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class IdempotencyMetrics {

  public static final String OUTCOME_STARTED = "started";
  public static final String OUTCOME_COMPLETED = "completed";
  public static final String OUTCOME_REPLAYED = "replayed";
  public static final String OUTCOME_IN_FLIGHT = "in_flight";
  public static final String OUTCOME_EFFECT_FAILED = "effect_failed";
  public static final String OUTCOME_MALFORMED = "malformed";
  public static final String OUTCOME_CLAIM_LOST = "claim_lost";
  public static final String OUTCOME_STORAGE_UNAVAILABLE = "storage_unavailable";
  public static final String OUTCOME_UNKNOWN_OWNER = "unknown_owner";

  private static final String METRIC_REQUEST_TOTAL = "idempotency.request.total";
  private static final String METRIC_IN_FLIGHT_WAIT = "idempotency.in_flight.wait";
  private static final String METRIC_REAPED_TOTAL = "idempotency.reaper.released.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> outcomeCounters = new ConcurrentHashMap<>();
  private final Timer inFlightWaitTimer;
  private final Counter reapedCounter;

  public IdempotencyMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.inFlightWaitTimer =
        Timer.builder(METRIC_IN_FLIGHT_WAIT)
            .description("Time a duplicate request spent waiting for the in-flight execution")
            .register(meterRegistry);
    this.reapedCounter =
        Counter.builder(METRIC_REAPED_TOTAL)
            .description("Incomplete idempotency claims released by the reaper or an operator")
            .register(meterRegistry);
  }

  public void recordOutcome(String outcome) {
    outcomeCounters
        .computeIfAbsent(
            outcome,
            ignored ->
                Counter.builder(METRIC_REQUEST_TOTAL)
                    .description("Idempotent request outcomes")
                    .tags(Tags.of("outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }

  public void recordInFlightWait(Duration waited) {
    if (waited == null || waited.isNegative()) {
      return;
    }
    inFlightWaitTimer.record(waited);
  }

  public void recordReleased(int count) {
    if (count > 0) {
      reapedCounter.increment(count);
    }
  }
}
