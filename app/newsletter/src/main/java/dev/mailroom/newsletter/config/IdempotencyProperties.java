/*
 * Where: newsletter configuration binding
 * What: in-flight wait policy of the idempotency gate
 * Why: lets operators trade request latency against duplicate-in-flight errors per environment
 */
package dev.mailroom.newsletter.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * @param inFlightTimeout how long a duplicate request polls for the running one; zero fails fast
 * @param initialBackoff first poll delay
 * @param maxBackoff cap of a single poll delay
 * @param backoffMultiplier growth factor between consecutive polls
 * @param backoffJitterMin lower bound of the random factor applied to each delay
 * @param backoffJitterMax upper bound of the random factor applied to each delay
 * @param retryAfter hint returned to clients whose request timed out behind an in-flight one
 */
@Validated
@ConfigurationProperties(prefix = "mailroom.idempotency")
public record IdempotencyProperties(
    @NotNull Duration inFlightTimeout,
    @NotNull Duration initialBackoff,
    @NotNull Duration maxBackoff,
    @DecimalMin("1.0") double backoffMultiplier,
    @DecimalMin(value = "0.0", inclusive = false) double backoffJitterMin,
    @DecimalMin(value = "0.0", inclusive = false) double backoffJitterMax,
    @NotNull Duration retryAfter) {

  @AssertTrue(message = "in-flight-timeout and retry-after must not be negative")
  public boolean isNonNegativeDurations() {
    return (inFlightTimeout == null || !inFlightTimeout.isNegative())
        && (retryAfter == null || !retryAfter.isNegative());
  }

  @AssertTrue(message = "initial-backoff must be positive and not exceed max-backoff")
  public boolean isBackoffRangeValid() {
    if (initialBackoff == null || maxBackoff == null) {
      return true;
    }
    return initialBackoff.toMillis() > 0 && initialBackoff.compareTo(maxBackoff) <= 0;
  }

  @AssertTrue(message = "backoff-jitter-min must not exceed backoff-jitter-max")
  public boolean isJitterRangeValid() {
    return backoffJitterMin <= backoffJitterMax;
  }
}
