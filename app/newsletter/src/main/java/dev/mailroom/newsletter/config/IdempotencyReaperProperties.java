/*
 * Where: newsletter configuration binding
 * What: schedule and age threshold for clearing abandoned idempotency claims
 * Why: the retention policy for stale claims is decided by operators, not hard-coded
 */
package dev.mailroom.newsletter.config;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "mailroom.idempotency.reaper")
public record IdempotencyReaperProperties(
    boolean enabled, @NotNull Duration staleAfter, @NotNull Duration cleanupInterval) {}
