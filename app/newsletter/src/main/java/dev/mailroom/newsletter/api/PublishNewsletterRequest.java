/*
 * Where: newsletter API
 * What: body of a publish request
 * Why: binds and validates the issue content; the key may also arrive as a header
 */
package dev.mailroom.newsletter.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PublishNewsletterRequest(
    @NotBlank(message = "title is required") String title,
    @NotBlank(message = "text_content is required") String textContent,
    @NotBlank(message = "html_content is required") String htmlContent,
    String idempotencyKey) {}
