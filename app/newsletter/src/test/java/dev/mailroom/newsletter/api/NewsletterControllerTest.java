/*
 * Where: newsletter API web layer tests
 * What: saved responses are written verbatim and idempotency errors map to HTTP statuses
 * Why: clients tell retryable conflicts from failures only by status and error code
 */
package dev.mailroom.newsletter.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.mailroom.newsletter.idempotency.DuplicateKeyInFlightException;
import dev.mailroom.newsletter.idempotency.EffectExecutionFailedException;
import dev.mailroom.newsletter.idempotency.IdempotencyKey;
import dev.mailroom.newsletter.idempotency.MalformedResponseException;
import dev.mailroom.newsletter.idempotency.SavedResponse;
import dev.mailroom.newsletter.idempotency.StorageUnavailableException;
import dev.mailroom.newsletter.idempotency.UnknownOwnerException;
import dev.mailroom.newsletter.service.NewsletterPublishService;
import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.time.Duration;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.RequestBuilder;

@WebMvcTest(NewsletterController.class)
@Import(ApiExceptionHandler.class)
class NewsletterControllerTest {

  private static final UUID OWNER_ID = UUID.fromString("5f0c6a0e-8f4e-4f57-9a43-3c1c9d1f7e21");
  private static final String BODY =
      """
      {
        "title": "Issue #1",
        "text_content": "Hello",
        "html_content": "<p>Hello</p>"
      }
      """;

  @Autowired private MockMvc mockMvc;

  @MockitoBean private NewsletterPublishService newsletterPublishService;

  @Test
  void publishWritesSavedResponseVerbatim() throws Exception {
    final SavedResponse saved =
        SavedResponse.builder(303)
            .header("Location", "/admin/newsletters")
            .header("X-Mailroom-Flash", "accepted")
            .header("X-Mailroom-Flash", "second")
            .build();
    when(newsletterPublishService.publish(eq(OWNER_ID), eq("idem-1"), any(PublishNewsletterRequest.class)))
        .thenReturn(saved);

    final MvcResult result =
        mockMvc
            .perform(
                post("/admin/newsletters")
                    .header("X-User-Id", OWNER_ID.toString())
                    .header("Idempotency-Key", "idem-1")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(BODY))
            .andExpect(status().isSeeOther())
            .andExpect(header().string("Location", "/admin/newsletters"))
            .andReturn();

    assertThat(result.getResponse().getHeaders("X-Mailroom-Flash"))
        .containsExactly("accepted", "second");
    assertThat(result.getResponse().getContentAsByteArray()).isEmpty();
  }

  @Test
  void interleavedHeadersAreWrittenInSavedOrder() throws IOException {
    // The mock servlet response groups by name, so the write order is checked on the raw calls.
    final SavedResponse saved =
        SavedResponse.builder(303)
            .header("Set-Cookie", "a=1")
            .header("X-Trace", "t")
            .header("Set-Cookie", "b=2")
            .body("ok")
            .build();
    final HttpServletResponse response = mock(HttpServletResponse.class);
    final ServletOutputStream out = mock(ServletOutputStream.class);
    when(response.getOutputStream()).thenReturn(out);

    NewsletterController.writeSavedResponse(saved, response);

    final InOrder order = inOrder(response, out);
    order.verify(response).setStatus(303);
    order.verify(response).addHeader("Set-Cookie", "a=1");
    order.verify(response).addHeader("X-Trace", "t");
    order.verify(response).addHeader("Set-Cookie", "b=2");
    order.verify(response).setContentLength(2);
    order.verify(out).write("ok".getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void publishFallsBackToBodyKeyAndReturnsBinaryBody() throws Exception {
    final byte[] body = {0x00, (byte) 0xff, 0x41};
    when(newsletterPublishService.publish(eq(OWNER_ID), eq("form-key"), any(PublishNewsletterRequest.class)))
        .thenReturn(SavedResponse.builder(200).body(body).build());

    mockMvc
        .perform(
            post("/admin/newsletters")
                .header("X-User-Id", OWNER_ID.toString())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "title": "Issue #1",
                      "text_content": "Hello",
                      "html_content": "<p>Hello</p>",
                      "idempotency_key": "form-key"
                    }
                    """))
        .andExpect(status().isOk())
        .andExpect(content().bytes(body));
  }

  @Test
  void headerKeyWinsOverBodyKey() throws Exception {
    when(newsletterPublishService.publish(eq(OWNER_ID), eq("header-key"), any(PublishNewsletterRequest.class)))
        .thenReturn(SavedResponse.builder(303).build());

    mockMvc
        .perform(
            post("/admin/newsletters")
                .header("X-User-Id", OWNER_ID.toString())
                .header("Idempotency-Key", "header-key")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "title": "Issue #1",
                      "text_content": "Hello",
                      "html_content": "<p>Hello</p>",
                      "idempotency_key": "form-key"
                    }
                    """))
        .andExpect(status().isSeeOther());

    verify(newsletterPublishService)
        .publish(eq(OWNER_ID), eq("header-key"), any(PublishNewsletterRequest.class));
  }

  @Test
  void inFlightKeyReturnsConflictWithRetryAfter() throws Exception {
    when(newsletterPublishService.publish(eq(OWNER_ID), eq("idem-busy"), any(PublishNewsletterRequest.class)))
        .thenThrow(
            new DuplicateKeyInFlightException(IdempotencyKey.parse("idem-busy"), Duration.ofSeconds(5)));

    mockMvc
        .perform(publishRequest("idem-busy"))
        .andExpect(status().isConflict())
        .andExpect(header().string("Retry-After", "5"))
        .andExpect(jsonPath("$.code").value("IDEMPOTENCY_KEY_IN_FLIGHT"));
  }

  @Test
  void subSecondRetryHintRoundsUpToOneSecond() throws Exception {
    when(newsletterPublishService.publish(eq(OWNER_ID), eq("idem-busy"), any(PublishNewsletterRequest.class)))
        .thenThrow(
            new DuplicateKeyInFlightException(IdempotencyKey.parse("idem-busy"), Duration.ofMillis(200)));

    mockMvc
        .perform(publishRequest("idem-busy"))
        .andExpect(status().isConflict())
        .andExpect(header().string("Retry-After", "1"));
  }

  @Test
  void effectFailureReturnsServerErrorWithoutCauseDetail() throws Exception {
    when(newsletterPublishService.publish(eq(OWNER_ID), eq("idem-fail"), any(PublishNewsletterRequest.class)))
        .thenThrow(
            new EffectExecutionFailedException(
                IdempotencyKey.parse("idem-fail"), new IOException("smtp password rejected")));

    final MvcResult result =
        mockMvc
            .perform(publishRequest("idem-fail"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.code").value("EFFECT_EXECUTION_FAILED"))
            .andReturn();

    assertThat(result.getResponse().getContentAsString()).doesNotContain("smtp password");
  }

  @Test
  void storageFailureReturnsServiceUnavailable() throws Exception {
    when(newsletterPublishService.publish(eq(OWNER_ID), eq("idem-db"), any(PublishNewsletterRequest.class)))
        .thenThrow(new StorageUnavailableException("db down", new SQLException("connection refused")));

    mockMvc
        .perform(publishRequest("idem-db"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("STORAGE_UNAVAILABLE"))
        .andExpect(jsonPath("$.message").value("storage is unavailable"));
  }

  @Test
  void unknownOwnerReturnsBadRequestInsteadOfStorageError() throws Exception {
    when(newsletterPublishService.publish(eq(OWNER_ID), eq("idem-owner"), any(PublishNewsletterRequest.class)))
        .thenThrow(
            new UnknownOwnerException(
                OWNER_ID, new DataIntegrityViolationException("violates foreign key constraint")));

    mockMvc
        .perform(publishRequest("idem-owner"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("UNKNOWN_OWNER"))
        .andExpect(jsonPath("$.message").value("X-User-Id is unknown"));
  }

  @Test
  void malformedResponseReturnsInternalError() throws Exception {
    when(newsletterPublishService.publish(eq(OWNER_ID), eq("idem-bad"), any(PublishNewsletterRequest.class)))
        .thenThrow(new MalformedResponseException("status code out of range: 700"));

    mockMvc
        .perform(publishRequest("idem-bad"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"))
        .andExpect(jsonPath("$.message").value("internal error"));
  }

  @Test
  void invalidKeyReturnsBadRequest() throws Exception {
    when(newsletterPublishService.publish(eq(OWNER_ID), eq("   "), any(PublishNewsletterRequest.class)))
        .thenThrow(new IllegalArgumentException("idempotency_key cannot be empty"));

    mockMvc
        .perform(publishRequest("   "))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("idempotency_key cannot be empty"));
  }

  @Test
  void missingOrInvalidUserHeaderReturnsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/admin/newsletters")
                .header("Idempotency-Key", "idem-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("X-User-Id is required"));

    mockMvc
        .perform(
            post("/admin/newsletters")
                .header("X-User-Id", "not-a-uuid")
                .header("Idempotency-Key", "idem-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(BODY))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));

    verifyNoInteractions(newsletterPublishService);
  }

  @Test
  void blankTitleReturnsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/admin/newsletters")
                .header("X-User-Id", OWNER_ID.toString())
                .header("Idempotency-Key", "idem-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "title": "",
                      "text_content": "Hello",
                      "html_content": "<p>Hello</p>"
                    }
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("title is required"));

    verifyNoInteractions(newsletterPublishService);
  }

  private RequestBuilder publishRequest(String key) {
    return post("/admin/newsletters")
        .header("X-User-Id", OWNER_ID.toString())
        .header("Idempotency-Key", key)
        .contentType(MediaType.APPLICATION_JSON)
        .content(BODY);
  }
}
