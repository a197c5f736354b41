/*
 * Where: newsletter API
 * What: publish endpoint that writes the idempotent response verbatim
 * Why: a retried submit must see exactly the bytes the first submit produced
 */
package dev.mailroom.newsletter.api;

import dev.mailroom.newsletter.idempotency.HeaderPair;
import dev.mailroom.newsletter.idempotency.SavedResponse;
import dev.mailroom.newsletter.service.NewsletterPublishService;
import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class NewsletterController {

  static final String HEADER_USER_ID = "X-User-Id";
  static final String HEADER_IDEMPOTENCY_KEY = "Idempotency-Key";

  private final NewsletterPublishService newsletterPublishService;

  @PostMapping(NewsletterPublishService.NEWSLETTERS_PATH)
  public void publish(
      @RequestHeader(HEADER_USER_ID) UUID ownerId,
      @RequestHeader(value = HEADER_IDEMPOTENCY_KEY, required = false) String headerKey,
      @Valid @RequestBody PublishNewsletterRequest request,
      HttpServletResponse response)
      throws IOException {
    // The header wins when both the header and the form field carry a key.
    final String idempotencyKey = headerKey != null ? headerKey : request.idempotencyKey();
    writeSavedResponse(newsletterPublishService.publish(ownerId, idempotencyKey, request), response);
  }

  /**
   * Writes status, headers and body straight to the servlet response. HttpHeaders groups values by
   * name, which would reorder interleaved headers.
   */
  static void writeSavedResponse(SavedResponse saved, HttpServletResponse response)
      throws IOException {
    response.setStatus(saved.statusCode());
    for (HeaderPair header : saved.headers()) {
      response.addHeader(header.name(), header.valueAsString());
    }
    final byte[] body = saved.body();
    response.setContentLength(body.length);
    if (body.length > 0) {
      final ServletOutputStream out = response.getOutputStream();
      out.write(body);
      out.flush();
    }
  }
}
