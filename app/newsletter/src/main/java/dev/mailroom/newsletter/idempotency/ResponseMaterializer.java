/*
 * Where: idempotency core
 * What: converts a replayable response to the flat storage columns and back
 * Why: replays must be byte-identical, including repeated headers and non UTF-8 values
 */
package dev.mailroom.newsletter.idempotency;

import dev.mailroom.newsletter.model.StoredResponse;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class ResponseMaterializer {

  static final int MIN_STATUS_CODE = 100;
  static final int MAX_STATUS_CODE = 599;

  // RFC 7230 tchar, besides ALPHA and DIGIT.
  private static final String TOKEN_SYMBOLS = "!#$%&'*+-.^_`|~";

  public StoredResponse encode(SavedResponse response) {
    validate(response);
    final List<HeaderPair> headers = response.headers();
    final String[] names = new String[headers.size()];
    final byte[][] values = new byte[headers.size()][];
    for (int i = 0; i < headers.size(); i++) {
      names[i] = headers.get(i).name();
      values[i] = headers.get(i).value();
    }
    return new StoredResponse((short) response.statusCode(), names, values, response.body());
  }

  public SavedResponse decode(StoredResponse stored) {
    final String[] names = stored.headerNames();
    final byte[][] values = stored.headerValues();
    final List<HeaderPair> headers = new ArrayList<>(names.length);
    for (int i = 0; i < names.length; i++) {
      headers.add(new HeaderPair(names[i], values[i]));
    }
    return new SavedResponse(stored.statusCode(), headers, stored.body());
  }

  /**
   * Rejects responses that must never reach storage.
   *
   * @throws MalformedResponseException when the status code or a header is invalid
   */
  public void validate(SavedResponse response) {
    if (response == null) {
      throw new MalformedResponseException("operation returned no response");
    }
    final int statusCode = response.statusCode();
    if (statusCode < MIN_STATUS_CODE || statusCode > MAX_STATUS_CODE) {
      throw new MalformedResponseException("status code out of range: " + statusCode);
    }
    for (HeaderPair header : response.headers()) {
      if (!isToken(header.name())) {
        throw new MalformedResponseException("invalid header name: '" + header.name() + "'");
      }
      for (byte value : header.value()) {
        if (value == '\r' || value == '\n' || value == 0) {
          throw new MalformedResponseException(
              "header " + header.name() + " contains a forbidden control byte");
        }
      }
    }
  }

  private boolean isToken(String name) {
    if (name.isEmpty()) {
      return false;
    }
    for (int i = 0; i < name.length(); i++) {
      final char c = name.charAt(i);
      final boolean alphaNumeric =
          (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
      if (!alphaNumeric && TOKEN_SYMBOLS.indexOf(c) < 0) {
        return false;
      }
    }
    return true;
  }
}
