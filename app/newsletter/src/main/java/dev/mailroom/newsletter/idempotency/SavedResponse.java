package dev.mailroom.newsletter.idempotency;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * HTTP-like response produced by an idempotent operation and replayed verbatim on retries.
 *
 * <p>Headers keep insertion order and may repeat a name. The body is uninterpreted bytes.
 */
public record SavedResponse(int statusCode, List<HeaderPair> headers, byte[] body) {

  public SavedResponse {
    Objects.requireNonNull(headers, "headers");
    Objects.requireNonNull(body, "body");
    headers = List.copyOf(headers);
    body = body.clone();
  }

  public static Builder builder(int statusCode) {
    return new Builder(statusCode);
  }

  @Override
  public byte[] body() {
    return body.clone();
  }

  public List<String> headerValues(String name) {
    return headers.stream()
        .filter(header -> header.name().equalsIgnoreCase(name))
        .map(HeaderPair::valueAsString)
        .toList();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof SavedResponse that)) {
      return false;
    }
    return statusCode == that.statusCode
        && headers.equals(that.headers)
        && Arrays.equals(body, that.body);
  }

  @Override
  public int hashCode() {
    int result = Integer.hashCode(statusCode);
    result = 31 * result + headers.hashCode();
    return 31 * result + Arrays.hashCode(body);
  }

  @Override
  public String toString() {
    return "SavedResponse[statusCode=" + statusCode
        + ", headers=" + headers
        + ", bodyLength=" + body.length + "]";
  }

  public static final class Builder {

    private final int statusCode;
    private final List<HeaderPair> headers = new ArrayList<>();
    private byte[] body = new byte[0];

    private Builder(int statusCode) {
      this.statusCode = statusCode;
    }

    public Builder header(String name, String value) {
      headers.add(HeaderPair.of(name, value));
      return this;
    }

    public Builder header(String name, byte[] value) {
      headers.add(new HeaderPair(name, value));
      return this;
    }

    public Builder body(byte[] body) {
      this.body = Objects.requireNonNull(body, "body");
      return this;
    }

    public Builder body(String body) {
      return body(body.getBytes(StandardCharsets.UTF_8));
    }

    public SavedResponse build() {
      return new SavedResponse(statusCode, headers, body);
    }
  }
}
