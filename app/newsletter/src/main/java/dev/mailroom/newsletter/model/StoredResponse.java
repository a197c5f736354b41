/*
 * Where: newsletter domain model
 * What: response columns of an idempotency row in their storage shape
 * Why: keeps the flat array layout of the table separate from the replayable response type
 */
package dev.mailroom.newsletter.model;

import java.util.Arrays;
import java.util.Objects;

public record StoredResponse(
    short statusCode, String[] headerNames, byte[][] headerValues, byte[] body) {

  public StoredResponse {
    Objects.requireNonNull(headerNames, "headerNames");
    Objects.requireNonNull(headerValues, "headerValues");
    Objects.requireNonNull(body, "body");
    if (headerNames.length != headerValues.length) {
      throw new IllegalArgumentException(
          "header names and values differ in length: "
              + headerNames.length
              + " != "
              + headerValues.length);
    }
    headerNames = headerNames.clone();
    headerValues = deepCopy(headerValues);
    body = body.clone();
  }

  @Override
  public String[] headerNames() {
    return headerNames.clone();
  }

  @Override
  public byte[][] headerValues() {
    return deepCopy(headerValues);
  }

  @Override
  public byte[] body() {
    return body.clone();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof StoredResponse that)) {
      return false;
    }
    return statusCode == that.statusCode
        && Arrays.equals(headerNames, that.headerNames)
        && Arrays.deepEquals(headerValues, that.headerValues)
        && Arrays.equals(body, that.body);
  }

  @Override
  public int hashCode() {
    int result = Short.hashCode(statusCode);
    result = 31 * result + Arrays.hashCode(headerNames);
    result = 31 * result + Arrays.deepHashCode(headerValues);
    return 31 * result + Arrays.hashCode(body);
  }

  @Override
  public String toString() {
    return "StoredResponse[statusCode=" + statusCode
        + ", headerNames=" + Arrays.toString(headerNames)
        + ", bodyLength=" + body.length + "]";
  }

  private static byte[][] deepCopy(byte[][] values) {
    final byte[][] copy = new byte[values.length][];
    for (int i = 0; i < values.length; i++) {
      copy[i] = Objects.requireNonNull(values[i], "header value").clone();
    }
    return copy;
  }
}
