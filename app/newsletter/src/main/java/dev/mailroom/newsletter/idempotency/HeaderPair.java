package dev.mailroom.newsletter.idempotency;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One response header. The value is kept as raw bytes so non UTF-8 values survive storage.
 */
public record HeaderPair(String name, byte[] value) {

  public HeaderPair {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(value, "value");
    value = value.clone();
  }

  /** Header value given as text, encoded with the HTTP header charset (ISO-8859-1). */
  public static HeaderPair of(String name, String value) {
    return new HeaderPair(name, value.getBytes(StandardCharsets.ISO_8859_1));
  }

  @Override
  public byte[] value() {
    return value.clone();
  }

  public String valueAsString() {
    return new String(value, StandardCharsets.ISO_8859_1);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof HeaderPair that)) {
      return false;
    }
    return name.equals(that.name) && Arrays.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + Arrays.hashCode(value);
  }

  @Override
  public String toString() {
    return name + ": " + valueAsString();
  }
}
