package io.sharedkey.platform.application.signing;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/** The exact byte sequence that is signed: UTF-8 lines joined by {@code \n}. */
public final class CanonicalString {
  private final byte[] bytes;

  CanonicalString(String text) {
    this.bytes = Objects.requireNonNull(text, "text").getBytes(StandardCharsets.UTF_8);
  }

  /** Returns a copy of the signed bytes. */
  public byte[] bytes() {
    return bytes.clone();
  }

  /** Returns the signed bytes decoded as UTF-8. */
  public String text() {
    return new String(bytes, StandardCharsets.UTF_8);
  }

  byte[] unsafeBytes() {
    return bytes;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof CanonicalString other && Arrays.equals(bytes, other.bytes));
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override
  public String toString() {
    return text();
  }
}
