package io.sharedkey.platform.application.signing;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/** Reads and writes request timestamps in RFC 1123 format ({@code Tue, 3 Jun 2008 11:05:30 GMT}). */
public final class RequestTimestamps {

  private static final DateTimeFormatter FORMAT = DateTimeFormatter.RFC_1123_DATE_TIME;

  private RequestTimestamps() {}

  /** Formats an instant in GMT, truncated to whole seconds. */
  public static String format(Instant instant) {
    return FORMAT.format(instant.atOffset(ZoneOffset.UTC));
  }

  /** Parses an RFC 1123 date; empty when blank or unparsable. */
  public static Optional<Instant> parse(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(FORMAT.parse(value.trim(), Instant::from));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }
}
