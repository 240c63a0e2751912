package io.sharedkey.platform.domain.request;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable view of an inbound HTTP request as seen by the signature validator.
 *
 * <p>Path and query are kept in their raw, still percent-encoded form: the canonical signing
 * string is computed over exactly what travelled on the wire.
 *
 * @param method HTTP method, upper-cased
 * @param rawPath raw request path, {@code "/"} when empty
 * @param rawQuery raw query string without the leading {@code ?}, empty when absent
 * @param headers request headers
 */
public record SignedRequest(String method, String rawPath, String rawQuery, RequestHeaders headers) {

  public static final String HEADER_AUTHORIZATION = "Authorization";
  public static final String HEADER_CONTENT_TYPE = "Content-Type";
  public static final String HEADER_CONTENT_LENGTH = "Content-Length";
  public static final String HEADER_TRANSFER_ENCODING = "Transfer-Encoding";

  public SignedRequest {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(headers, "headers");
    if (method.isBlank()) {
      throw new IllegalArgumentException("method must not be blank");
    }
    method = method.trim().toUpperCase(Locale.ROOT);
    rawPath = (rawPath == null || rawPath.isEmpty()) ? "/" : rawPath;
    rawQuery = (rawQuery == null) ? "" : rawQuery;
  }

  /**
   * Builds a request view from a target URI (only path and query are used).
   *
   * @param method HTTP method
   * @param target absolute or relative request URI
   * @param headers request headers
   */
  public static SignedRequest of(String method, URI target, RequestHeaders headers) {
    Objects.requireNonNull(target, "target");
    return new SignedRequest(method, target.getRawPath(), target.getRawQuery(), headers);
  }

  /** Returns path plus query, as used to identify the requested resource. */
  public String target() {
    return rawQuery.isEmpty() ? rawPath : rawPath + "?" + rawQuery;
  }

  /** Returns a copy with one header replaced. */
  public SignedRequest withHeader(String name, String value) {
    return new SignedRequest(method, rawPath, rawQuery, headers.with(name, value));
  }

  /**
   * Returns whether the request announces a body: a positive {@code Content-Length} or any
   * {@code Transfer-Encoding}. An unparsable length counts as a body.
   */
  public boolean declaresBody() {
    if (headers.contains(HEADER_TRANSFER_ENCODING)) {
      return true;
    }
    for (String v : headers.all(HEADER_CONTENT_LENGTH)) {
      try {
        if (Long.parseLong(v.trim()) > 0) {
          return true;
        }
      } catch (NumberFormatException e) {
        return true;
      }
    }
    return false;
  }
}
