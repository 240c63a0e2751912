package io.sharedkey.platform.application.signing;

import io.sharedkey.platform.domain.auth.ValidationError;
import io.sharedkey.platform.domain.request.RequestHeaders;
import io.sharedkey.platform.domain.request.SignedRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Builds the {@link CanonicalString} shared by signer and verifier.
 *
 * <p>Layout (v1), lines joined by {@code \n}, no trailing newline:
 *
 * <pre>
 * METHOD
 * content digest header value, or empty
 * Content-Type value, or empty
 * timestamp header value exactly as sent
 * name:value           one line per extension header, lower-cased names sorted
 * raw path
 * key:v1,v2            one line per query key, keys and values escaped, then sorted
 * </pre>
 *
 * <p>Extension headers are those whose name starts with the scheme's prefix. Their values are
 * trimmed, inner whitespace runs collapse to one space, and repeated values are joined with
 * {@code ,} in arrival order.
 *
 * <p>Query keys and values stay as sent except that {@code %}, {@code :}, {@code ,} and control
 * characters are written as {@code %XX}. That keeps the query lines one-to-one with the raw query:
 * {@code a=b:c} and {@code a:b=c}, or {@code ids=1&ids=2} and {@code ids=1,2}, sign differently.
 * Nothing is percent-decoded, so canonicalization cannot fail on malformed escapes.
 *
 * <p>Stateless and thread-safe.
 */
public final class CanonicalStringBuilder {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final SharedKeyScheme scheme;

  public CanonicalStringBuilder(SharedKeyScheme scheme) {
    this.scheme = Objects.requireNonNull(scheme, "scheme");
  }

  /**
   * Canonicalizes {@code request}.
   *
   * @param request the request
   * @param timestampValue the timestamp header value that is being signed
   * @return the canonical string, or {@code MISSING_REQUIRED_FIELD} when the request declares a
   *     body without the content headers the scheme requires
   */
  public Step<CanonicalString> build(SignedRequest request, String timestampValue) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(timestampValue, "timestampValue");
    RequestHeaders headers = request.headers();

    String digest = single(headers, scheme.contentDigestHeader());
    String contentType = single(headers, SignedRequest.HEADER_CONTENT_TYPE);
    if (scheme.requireContentHeadersForBody() && request.declaresBody()) {
      if (contentType.isEmpty()) {
        return missing(SignedRequest.HEADER_CONTENT_TYPE);
      }
      if (digest.isEmpty()) {
        return missing(scheme.contentDigestHeader());
      }
    }

    StringBuilder sb = new StringBuilder(256);
    sb.append(request.method()).append('\n');
    sb.append(digest).append('\n');
    sb.append(contentType).append('\n');
    sb.append(timestampValue.trim()).append('\n');
    appendExtensionHeaders(sb, headers);
    appendResource(sb, request);
    return Step.ok(new CanonicalString(sb.toString()));
  }

  /** Canonicalized resource: raw path, then {@code \nkey:v1,v2} per query key. */
  String canonicalResource(SignedRequest request) {
    StringBuilder sb = new StringBuilder();
    appendResource(sb, request);
    return sb.toString();
  }

  private static void appendResource(StringBuilder sb, SignedRequest request) {
    sb.append(request.rawPath());
    for (Map.Entry<String, List<String>> e : queryParameters(request.rawQuery()).entrySet()) {
      List<String> vs = e.getValue();
      vs.sort(null);
      sb.append('\n').append(e.getKey()).append(':').append(String.join(",", vs));
    }
  }

  private void appendExtensionHeaders(StringBuilder sb, RequestHeaders headers) {
    TreeMap<String, String> signed = new TreeMap<>();
    for (String name : headers.names()) {
      if (name.startsWith(scheme.headerPrefix())) {
        List<String> normalized = new ArrayList<>();
        for (String v : headers.all(name)) {
          normalized.add(WHITESPACE.matcher(v.trim()).replaceAll(" "));
        }
        signed.put(name, String.join(",", normalized));
      }
    }
    signed.forEach((name, value) -> sb.append(name).append(':').append(value).append('\n'));
  }

  private static TreeMap<String, List<String>> queryParameters(String rawQuery) {
    TreeMap<String, List<String>> params = new TreeMap<>();
    if (rawQuery.isEmpty()) {
      return params;
    }
    for (String part : rawQuery.split("&")) {
      if (part.isEmpty()) {
        continue;
      }
      int eq = part.indexOf('=');
      String k = eq >= 0 ? part.substring(0, eq) : part;
      String v = eq >= 0 ? part.substring(eq + 1) : "";
      params.computeIfAbsent(escape(k), x -> new ArrayList<>()).add(escape(v));
    }
    return params;
  }

  /** Percent-encodes the characters that delimit query lines; everything else stays raw. */
  static String escape(String raw) {
    StringBuilder out = null;
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      boolean delimiter = c == '%' || c == ':' || c == ',' || c < 0x20 || c == 0x7f;
      if (delimiter && out == null) {
        out = new StringBuilder(raw.length() + 8).append(raw, 0, i);
      }
      if (out != null) {
        if (delimiter) {
          out.append('%').append(String.format("%02X", (int) c));
        } else {
          out.append(c);
        }
      }
    }
    return out == null ? raw : out.toString();
  }

  private static String single(RequestHeaders headers, String name) {
    return String.join(",", headers.all(name)).trim();
  }

  private static Step<CanonicalString> missing(String header) {
    return Step.fail(
        ValidationError.missingRequiredField(
            "Missing required header for request with body: " + header));
  }
}
