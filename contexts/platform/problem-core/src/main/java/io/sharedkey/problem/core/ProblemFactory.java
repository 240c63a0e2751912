package io.sharedkey.problem.core;

import io.sharedkey.platform.domain.error.ProblemTypes.ProblemType;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds RFC 7807-compatible problem payloads for rejected requests, adding the request id and
 * a stable {@code problemCode} extension.
 *
 * <p>Stateless and thread-safe.
 */
public final class ProblemFactory {

  /**
   * Builds a {@link ProblemPayload}.
   *
   * @param ctx request context (may be {@code null})
   * @param status HTTP status code
   * @param type problem type metadata (may be {@code null})
   * @param detail human-readable detail message (may be {@code null})
   * @return a populated {@link ProblemPayload}
   */
  public ProblemPayload build(RequestContext ctx, int status, ProblemType type, String detail) {
    Map<String, Object> ext = baseExtensions(ctx);
    if (type != null) {
      ext.put("problemCode", type.slug());
    }
    URI typeUri = (type != null) ? type.uri() : URI.create("about:blank");
    String title = (type != null) ? type.title() : null;
    return new ProblemPayload(typeUri, title, status, detail, safe(ctx == null ? null : ctx.path()), ext);
  }

  /** Builds a payload using the type's default status. */
  public ProblemPayload build(RequestContext ctx, ProblemType type, String detail) {
    return build(ctx, type.defaultStatus(), type, detail);
  }

  private static Map<String, Object> baseExtensions(RequestContext ctx) {
    Map<String, Object> m = new LinkedHashMap<>(3);
    if (ctx == null) {
      return m;
    }
    put(m, "requestId", ctx.requestId());
    put(m, "method", ctx.method());
    return m;
  }

  private static void put(Map<String, Object> m, String k, String v) {
    if (v != null && !v.isBlank()) {
      m.put(k, v);
    }
  }

  private static String safe(String s) {
    return (s == null || s.isBlank()) ? null : s;
  }
}
