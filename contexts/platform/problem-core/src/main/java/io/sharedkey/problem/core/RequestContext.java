package io.sharedkey.problem.core;

/**
 * Minimal, immutable request metadata used to enrich {@link ProblemPayload#extensions()}.
 *
 * <p>Carries nothing credential-related: no account, no signature, no header values.
 *
 * @param method HTTP method, e.g. {@code GET}
 * @param path request path (no query string)
 * @param requestId application-level request id, if the caller sent one
 */
public record RequestContext(String method, String path, String requestId) {}
