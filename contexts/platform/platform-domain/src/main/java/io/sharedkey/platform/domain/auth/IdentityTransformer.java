package io.sharedkey.platform.domain.auth;

/**
 * Host-supplied hook that turns the raw validated identity into the identity the application
 * sees (enrichment, normalization, claim mapping).
 *
 * <p>Must be safe for concurrent invocation. Failures are reported by throwing {@link
 * IdentityTransformationException}; the pipeline treats any exception as an internal error, never
 * as an authentication rejection.
 */
@FunctionalInterface
public interface IdentityTransformer {

  /**
   * @param resourceIdentifier the requested resource (path plus query)
   * @param identity the identity established by signature validation
   * @return the identity to attach to the request (never {@code null})
   */
  Identity transform(String resourceIdentifier, Identity identity);
}
