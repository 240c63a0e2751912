package io.sharedkey.platform.http.pipeline;

import io.sharedkey.platform.domain.auth.Identity;
import io.sharedkey.platform.domain.request.SignedRequest;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-request context passed down the pipeline: the request plus the identity established so
 * far. Immutable; stages hand a new instance to the next stage instead of mutating shared state.
 */
public final class InboundRequest {
  private final SignedRequest request;
  private final Identity identity;

  private InboundRequest(SignedRequest request, Identity identity) {
    this.request = Objects.requireNonNull(request, "request");
    this.identity = identity;
  }

  /** A request nobody has authenticated yet. */
  public static InboundRequest of(SignedRequest request) {
    return new InboundRequest(request, null);
  }

  public SignedRequest request() {
    return request;
  }

  public Optional<Identity> identity() {
    return Optional.ofNullable(identity);
  }

  /** Returns a copy carrying {@code identity}. */
  public InboundRequest withIdentity(Identity identity) {
    return new InboundRequest(request, Objects.requireNonNull(identity, "identity"));
  }

  @Override
  public String toString() {
    return "InboundRequest["
        + request.method()
        + " "
        + request.rawPath()
        + (identity == null ? "" : ", account=" + identity.account())
        + "]";
  }
}
