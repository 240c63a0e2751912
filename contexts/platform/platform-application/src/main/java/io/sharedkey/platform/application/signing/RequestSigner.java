package io.sharedkey.platform.application.signing;

import io.sharedkey.platform.domain.request.SignedRequest;
import java.time.Clock;
import java.util.Base64;
import java.util.Objects;

/**
 * Client-side counterpart of {@link SignatureValidator}: stamps and signs outgoing requests with
 * the same {@link CanonicalStringBuilder}, so both sides agree byte-for-byte.
 *
 * <p>Thread-safe. Callers own the secret; it is not retained.
 */
public final class RequestSigner {

  private final SharedKeyScheme scheme;
  private final Clock clock;
  private final CanonicalStringBuilder canonicalizer;

  public RequestSigner(SharedKeyScheme scheme) {
    this(scheme, Clock.systemUTC());
  }

  public RequestSigner(SharedKeyScheme scheme, Clock clock) {
    this.scheme = Objects.requireNonNull(scheme, "scheme");
    this.clock = (clock == null ? Clock.systemUTC() : clock);
    this.canonicalizer = new CanonicalStringBuilder(scheme);
  }

  /**
   * Returns a copy of {@code request} carrying a timestamp header (added when absent) and the
   * {@code Authorization} header.
   *
   * @param request the request to sign
   * @param account account identifier
   * @param secret the account's shared secret
   * @throws IllegalStateException if the request cannot be canonicalized (body without content
   *     headers)
   */
  public SignedRequest sign(SignedRequest request, String account, byte[] secret) {
    Objects.requireNonNull(request, "request");
    SignedRequest stamped = request;
    if (!request.headers().contains(scheme.timestampHeader())
        && !request.headers().contains(SharedKeyScheme.FALLBACK_TIMESTAMP_HEADER)) {
      stamped = request.withHeader(scheme.timestampHeader(), RequestTimestamps.format(clock.instant()));
    }
    return stamped.withHeader(SignedRequest.HEADER_AUTHORIZATION, authorization(stamped, account, secret));
  }

  /**
   * Computes the {@code Authorization} header value for a request that already carries its
   * timestamp header.
   *
   * @throws IllegalStateException if the timestamp is missing or the request cannot be
   *     canonicalized
   */
  public String authorization(SignedRequest request, String account, byte[] secret) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(account, "account");
    Objects.requireNonNull(secret, "secret");
    if (account.isBlank()) {
      throw new IllegalArgumentException("account must not be blank");
    }
    String timestamp =
        request
            .headers()
            .first(scheme.timestampHeader())
            .or(() -> request.headers().first(SharedKeyScheme.FALLBACK_TIMESTAMP_HEADER))
            .orElseThrow(() -> new IllegalStateException("request has no timestamp header"));

    Step<CanonicalString> canonical = canonicalizer.build(request, timestamp);
    if (!canonical.isOk()) {
      throw new IllegalStateException(canonical.error().reason());
    }
    byte[] mac = scheme.algorithm().mac(secret, canonical.value().unsafeBytes());
    return scheme.scheme() + " " + account + ":" + Base64.getEncoder().encodeToString(mac);
  }
}
