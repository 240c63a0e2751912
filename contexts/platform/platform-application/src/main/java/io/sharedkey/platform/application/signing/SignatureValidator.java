package io.sharedkey.platform.application.signing;

import io.sharedkey.platform.domain.auth.Credential;
import io.sharedkey.platform.domain.auth.Identity;
import io.sharedkey.platform.domain.auth.SecretResolver;
import io.sharedkey.platform.domain.auth.ValidationError;
import io.sharedkey.platform.domain.auth.ValidationResult;
import io.sharedkey.platform.domain.request.RequestHeaders;
import io.sharedkey.platform.domain.request.SignedRequest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Verifies SharedKey-signed requests.
 *
 * <p>Order of checks:
 *
 * <ol>
 *   <li>parse the {@code Authorization} credential;
 *   <li>read the timestamp ({@code x-sk-date}, falling back to {@code Date});
 *   <li>freshness: older than {@code maxAge} or further in the future than the clock skew is
 *       {@code EXPIRED};
 *   <li>canonicalize (required content headers) before any secret is looked up, so a 412 never
 *       depends on whether the account exists;
 *   <li>resolve the secret;
 *   <li>HMAC and constant-time comparison.
 * </ol>
 *
 * <p>An unknown account still pays for a full HMAC (under a random decoy key) and comparison, so
 * it costs the same as a signature mismatch.
 *
 * <p>No state is kept between calls; instances are thread-safe. The only I/O is the call into the
 * {@link SecretResolver}, whose exceptions propagate unchanged.
 */
public final class SignatureValidator {

  private final SharedKeyScheme scheme;
  private final Clock clock;
  private final AuthorizationHeaderParser parser;
  private final CanonicalStringBuilder canonicalizer;
  private final byte[] decoyKey;

  public SignatureValidator(SharedKeyScheme scheme) {
    this(scheme, Clock.systemUTC());
  }

  public SignatureValidator(SharedKeyScheme scheme, Clock clock) {
    this.scheme = Objects.requireNonNull(scheme, "scheme");
    this.clock = (clock == null ? Clock.systemUTC() : clock);
    this.parser = new AuthorizationHeaderParser(scheme);
    this.canonicalizer = new CanonicalStringBuilder(scheme);
    this.decoyKey = new byte[scheme.algorithm().macLength()];
    new SecureRandom().nextBytes(decoyKey);
  }

  public SharedKeyScheme scheme() {
    return scheme;
  }

  /**
   * Validates a signed request.
   *
   * @param request the request (non-null)
   * @param secretResolver resolves the credential's account to its secret
   * @param maxAge maximum accepted age of the request timestamp (non-negative)
   * @return the authenticated identity, or the reason for rejection
   * @throws NullPointerException if any argument is null
   * @throws IllegalArgumentException if {@code maxAge} is negative
   */
  public ValidationResult validate(SignedRequest request, SecretResolver secretResolver, Duration maxAge) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(secretResolver, "secretResolver");
    Objects.requireNonNull(maxAge, "maxAge");
    if (maxAge.isNegative()) {
      throw new IllegalArgumentException("maxAge must not be negative");
    }

    // 1) Credential
    Step<Credential> credential = parser.parse(request.headers());
    if (!credential.isOk()) {
      return ValidationResult.rejected(credential.error());
    }

    // 2) Timestamp
    Step<String> timestampValue = timestampValue(request.headers());
    if (!timestampValue.isOk()) {
      return ValidationResult.rejected(timestampValue.error());
    }
    Optional<Instant> timestamp = RequestTimestamps.parse(timestampValue.value());
    if (timestamp.isEmpty()) {
      return ValidationResult.rejected(
          ValidationError.missingRequiredField(
              "Unparsable " + timestampHeaderIn(request.headers()) + " header; expected RFC 1123 date"));
    }

    // 3) Freshness
    Duration age = Duration.between(timestamp.get(), clock.instant());
    if (age.compareTo(maxAge) > 0) {
      return ValidationResult.rejected(ValidationError.expired("Request expired"));
    }
    if (age.isNegative() && age.negated().compareTo(scheme.clockSkew()) > 0) {
      return ValidationResult.rejected(ValidationError.expired("Request timestamp is in the future"));
    }

    // 4) Canonical string
    Step<CanonicalString> canonical = canonicalizer.build(request, timestampValue.value());
    if (!canonical.isOk()) {
      return ValidationResult.rejected(canonical.error());
    }

    // 5) Secret
    String account = credential.value().account();
    Optional<byte[]> resolved = secretResolver.resolve(account);
    byte[] secret = (resolved == null) ? null : resolved.filter(s -> s.length > 0).orElse(null);

    // 6) MAC, same work whether or not the account exists
    byte[] expected =
        scheme.algorithm().mac(secret != null ? secret : decoyKey, canonical.value().unsafeBytes());
    boolean matches = constantTimeEquals(expected, credential.value().signature());

    if (secret == null) {
      return ValidationResult.rejected(ValidationError.unknownAccount("Unknown account"));
    }
    if (!matches) {
      return ValidationResult.rejected(ValidationError.signatureMismatch("Signature mismatch"));
    }
    return ValidationResult.authenticated(Identity.authenticated(account, scheme.scheme()));
  }

  /** Returns the timestamp value that gets signed: designated header first, then {@code Date}. */
  private Step<String> timestampValue(RequestHeaders headers) {
    String header = timestampHeaderIn(headers);
    List<String> values = headers.all(header);
    if (values.isEmpty()) {
      return Step.fail(
          ValidationError.missingRequiredField(
              "Missing required header: " + scheme.timestampHeader()));
    }
    if (values.size() > 1) {
      return Step.fail(
          ValidationError.missingRequiredField(header + " header must appear once"));
    }
    return Step.ok(values.get(0));
  }

  private String timestampHeaderIn(RequestHeaders headers) {
    return headers.contains(scheme.timestampHeader())
        ? scheme.timestampHeader()
        : SharedKeyScheme.FALLBACK_TIMESTAMP_HEADER;
  }

  /** Compares every byte regardless of where the first difference is. Lengths are public. */
  static boolean constantTimeEquals(byte[] a, byte[] b) {
    if (a == null || b == null || a.length != b.length) return false;
    int r = 0;
    for (int i = 0; i < a.length; i++) r |= a[i] ^ b[i];
    return r == 0;
  }
}
