package io.sharedkey.platform.application.signing;

import io.sharedkey.platform.domain.auth.Credential;
import io.sharedkey.platform.domain.auth.ValidationError;
import io.sharedkey.platform.domain.request.RequestHeaders;
import io.sharedkey.platform.domain.request.SignedRequest;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

/**
 * Parses {@code Authorization: <scheme> <account>:<base64-signature>}.
 *
 * <p>Strict: exactly one space after the scheme token, the credential split on its last colon, a
 * whitespace-free account, and a signature in canonical padded Base64 that decodes to exactly the
 * algorithm's MAC length. Anything else is rejected; nothing is guessed.
 */
public final class AuthorizationHeaderParser {

  private final String scheme;
  private final int macLength;

  public AuthorizationHeaderParser(SharedKeyScheme scheme) {
    Objects.requireNonNull(scheme, "scheme");
    this.scheme = scheme.scheme();
    this.macLength = scheme.algorithm().macLength();
  }

  /**
   * Extracts the credential from the request headers.
   *
   * @return the credential, {@code MISSING_REQUIRED_FIELD} when no {@code Authorization} header
   *     is present, {@code MALFORMED_CREDENTIAL} otherwise
   */
  public Step<Credential> parse(RequestHeaders headers) {
    List<String> values = headers.all(SignedRequest.HEADER_AUTHORIZATION);
    if (values.isEmpty()) {
      return Step.fail(
          ValidationError.missingRequiredField(
              "Missing required header: " + SignedRequest.HEADER_AUTHORIZATION));
    }
    if (values.size() > 1) {
      return malformed("Authorization header must appear once");
    }
    return parse(values.get(0));
  }

  /** Parses a single header value. */
  public Step<Credential> parse(String headerValue) {
    String value = headerValue.trim();
    String prefix = scheme + " ";
    if (!value.startsWith(prefix)) {
      return malformed("Authorization scheme must be " + scheme);
    }
    String credential = value.substring(prefix.length());
    int colon = credential.lastIndexOf(':');
    if (colon <= 0 || colon == credential.length() - 1) {
      return malformed("Credential must be <account>:<signature>");
    }
    String account = credential.substring(0, colon);
    String encoded = credential.substring(colon + 1);
    if (!isToken(account)) {
      return malformed("Account contains illegal characters");
    }

    byte[] signature;
    try {
      signature = Base64.getDecoder().decode(encoded);
    } catch (IllegalArgumentException e) {
      return malformed("Signature is not valid Base64");
    }
    // Re-encoding must round-trip: rejects missing padding and non-zero trailing bits.
    if (!Base64.getEncoder().encodeToString(signature).equals(encoded)) {
      return malformed("Signature is not canonical Base64");
    }
    if (signature.length != macLength) {
      return malformed("Signature length must be " + macLength + " bytes");
    }
    return Step.ok(new Credential(account, signature));
  }

  private static boolean isToken(String s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c <= ' ' || c == 0x7f) {
        return false;
      }
    }
    return true;
  }

  private static Step<Credential> malformed(String reason) {
    return Step.fail(ValidationError.malformedCredential(reason));
  }
}
