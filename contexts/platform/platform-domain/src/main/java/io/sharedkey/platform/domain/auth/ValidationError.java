package io.sharedkey.platform.domain.auth;

import java.util.Objects;
import java.util.Optional;

/**
 * Why a signed request was rejected.
 *
 * @param kind the failure category
 * @param reason short diagnostic; may be {@code null}. Never contains secret material.
 */
public record ValidationError(Kind kind, String reason) {

  /** Failure categories, each mapped to exactly one rejection response. */
  public enum Kind {
    /** Authorization header present but not of the form {@code <scheme> <account>:<signature>}. */
    MALFORMED_CREDENTIAL,
    /** The secret resolver knows no such account. */
    UNKNOWN_ACCOUNT,
    /** The presented signature does not match the computed one. */
    SIGNATURE_MISMATCH,
    /** The request timestamp is outside the accepted window. */
    EXPIRED,
    /** A header the scheme requires is absent or unreadable. */
    MISSING_REQUIRED_FIELD
  }

  public ValidationError {
    Objects.requireNonNull(kind, "kind");
  }

  public static ValidationError malformedCredential(String reason) {
    return new ValidationError(Kind.MALFORMED_CREDENTIAL, reason);
  }

  public static ValidationError unknownAccount(String reason) {
    return new ValidationError(Kind.UNKNOWN_ACCOUNT, reason);
  }

  public static ValidationError signatureMismatch(String reason) {
    return new ValidationError(Kind.SIGNATURE_MISMATCH, reason);
  }

  public static ValidationError expired(String reason) {
    return new ValidationError(Kind.EXPIRED, reason);
  }

  public static ValidationError missingRequiredField(String reason) {
    return new ValidationError(Kind.MISSING_REQUIRED_FIELD, reason);
  }

  /** Returns the reason, if one was given. */
  public Optional<String> reasonText() {
    return Optional.ofNullable(reason).filter(r -> !r.isBlank());
  }
}
