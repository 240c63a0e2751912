package io.sharedkey.platform.domain.auth;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of validating a signed request: either an {@link Identity} or a {@link
 * ValidationError}. Returned as a value; rejections never travel as exceptions.
 */
public sealed interface ValidationResult
    permits ValidationResult.Authenticated, ValidationResult.Rejected {

  static ValidationResult authenticated(Identity identity) {
    return new Authenticated(identity);
  }

  static ValidationResult rejected(ValidationError error) {
    return new Rejected(error);
  }

  /** Returns whether validation succeeded. */
  boolean isAuthenticated();

  /** Applies one of the two functions depending on the outcome. */
  <T> T fold(Function<Identity, T> onAuthenticated, Function<ValidationError, T> onRejected);

  /** Successful validation. */
  record Authenticated(Identity identity) implements ValidationResult {
    public Authenticated {
      Objects.requireNonNull(identity, "identity");
    }

    @Override
    public boolean isAuthenticated() {
      return true;
    }

    @Override
    public <T> T fold(Function<Identity, T> onAuthenticated, Function<ValidationError, T> onRejected) {
      return onAuthenticated.apply(identity);
    }
  }

  /** Failed validation. */
  record Rejected(ValidationError error) implements ValidationResult {
    public Rejected {
      Objects.requireNonNull(error, "error");
    }

    @Override
    public boolean isAuthenticated() {
      return false;
    }

    @Override
    public <T> T fold(Function<Identity, T> onAuthenticated, Function<ValidationError, T> onRejected) {
      return onRejected.apply(error);
    }
  }
}
