package io.sharedkey.platform.application.signing;

import io.sharedkey.platform.domain.auth.ValidationError;
import java.util.Objects;

/**
 * Intermediate result of one validation step: a value, or the {@link ValidationError} that ends
 * validation.
 *
 * @param <T> type of the value
 */
public final class Step<T> {
  private final T value;
  private final ValidationError error;

  private Step(T value, ValidationError error) {
    this.value = value;
    this.error = error;
  }

  public static <T> Step<T> ok(T value) {
    return new Step<>(Objects.requireNonNull(value, "value"), null);
  }

  public static <T> Step<T> fail(ValidationError error) {
    return new Step<>(null, Objects.requireNonNull(error, "error"));
  }

  public boolean isOk() {
    return error == null;
  }

  /**
   * @throws IllegalStateException if this step failed
   */
  public T value() {
    if (error != null) {
      throw new IllegalStateException("step failed: " + error.kind());
    }
    return value;
  }

  /**
   * @throws IllegalStateException if this step succeeded
   */
  public ValidationError error() {
    if (error == null) {
      throw new IllegalStateException("step succeeded");
    }
    return error;
  }

  @Override
  public String toString() {
    return isOk() ? "Step[ok]" : "Step[" + error.kind() + "]";
  }
}
