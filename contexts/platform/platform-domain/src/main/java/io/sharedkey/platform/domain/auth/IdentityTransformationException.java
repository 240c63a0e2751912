package io.sharedkey.platform.domain.auth;

import io.sharedkey.platform.domain.error.HasProblemType;
import io.sharedkey.platform.domain.error.ProblemTypes;
import java.io.Serial;

/** Raised by an {@link IdentityTransformer} that cannot produce an identity. */
public class IdentityTransformationException extends RuntimeException implements HasProblemType {

  @Serial private static final long serialVersionUID = 1L;

  public IdentityTransformationException(String message) {
    super(message);
  }

  public IdentityTransformationException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public ProblemTypes.ProblemType type() {
    return ProblemTypes.IDENTITY_TRANSFORMATION_FAILED;
  }
}
