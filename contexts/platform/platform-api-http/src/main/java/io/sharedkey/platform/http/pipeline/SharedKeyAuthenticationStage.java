package io.sharedkey.platform.http.pipeline;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.sharedkey.platform.application.signing.SignatureValidator;
import io.sharedkey.platform.domain.auth.Identity;
import io.sharedkey.platform.domain.auth.IdentityTransformer;
import io.sharedkey.platform.domain.auth.SecretResolver;
import io.sharedkey.platform.domain.auth.ValidationError;
import io.sharedkey.platform.domain.auth.ValidationResult;
import io.sharedkey.platform.domain.error.HasProblemType;
import io.sharedkey.platform.domain.error.ProblemTypes;
import io.sharedkey.platform.domain.error.ProblemTypes.ProblemType;
import io.sharedkey.platform.domain.request.SignedRequest;
import io.sharedkey.problem.core.ProblemFactory;
import io.sharedkey.problem.core.RequestContext;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pipeline stage that authenticates SharedKey-signed requests.
 *
 * <p>Outcome mapping:
 *
 * <ul>
 *   <li>authenticated: the (optionally transformed) identity is attached and the request
 *       forwarded;
 *   <li>malformed credential, unknown account, signature mismatch: {@code 401} with {@code
 *       WWW-Authenticate: <scheme>} and a generic detail, byte-identical across the three;
 *   <li>expired: the configured expired status ({@code 403} unless set to {@code 401});
 *   <li>missing required field: {@code 412} naming the missing header.
 * </ul>
 *
 * <p>A failing {@link SecretResolver} yields {@code 503}, a failing {@link IdentityTransformer}
 * {@code 500}. Neither is reported as an authentication failure. A transformer exception that
 * implements {@link HasProblemType} names the problem type of the 500 body. If the handling thread is
 * interrupted during validation the request is abandoned with a {@link CancellationException}.
 *
 * <p>Outcomes are counted in Micrometer under {@code security.sharedkey.*}.
 *
 * <p>Holds no per-request state; one instance serves all requests concurrently.
 */
public final class SharedKeyAuthenticationStage implements RequestStage {

  private static final Logger LOG = LoggerFactory.getLogger(SharedKeyAuthenticationStage.class);

  public static final Duration DEFAULT_MAX_AGE = Duration.ofMinutes(5);
  public static final String HEADER_WWW_AUTHENTICATE = "WWW-Authenticate";
  public static final String HEADER_REQUEST_ID = "X-Request-Id";

  static final String AUTHENTICATION_FAILED_DETAIL = "Authentication failed";

  private static final int MAX_REQUEST_ID_LENGTH = 128;

  private final SignatureValidator validator;
  private final SecretResolver secretResolver;
  private final Duration maxAge;
  private final IdentityTransformer identityTransformer;
  private final int expiredStatus;
  private final boolean distinguishUnknownAccountInLogs;
  private final MeterRegistry metrics;
  private final ProblemFactory problems = new ProblemFactory();

  private SharedKeyAuthenticationStage(Builder b) {
    this.validator = Objects.requireNonNull(b.validator, "validator");
    this.secretResolver = Objects.requireNonNull(b.secretResolver, "secretResolver");
    this.maxAge = Objects.requireNonNull(b.maxAge, "maxAge");
    if (maxAge.isNegative()) {
      throw new IllegalArgumentException("maxAge must not be negative");
    }
    if (b.expiredStatus != 401 && b.expiredStatus != 403) {
      throw new IllegalArgumentException("expiredStatus must be 401 or 403, got " + b.expiredStatus);
    }
    this.identityTransformer = b.identityTransformer;
    this.expiredStatus = b.expiredStatus;
    this.distinguishUnknownAccountInLogs = b.distinguishUnknownAccountInLogs;
    this.metrics = (b.metrics == null ? new SimpleMeterRegistry() : b.metrics);
  }

  public static Builder builder(SignatureValidator validator, SecretResolver secretResolver) {
    return new Builder(validator, secretResolver);
  }

  public Duration maxAge() {
    return maxAge;
  }

  public int expiredStatus() {
    return expiredStatus;
  }

  @Override
  public StageResponse handle(InboundRequest request, Next next) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(next, "next");
    SignedRequest signed = request.request();
    RequestContext ctx = contextOf(signed);

    ValidationResult result;
    try {
      result = validator.validate(signed, this::resolveSecret, maxAge);
    } catch (SecretResolutionFailure e) {
      LOG.warn(
          "Secret resolution failed for {} {}: {}",
          signed.method(),
          signed.rawPath(),
          e.getCause().getClass().getName());
      metrics.counter("security.sharedkey.collaborator.failed", "collaborator", "secret-resolver").increment();
      return StageResponse.rejected(
          problems.build(ctx, ProblemTypes.SECRET_RESOLUTION_FAILED, "Secret resolution failed"),
          "Service Unavailable",
          Map.of());
    }

    if (Thread.currentThread().isInterrupted()) {
      throw new CancellationException("Request abandoned during authentication");
    }

    if (result instanceof ValidationResult.Rejected rejected) {
      return reject(ctx, signed, rejected.error());
    }
    Identity identity = ((ValidationResult.Authenticated) result).identity();
    metrics.counter("security.sharedkey.authenticated").increment();
    LOG.debug("Authenticated account {} for {} {}", identity.account(), signed.method(), signed.rawPath());

    if (identityTransformer != null) {
      try {
        identity = transform(signed, identity);
      } catch (TransformationFailure e) {
        metrics.counter("security.sharedkey.collaborator.failed", "collaborator", "identity-transformer").increment();
        return StageResponse.rejected(
            problems.build(ctx, 500, e.type, "Identity transformation failed"),
            "Internal Server Error",
            Map.of());
      }
    }
    return next.proceed(request.withIdentity(identity));
  }

  private Optional<byte[]> resolveSecret(String account) {
    try {
      return secretResolver.resolve(account);
    } catch (RuntimeException e) {
      throw new SecretResolutionFailure(e);
    }
  }

  private Identity transform(SignedRequest signed, Identity identity) {
    Identity out;
    try {
      out = identityTransformer.transform(signed.target(), identity);
    } catch (RuntimeException e) {
      LOG.error("Identity transformer failed for account {}", identity.account(), e);
      ProblemType type =
          (e instanceof HasProblemType typed && typed.type() != null)
              ? typed.type()
              : ProblemTypes.IDENTITY_TRANSFORMATION_FAILED;
      throw new TransformationFailure(type);
    }
    if (out == null) {
      LOG.error("Identity transformer returned null for account {}", identity.account());
      throw new TransformationFailure(ProblemTypes.IDENTITY_TRANSFORMATION_FAILED);
    }
    return out;
  }

  private StageResponse reject(RequestContext ctx, SignedRequest signed, ValidationError error) {
    ValidationError.Kind reported = reportedKind(error.kind());
    metrics.counter("security.sharedkey.rejected", "kind", reported.name()).increment();
    LOG.debug("SharedKey rejection {} for {} {}", reported, signed.method(), signed.rawPath());
    return switch (error.kind()) {
      case MALFORMED_CREDENTIAL, UNKNOWN_ACCOUNT, SIGNATURE_MISMATCH -> StageResponse.rejected(
          problems.build(ctx, ProblemTypes.AUTHENTICATION_FAILED, AUTHENTICATION_FAILED_DETAIL),
          "Unauthorized",
          challenge());
      case EXPIRED -> StageResponse.rejected(
          problems.build(ctx, expiredStatus, ProblemTypes.REQUEST_EXPIRED, error.reason()),
          error.reason(),
          expiredStatus == 401 ? challenge() : Map.of());
      case MISSING_REQUIRED_FIELD -> StageResponse.rejected(
          problems.build(ctx, ProblemTypes.PRECONDITION_FAILED, error.reason()),
          error.reason(),
          Map.of());
    };
  }

  private Map<String, String> challenge() {
    return Map.of(HEADER_WWW_AUTHENTICATE, validator.scheme().scheme());
  }

  /** Kind as it appears in logs and metrics; unknown accounts fold into mismatches unless enabled. */
  private ValidationError.Kind reportedKind(ValidationError.Kind kind) {
    if (kind == ValidationError.Kind.UNKNOWN_ACCOUNT && !distinguishUnknownAccountInLogs) {
      return ValidationError.Kind.SIGNATURE_MISMATCH;
    }
    return kind;
  }

  private static RequestContext contextOf(SignedRequest signed) {
    String requestId =
        signed
            .headers()
            .first(HEADER_REQUEST_ID)
            .map(String::trim)
            .filter(SharedKeyAuthenticationStage::isSafeRequestId)
            .orElse(null);
    return new RequestContext(signed.method(), signed.rawPath(), requestId);
  }

  private static boolean isSafeRequestId(String id) {
    if (id.isEmpty() || id.length() > MAX_REQUEST_ID_LENGTH) {
      return false;
    }
    return id.chars().allMatch(c -> c > ' ' && c < 0x7f);
  }

  /** Carries a resolver exception out of the validator, which otherwise propagates it as-is. */
  private static final class SecretResolutionFailure extends RuntimeException {
    private static final long serialVersionUID = 1L;

    SecretResolutionFailure(RuntimeException cause) {
      super(cause);
    }
  }

  /** Problem type of a failed transformation; the status stays 500 whatever the type says. */
  private static final class TransformationFailure extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final transient ProblemType type;

    TransformationFailure(ProblemType type) {
      super(null, null, false, false);
      this.type = type;
    }
  }

  /** Builder; {@code maxAge} defaults to five minutes, {@code expiredStatus} to 403. */
  public static final class Builder {
    private final SignatureValidator validator;
    private final SecretResolver secretResolver;
    private Duration maxAge = DEFAULT_MAX_AGE;
    private IdentityTransformer identityTransformer;
    private int expiredStatus = 403;
    private boolean distinguishUnknownAccountInLogs;
    private MeterRegistry metrics;

    private Builder(SignatureValidator validator, SecretResolver secretResolver) {
      this.validator = validator;
      this.secretResolver = secretResolver;
    }

    public Builder maxAge(Duration maxAge) {
      this.maxAge = maxAge;
      return this;
    }

    public Builder identityTransformer(IdentityTransformer identityTransformer) {
      this.identityTransformer = identityTransformer;
      return this;
    }

    public Builder expiredStatus(int expiredStatus) {
      this.expiredStatus = expiredStatus;
      return this;
    }

    public Builder distinguishUnknownAccountInLogs(boolean distinguish) {
      this.distinguishUnknownAccountInLogs = distinguish;
      return this;
    }

    /** Registry for outcome counters; a private {@link SimpleMeterRegistry} when not set. */
    public Builder meterRegistry(MeterRegistry metrics) {
      this.metrics = metrics;
      return this;
    }

    public SharedKeyAuthenticationStage build() {
      return new SharedKeyAuthenticationStage(this);
    }
  }
}
