package io.sharedkey.platform.application.signing;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Wire-level parameters of the SharedKey signing scheme, fixed per deployment.
 *
 * <p>Signer and verifier must be built from equal schemes or signatures will not match.
 */
public final class SharedKeyScheme {

  public static final String DEFAULT_SCHEME = "SharedKey";
  public static final String DEFAULT_TIMESTAMP_HEADER = "x-sk-date";
  public static final String FALLBACK_TIMESTAMP_HEADER = "Date";
  public static final String DEFAULT_HEADER_PREFIX = "x-sk-";
  public static final String DEFAULT_CONTENT_DIGEST_HEADER = "Content-Digest";
  public static final Duration DEFAULT_CLOCK_SKEW = Duration.ofMinutes(1);

  private static final SharedKeyScheme DEFAULTS = builder().build();

  private final String scheme;
  private final String timestampHeader;
  private final String headerPrefix;
  private final String contentDigestHeader;
  private final HmacAlgorithm algorithm;
  private final Duration clockSkew;
  private final boolean requireContentHeadersForBody;

  private SharedKeyScheme(Builder b) {
    this.scheme = requireToken(b.scheme, "scheme");
    this.timestampHeader = requireToken(b.timestampHeader, "timestampHeader");
    this.headerPrefix = requireToken(b.headerPrefix, "headerPrefix").toLowerCase(Locale.ROOT);
    this.contentDigestHeader = requireToken(b.contentDigestHeader, "contentDigestHeader");
    this.algorithm = Objects.requireNonNull(b.algorithm, "algorithm");
    this.clockSkew = Objects.requireNonNull(b.clockSkew, "clockSkew");
    if (clockSkew.isNegative()) {
      throw new IllegalArgumentException("clockSkew must not be negative");
    }
    this.requireContentHeadersForBody = b.requireContentHeadersForBody;
  }

  /** Scheme with all defaults: {@code SharedKey}, {@code x-sk-date}, HMAC-SHA256. */
  public static SharedKeyScheme defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Token that precedes the credential in the {@code Authorization} header. */
  public String scheme() {
    return scheme;
  }

  /** Header carrying the RFC 1123 request timestamp. */
  public String timestampHeader() {
    return timestampHeader;
  }

  /** Lower-cased prefix selecting the extension headers that are signed. */
  public String headerPrefix() {
    return headerPrefix;
  }

  /** Header carrying the content digest. */
  public String contentDigestHeader() {
    return contentDigestHeader;
  }

  public HmacAlgorithm algorithm() {
    return algorithm;
  }

  /** How far in the future a timestamp may lie before it is rejected. */
  public Duration clockSkew() {
    return clockSkew;
  }

  /** Whether requests with a body must carry content type and digest headers. */
  public boolean requireContentHeadersForBody() {
    return requireContentHeadersForBody;
  }

  private static String requireToken(String v, String name) {
    Objects.requireNonNull(v, name);
    String t = v.trim();
    if (t.isEmpty() || t.chars().anyMatch(c -> c <= ' ' || c == ':')) {
      throw new IllegalArgumentException(name + " must be a non-blank token, got: '" + v + "'");
    }
    return t;
  }

  @Override
  public String toString() {
    return "SharedKeyScheme["
        + scheme
        + ", "
        + algorithm.jcaName()
        + ", timestamp="
        + timestampHeader
        + ", prefix="
        + headerPrefix
        + "]";
  }

  /** Builder seeded with the defaults. */
  public static final class Builder {
    private String scheme = DEFAULT_SCHEME;
    private String timestampHeader = DEFAULT_TIMESTAMP_HEADER;
    private String headerPrefix = DEFAULT_HEADER_PREFIX;
    private String contentDigestHeader = DEFAULT_CONTENT_DIGEST_HEADER;
    private HmacAlgorithm algorithm = HmacAlgorithm.HMAC_SHA256;
    private Duration clockSkew = DEFAULT_CLOCK_SKEW;
    private boolean requireContentHeadersForBody = true;

    private Builder() {}

    public Builder scheme(String scheme) {
      this.scheme = scheme;
      return this;
    }

    public Builder timestampHeader(String timestampHeader) {
      this.timestampHeader = timestampHeader;
      return this;
    }

    public Builder headerPrefix(String headerPrefix) {
      this.headerPrefix = headerPrefix;
      return this;
    }

    public Builder contentDigestHeader(String contentDigestHeader) {
      this.contentDigestHeader = contentDigestHeader;
      return this;
    }

    public Builder algorithm(HmacAlgorithm algorithm) {
      this.algorithm = algorithm;
      return this;
    }

    public Builder clockSkew(Duration clockSkew) {
      this.clockSkew = clockSkew;
      return this;
    }

    public Builder requireContentHeadersForBody(boolean require) {
      this.requireContentHeadersForBody = require;
      return this;
    }

    public SharedKeyScheme build() {
      return new SharedKeyScheme(this);
    }
  }
}
