package io.sharedkey.platform.domain.auth;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Authenticated caller identity: the account whose secret produced the request signature plus an
 * extensible set of claims.
 *
 * <p>Created once per successful validation and scoped to a single request; an {@link
 * IdentityTransformer} may replace it with an enriched copy. Claims are multi-valued and keep
 * insertion order.
 *
 * @param account the authenticated account identifier
 * @param authenticationType how the identity was established (the authorization scheme token)
 * @param claims claim name to values; copied and unmodifiable
 */
public record Identity(String account, String authenticationType, Map<String, List<String>> claims) {

  /** Claim carrying the account name. */
  public static final String CLAIM_NAME = "name";

  /** Claim carrying the authentication method (scheme token). */
  public static final String CLAIM_AUTHENTICATION_METHOD = "authentication-method";

  public Identity {
    Objects.requireNonNull(account, "account");
    Objects.requireNonNull(authenticationType, "authenticationType");
    if (account.isBlank()) {
      throw new IllegalArgumentException("account must not be blank");
    }
    Map<String, List<String>> copy = new LinkedHashMap<>();
    if (claims != null) {
      claims.forEach((k, v) -> copy.put(Objects.requireNonNull(k, "claim name"), List.copyOf(v)));
    }
    claims = Collections.unmodifiableMap(copy);
  }

  /**
   * Identity for an account authenticated with {@code scheme}, carrying the {@link #CLAIM_NAME}
   * and {@link #CLAIM_AUTHENTICATION_METHOD} claims.
   */
  public static Identity authenticated(String account, String scheme) {
    return builder(account, scheme)
        .claim(CLAIM_NAME, account)
        .claim(CLAIM_AUTHENTICATION_METHOD, scheme)
        .build();
  }

  public static Builder builder(String account, String authenticationType) {
    return new Builder(account, authenticationType);
  }

  /** Returns all values of a claim, possibly empty. */
  public List<String> claimValues(String name) {
    return claims.getOrDefault(name, List.of());
  }

  /** Returns the first value of a claim. */
  public Optional<String> claim(String name) {
    List<String> vs = claimValues(name);
    return vs.isEmpty() ? Optional.empty() : Optional.of(vs.get(0));
  }

  /** Returns whether the claim carries {@code value}. */
  public boolean hasClaim(String name, String value) {
    return claimValues(name).contains(value);
  }

  /** Returns a builder seeded with this identity, for transformers. */
  public Builder toBuilder() {
    Builder b = new Builder(account, authenticationType);
    claims.forEach((k, vs) -> vs.forEach(v -> b.claim(k, v)));
    return b;
  }

  /** Collects claims for a new {@link Identity}. */
  public static final class Builder {
    private final String account;
    private final String authenticationType;
    private final Map<String, List<String>> claims = new LinkedHashMap<>();

    private Builder(String account, String authenticationType) {
      this.account = account;
      this.authenticationType = authenticationType;
    }

    /** Adds one value to a claim. */
    public Builder claim(String name, String value) {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(value, "value");
      claims.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
      return this;
    }

    public Identity build() {
      return new Identity(account, authenticationType, claims);
    }
  }
}
