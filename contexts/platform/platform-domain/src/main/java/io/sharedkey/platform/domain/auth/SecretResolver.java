package io.sharedkey.platform.domain.auth;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves an account identifier to its shared secret (typically backed by a secrets store or
 * vault).
 *
 * <p>Implementations are invoked concurrently by many requests and must be safe for that. The
 * lookup may block; callers hold no lock across it. An unknown account is a normal {@link
 * Optional#empty()} return, not an exception; exceptions signal that the lookup itself failed.
 */
@FunctionalInterface
public interface SecretResolver {

  /**
   * Looks up the secret for {@code account}.
   *
   * @param account non-blank account identifier as presented by the caller
   * @return the secret bytes, or empty if no such account exists
   */
  Optional<byte[]> resolve(String account);

  /**
   * Fixed, in-memory resolver. Secrets are copied on construction and on every lookup.
   *
   * @param secrets account to secret bytes
   * @return resolver backed by an immutable copy of {@code secrets}
   */
  static SecretResolver of(Map<String, byte[]> secrets) {
    Objects.requireNonNull(secrets, "secrets");
    Map<String, byte[]> copy = new HashMap<>();
    secrets.forEach((k, v) -> copy.put(k, v.clone()));
    Map<String, byte[]> frozen = Map.copyOf(copy);
    return account -> Optional.ofNullable(frozen.get(account)).map(byte[]::clone);
  }
}
