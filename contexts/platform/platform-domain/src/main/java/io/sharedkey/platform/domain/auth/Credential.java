package io.sharedkey.platform.domain.auth;

import java.util.Arrays;
import java.util.Objects;

/**
 * Credential parsed from the {@code Authorization} header: the account the caller claims to be
 * and the signature it presented.
 *
 * @param account non-blank account identifier
 * @param signature raw (Base64-decoded) signature bytes; copied on the way in and out
 */
public record Credential(String account, byte[] signature) {

  public Credential {
    Objects.requireNonNull(account, "account");
    Objects.requireNonNull(signature, "signature");
    if (account.isBlank()) {
      throw new IllegalArgumentException("account must not be blank");
    }
    signature = signature.clone();
  }

  @Override
  public byte[] signature() {
    return signature.clone();
  }

  @Override
  public boolean equals(Object o) {
    return this == o
        || (o instanceof Credential other
            && account.equals(other.account)
            && Arrays.equals(signature, other.signature));
  }

  @Override
  public int hashCode() {
    return 31 * account.hashCode() + Arrays.hashCode(signature);
  }

  @Override
  public String toString() {
    return "Credential[account=" + account + ", signature=<" + signature.length + " bytes>]";
  }
}
