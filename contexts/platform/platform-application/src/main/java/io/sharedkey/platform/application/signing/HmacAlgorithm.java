package io.sharedkey.platform.application.signing;

import java.security.GeneralSecurityException;
import java.util.Locale;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/** Keyed hash algorithms accepted by the signing scheme. */
public enum HmacAlgorithm {
  HMAC_SHA256("HmacSHA256", 32),
  HMAC_SHA512("HmacSHA512", 64);

  private final String jcaName;
  private final int macLength;

  HmacAlgorithm(String jcaName, int macLength) {
    this.jcaName = jcaName;
    this.macLength = macLength;
  }

  /** JCA algorithm name, e.g. {@code HmacSHA256}. */
  public String jcaName() {
    return jcaName;
  }

  /** Length in bytes of the MAC this algorithm produces. */
  public int macLength() {
    return macLength;
  }

  /**
   * Computes the MAC of {@code data} under {@code secret}.
   *
   * @throws IllegalArgumentException if {@code secret} is empty
   * @throws IllegalStateException if the JCA provider lacks the algorithm
   */
  public byte[] mac(byte[] secret, byte[] data) {
    if (secret == null || secret.length == 0) {
      throw new IllegalArgumentException("secret must not be empty");
    }
    try {
      Mac mac = Mac.getInstance(jcaName);
      mac.init(new SecretKeySpec(secret, jcaName));
      return mac.doFinal(data);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException(jcaName + " not available", e);
    }
  }

  /**
   * Resolves a JCA name such as {@code HmacSHA256} (case-insensitive).
   *
   * @throws IllegalArgumentException for unsupported names
   */
  public static HmacAlgorithm fromJcaName(String name) {
    if (name != null) {
      String n = name.trim().toLowerCase(Locale.ROOT);
      for (HmacAlgorithm a : values()) {
        if (a.jcaName.toLowerCase(Locale.ROOT).equals(n)) {
          return a;
        }
      }
    }
    throw new IllegalArgumentException("Unsupported HMAC algorithm: " + name);
  }
}
