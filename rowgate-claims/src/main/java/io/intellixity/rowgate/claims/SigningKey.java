package io.intellixity.rowgate.claims;

import org.jose4j.keys.HmacKey;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/** Symmetric HS256 key. At least 256 bits, as HS256 requires a key no shorter than the hash output. */
public final class SigningKey {
  public static final int MIN_BYTES = 32;

  private final HmacKey key;

  private SigningKey(byte[] secret) {
    if (secret.length < MIN_BYTES) {
      throw new IllegalArgumentException("signing secret must be at least " + MIN_BYTES + " bytes");
    }
    this.key = new HmacKey(secret);
  }

  public static SigningKey ofSecret(String secret) {
    Objects.requireNonNull(secret, "secret");
    return new SigningKey(secret.getBytes(StandardCharsets.UTF_8));
  }

  public static SigningKey ofBytes(byte[] secret) {
    Objects.requireNonNull(secret, "secret");
    return new SigningKey(secret.clone());
  }

  SecretKey secretKey() {
    return key;
  }

  @Override
  public String toString() {
    return "SigningKey[HS256]";
  }
}
