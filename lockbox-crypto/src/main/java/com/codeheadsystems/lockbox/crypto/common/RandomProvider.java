package com.codeheadsystems.lockbox.crypto.common;

import java.security.SecureRandom;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random byte generation.
 * Used for auth salts, vault salts and nonces, and by the password generator.
 */
public record RandomProvider(SecureRandom random) {

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * Returns a uniformly distributed int in {@code [0, bound)}.
   *
   * @param bound the exclusive upper bound
   * @return the random int
   */
  public int nextInt(int bound) {
    return random.nextInt(bound);
  }
}
