package com.codeheadsystems.lockbox.crypto.kdf;

/**
 * Argon2id cost parameters.
 * <p>
 * Every client of an account must use the same parameters, otherwise the verifier computed at
 * login will not match the one stored at registration and no sealed vault will open.
 *
 * @param iterations  the time cost
 * @param memoryKib   the memory cost in kibibytes
 * @param parallelism the number of lanes
 */
public record KdfParameters(int iterations, int memoryKib, int parallelism) {

  /**
   * Production parameters: 3 iterations, 128 MiB, 4 lanes.
   */
  public static final KdfParameters DEFAULT = new KdfParameters(3, 131072, 4);

  /**
   * Validates the parameters.
   */
  public KdfParameters {
    if (iterations < 1) {
      throw new IllegalArgumentException("iterations must be at least 1");
    }
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be at least 1");
    }
    if (memoryKib < 8 * parallelism) {
      throw new IllegalArgumentException("memoryKib must be at least 8 * parallelism");
    }
  }

  /**
   * Cheap parameters for unit tests. Do not use in production.
   *
   * @return the kdf parameters
   */
  public static KdfParameters forTesting() {
    return new KdfParameters(1, 1024, 1);
  }
}
