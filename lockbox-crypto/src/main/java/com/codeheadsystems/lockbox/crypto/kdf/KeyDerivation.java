package com.codeheadsystems.lockbox.crypto.kdf;

import com.codeheadsystems.lockbox.crypto.common.ByteUtils;
import com.codeheadsystems.lockbox.crypto.exceptions.InvalidInputException;
import com.codeheadsystems.lockbox.crypto.secret.Secret;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;

/**
 * Derives 32-byte symmetric keys from a secret and a 16-byte salt with Argon2id (version 1.3).
 * <p>
 * The same secret is run through this function twice with unrelated salts: once with the
 * account's auth salt to produce the login verifier, and once with a fresh vault salt on every
 * seal to produce the vault key. A salt must never serve both purposes.
 * <p>
 * Each call allocates the configured memory cost (128 MiB by default) and takes a noticeable
 * amount of CPU time. Run it on a worker thread.
 */
public class KeyDerivation {

  /**
   * Required salt length in bytes.
   */
  public static final int SALT_LENGTH = 16;

  /**
   * Derived key length in bytes.
   */
  public static final int KEY_LENGTH = 32;

  private final KdfParameters parameters;

  /**
   * Instantiates a key derivation with the production parameters.
   */
  public KeyDerivation() {
    this(KdfParameters.DEFAULT);
  }

  /**
   * Instantiates a key derivation with explicit parameters.
   *
   * @param parameters the parameters
   */
  public KeyDerivation(final KdfParameters parameters) {
    this.parameters = parameters;
  }

  /**
   * Parameters.
   *
   * @return the kdf parameters
   */
  public KdfParameters parameters() {
    return parameters;
  }

  /**
   * Derives a key from raw secret bytes.
   *
   * @param secret the secret bytes
   * @param salt   a 16-byte salt
   * @return a new 32-byte key
   * @throws InvalidInputException if the salt is null, empty or not 16 bytes long
   */
  public byte[] derive(byte[] secret, byte[] salt) {
    if (secret == null) {
      throw new InvalidInputException("Secret must not be null");
    }
    if (salt == null || salt.length == 0) {
      throw new InvalidInputException("Salt must not be empty");
    }
    if (salt.length != SALT_LENGTH) {
      throw new InvalidInputException("Salt must be " + SALT_LENGTH + " bytes, got " + salt.length);
    }
    Argon2Parameters params = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
        .withVersion(Argon2Parameters.ARGON2_VERSION_13)
        .withSalt(salt)
        .withIterations(parameters.iterations())
        .withMemoryAsKB(parameters.memoryKib())
        .withParallelism(parameters.parallelism())
        .build();
    Argon2BytesGenerator generator = new Argon2BytesGenerator();
    generator.init(params);
    byte[] output = new byte[KEY_LENGTH];
    generator.generateBytes(secret, output, 0, output.length);
    return output;
  }

  /**
   * Derives a key from a {@link Secret}. The UTF-8 encoding of the secret exists only for the
   * duration of the call.
   *
   * @param secret the secret
   * @param salt   a 16-byte salt
   * @return a new 32-byte key
   */
  public byte[] derive(Secret secret, byte[] salt) {
    byte[] encoded = secret.utf8();
    try {
      return derive(encoded, salt);
    } finally {
      ByteUtils.wipe(encoded);
    }
  }
}
