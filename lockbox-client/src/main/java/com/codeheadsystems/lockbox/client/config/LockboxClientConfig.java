package com.codeheadsystems.lockbox.client.config;

import com.codeheadsystems.lockbox.crypto.kdf.KdfParameters;
import java.net.URI;
import java.time.Duration;

/**
 * Client-side configuration.
 * <p>
 * The KDF parameters must be identical on every client of an account: they shape both the login
 * verifier and the vault key. Production code uses {@link KdfParameters#DEFAULT}. For tests use
 * {@link #forTesting(URI)}, which swaps in cheap KDF parameters and a short idle timeout.
 *
 * @param baseUri       base URL of the remote authority, e.g. {@code http://host:8080}
 * @param kdfParameters the Argon2id parameters
 * @param idleTimeout   inactivity period after which an unlocked session locks
 */
public record LockboxClientConfig(URI baseUri, KdfParameters kdfParameters, Duration idleTimeout) {

  /**
   * Default inactivity period.
   */
  public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofMinutes(5);

  /**
   * Validates the config.
   */
  public LockboxClientConfig {
    if (baseUri == null) {
      throw new IllegalArgumentException("baseUri must not be null");
    }
    if (kdfParameters == null) {
      throw new IllegalArgumentException("kdfParameters must not be null");
    }
    if (idleTimeout == null || idleTimeout.isNegative() || idleTimeout.isZero()) {
      throw new IllegalArgumentException("idleTimeout must be positive");
    }
  }

  /**
   * Production config for the given authority.
   *
   * @param baseUri the base uri
   * @return the lockbox client config
   */
  public static LockboxClientConfig of(URI baseUri) {
    return new LockboxClientConfig(baseUri, KdfParameters.DEFAULT, DEFAULT_IDLE_TIMEOUT);
  }

  /**
   * Test-only config with cheap KDF parameters. Do not use in production.
   *
   * @param baseUri the base uri
   * @return the lockbox client config
   */
  public static LockboxClientConfig forTesting(URI baseUri) {
    return new LockboxClientConfig(baseUri, KdfParameters.forTesting(), Duration.ofSeconds(30));
  }

  /**
   * Copy with another idle timeout.
   *
   * @param timeout the timeout
   * @return the lockbox client config
   */
  public LockboxClientConfig withIdleTimeout(Duration timeout) {
    return new LockboxClientConfig(baseUri, kdfParameters, timeout);
  }
}
