package com.codeheadsystems.lockbox.server.exceptions;

/**
 * Thrown while an identity is locked out after too many failed attempts.
 */
public class RateLimitExceededException extends RuntimeException {

  private final long retryAfterSeconds;

  /**
   * Instantiates a new Rate limit exceeded exception.
   *
   * @param retryAfterSeconds seconds until the lockout ends, at least 1
   */
  public RateLimitExceededException(final long retryAfterSeconds) {
    super("Too many failed attempts. Try again in " + Math.max(1, retryAfterSeconds) + " seconds.");
    this.retryAfterSeconds = Math.max(1, retryAfterSeconds);
  }

  public long retryAfterSeconds() {
    return retryAfterSeconds;
  }
}
