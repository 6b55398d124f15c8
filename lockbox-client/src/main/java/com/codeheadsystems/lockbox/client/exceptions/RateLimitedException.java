package com.codeheadsystems.lockbox.client.exceptions;

import com.codeheadsystems.lockbox.client.model.RateLimited;

/**
 * The authority answered 429. Never retried automatically.
 */
public class RateLimitedException extends RuntimeException {

  private final RateLimited rateLimited;

  /**
   * Instantiates a new Rate limited exception.
   *
   * @param rateLimited the rate limited
   */
  public RateLimitedException(final RateLimited rateLimited) {
    super("Rate limited, retry after " + rateLimited.retryAfterSeconds() + "s");
    this.rateLimited = rateLimited;
  }

  public RateLimited rateLimited() {
    return rateLimited;
  }
}
