package com.codeheadsystems.lockbox.client.model;

/**
 * The authority refused the attempt and asked the caller to wait. Surfaced as is, never retried
 * silently.
 *
 * @param retryAfterSeconds seconds to wait before the next attempt
 * @param detail            the authority's message, may be null
 */
public record RateLimited(long retryAfterSeconds, String detail)
    implements LoginOutcome, RegisterOutcome, SessionOutcome {
}
