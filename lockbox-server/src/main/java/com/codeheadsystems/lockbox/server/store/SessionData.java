package com.codeheadsystems.lockbox.server.store;

import com.codeheadsystems.lockbox.server.auth.TokenStage;
import java.time.Instant;

/**
 * Data stored for an issued bearer token.
 *
 * @param username  the account the token belongs to
 * @param stage     the login stage the token grants
 * @param issuedAt  when the token was issued
 * @param expiresAt when the token expires
 */
public record SessionData(
    String username,
    TokenStage stage,
    Instant issuedAt,
    Instant expiresAt) {
}
