package com.codeheadsystems.lockbox.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.lockbox.server.store.SessionData;
import com.codeheadsystems.lockbox.server.store.SessionStore;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies the bearer tokens handed out by {@code /login} and {@code /login/mfa}.
 * <p>
 * Tokens are HMAC-SHA256 signed JWTs carrying the username as subject and the {@link TokenStage}
 * as a claim. Each token's JTI is stored in a {@link SessionStore} so that it can be revoked
 * before expiry.
 */
public class TokenManager {

  /**
   * Claim holding the {@link TokenStage}.
   */
  public static final String STAGE_CLAIM = "stage";

  private static final Logger log = LoggerFactory.getLogger(TokenManager.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final SessionStore sessionStore;
  private final String issuer;
  private final long ttlSeconds;

  /**
   * Creates a new TokenManager.
   *
   * @param secret       HMAC-SHA256 signing secret
   * @param issuer       JWT issuer claim
   * @param ttlSeconds   token time-to-live in seconds
   * @param sessionStore backing store for session data and revocation
   */
  public TokenManager(final byte[] secret, final String issuer, final long ttlSeconds,
                      final SessionStore sessionStore) {
    log.info("TokenManager(issuer={}, ttlSeconds={})", issuer, ttlSeconds);
    this.algorithm = Algorithm.HMAC256(secret);
    this.verifier = JWT.require(algorithm).withIssuer(issuer).build();
    this.sessionStore = sessionStore;
    this.issuer = issuer;
    this.ttlSeconds = ttlSeconds;
  }

  /**
   * Issues a token.
   *
   * @param username the account
   * @param stage    the stage the token grants
   * @return signed JWT string
   */
  public String issueToken(final String username, final TokenStage stage) {
    String jti = UUID.randomUUID().toString();
    Instant now = Instant.now();
    Instant expiresAt = now.plusSeconds(ttlSeconds);

    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(jti)
        .withSubject(username)
        .withClaim(STAGE_CLAIM, stage.name())
        .withIssuedAt(now)
        .withExpiresAt(expiresAt)
        .sign(algorithm);

    sessionStore.store(jti, new SessionData(username, stage, now, expiresAt));
    log.debug("Issued {} token jti={}", stage, jti);
    return token;
  }

  /**
   * Result of a successful token verification.
   *
   * @param username the JWT subject
   * @param jti      the JWT ID
   * @param stage    the stage recorded when the token was issued
   */
  public record VerifyResult(String username, String jti, TokenStage stage) {
  }

  /**
   * Verifies a token and returns its subject, JTI and stage if valid and not revoked.
   *
   * @param token JWT string, optionally prefixed with {@code Bearer }
   * @return verify result if valid, empty if missing, invalid or revoked
   */
  public Optional<VerifyResult> verify(final String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    String raw = token.startsWith("Bearer ") ? token.substring("Bearer ".length()).trim() : token.trim();
    try {
      DecodedJWT decoded = verifier.verify(raw);
      String jti = decoded.getId();
      Optional<SessionData> session = sessionStore.load(jti);
      if (session.isEmpty()) {
        log.debug("JWT jti={} not found in session store (revoked or expired)", jti);
        return Optional.empty();
      }
      return Optional.of(new VerifyResult(decoded.getSubject(), jti, session.get().stage()));
    } catch (JWTVerificationException e) {
      log.debug("JWT verification failed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Revokes a token by its JTI.
   *
   * @param jti the JWT ID to revoke
   */
  public void revoke(final String jti) {
    sessionStore.revoke(jti);
  }
}
