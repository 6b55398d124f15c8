package com.codeheadsystems.lockbox.server.auth;

import static org.assertj.core.api.Assertions.assertThat;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.codeheadsystems.lockbox.server.auth.TokenManager.VerifyResult;
import com.codeheadsystems.lockbox.server.store.InMemorySessionStore;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TokenManagerTest {

  private static final byte[] SECRET = "test-secret-must-be-at-least-32-bytes!".getBytes(StandardCharsets.UTF_8);
  private static final byte[] WRONG_SECRET = "wrong-secret-must-be-at-least-32-bytes".getBytes(StandardCharsets.UTF_8);

  private InMemorySessionStore sessionStore;
  private TokenManager tokenManager;

  @BeforeEach
  void setUp() {
    sessionStore = new InMemorySessionStore();
    tokenManager = new TokenManager(SECRET, "test-issuer", 3600, sessionStore);
  }

  @Test
  void issueAndVerify_roundTrip() {
    String token = tokenManager.issueToken("alice", TokenStage.FULL);

    Optional<VerifyResult> result = tokenManager.verify(token);

    assertThat(result).isPresent();
    assertThat(result.get().username()).isEqualTo("alice");
    assertThat(result.get().stage()).isEqualTo(TokenStage.FULL);
    assertThat(JWT.decode(token).getClaim(TokenManager.STAGE_CLAIM).asString()).isEqualTo("FULL");
  }

  @Test
  void verify_acceptsBearerPrefix() {
    String token = tokenManager.issueToken("alice", TokenStage.FULL);

    assertThat(tokenManager.verify("Bearer " + token)).isPresent();
  }

  @Test
  void verify_missingToken_returnsEmpty() {
    assertThat(tokenManager.verify(null)).isEmpty();
    assertThat(tokenManager.verify(" ")).isEmpty();
  }

  @Test
  void verify_revokedToken_returnsEmpty() {
    String token = tokenManager.issueToken("alice", TokenStage.FULL);
    tokenManager.revoke(JWT.decode(token).getId());

    assertThat(tokenManager.verify(token)).isEmpty();
  }

  @Test
  void verify_wrongSecret_returnsEmpty() {
    String token = tokenManager.issueToken("alice", TokenStage.FULL);

    TokenManager other = new TokenManager(WRONG_SECRET, "test-issuer", 3600, new InMemorySessionStore());
    assertThat(other.verify(token)).isEmpty();
  }

  @Test
  void verify_expiredToken_returnsEmpty() {
    String token = JWT.create()
        .withIssuer("test-issuer")
        .withJWTId("expired-jti")
        .withSubject("alice")
        .withClaim(TokenManager.STAGE_CLAIM, "FULL")
        .withIssuedAt(Instant.now().minusSeconds(7200))
        .withExpiresAt(Instant.now().minusSeconds(3600))
        .sign(Algorithm.HMAC256(SECRET));

    assertThat(tokenManager.verify(token)).isEmpty();
  }

  @Test
  void verify_tamperedToken_returnsEmpty() {
    String token = tokenManager.issueToken("alice", TokenStage.FULL);
    String tampered = token.substring(0, token.length() - 2) + "XX";

    assertThat(tokenManager.verify(tampered)).isEmpty();
  }
}
