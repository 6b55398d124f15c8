package com.codeheadsystems.lockbox.dropwizard.auth;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.lockbox.server.auth.LockboxPrincipal;
import com.codeheadsystems.lockbox.server.auth.TokenManager;
import com.codeheadsystems.lockbox.server.auth.TokenStage;
import com.codeheadsystems.lockbox.server.store.InMemorySessionStore;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LockboxAuthenticatorTest {

  private TokenManager tokenManager;
  private LockboxAuthenticator authenticator;

  @BeforeEach
  void setUp() {
    tokenManager = new TokenManager("test-secret-must-be-at-least-32-bytes!".getBytes(StandardCharsets.UTF_8),
        "test-issuer", 600, new InMemorySessionStore());
    authenticator = new LockboxAuthenticator(tokenManager);
  }

  @Test
  void validToken_yieldsPrincipalWithStage() throws Exception {
    Optional<LockboxPrincipal> principal = authenticator.authenticate(
        tokenManager.issueToken("alice", TokenStage.PASSWORD));

    assertThat(principal).isPresent();
    assertThat(principal.get().username()).isEqualTo("alice");
    assertThat(principal.get().stage()).isEqualTo(TokenStage.PASSWORD);
  }

  @Test
  void revokedToken_isRejected() throws Exception {
    String token = tokenManager.issueToken("alice", TokenStage.FULL);
    tokenManager.revoke(authenticator.authenticate(token).orElseThrow().jti());

    assertThat(authenticator.authenticate(token)).isEmpty();
  }

  @Test
  void garbage_isRejected() throws Exception {
    assertThat(authenticator.authenticate("not-a-token")).isEmpty();
  }
}
