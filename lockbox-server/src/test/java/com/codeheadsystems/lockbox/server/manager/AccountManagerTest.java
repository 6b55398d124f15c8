package com.codeheadsystems.lockbox.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.lockbox.crypto.common.ByteUtils;
import com.codeheadsystems.lockbox.crypto.common.RandomProvider;
import com.codeheadsystems.lockbox.model.LoginRequest;
import com.codeheadsystems.lockbox.model.MfaLoginRequest;
import com.codeheadsystems.lockbox.model.MfaSetupResponse;
import com.codeheadsystems.lockbox.model.RegisterRequest;
import com.codeheadsystems.lockbox.server.MutableClock;
import com.codeheadsystems.lockbox.server.auth.LockboxPrincipal;
import com.codeheadsystems.lockbox.server.auth.TokenManager;
import com.codeheadsystems.lockbox.server.auth.TokenStage;
import com.codeheadsystems.lockbox.server.exceptions.RateLimitExceededException;
import com.codeheadsystems.lockbox.server.exceptions.UsernameTakenException;
import com.codeheadsystems.lockbox.server.limiter.AttemptLimiter;
import com.codeheadsystems.lockbox.server.mfa.TotpManager;
import com.codeheadsystems.lockbox.server.store.InMemoryAccountStore;
import com.codeheadsystems.lockbox.server.store.InMemorySessionStore;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AccountManagerTest {

  private static final byte[] SALT = new byte[16];
  private static final byte[] VERIFIER = filled(32, (byte) 7);
  private static final byte[] WRONG_VERIFIER = filled(32, (byte) 8);
  private static final String ADDRESS = "127.0.0.1";

  private MutableClock clock;
  private TokenManager tokenManager;
  private TotpManager totpManager;
  private MfaManager mfaManager;
  private AccountManager accountManager;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    InMemoryAccountStore accountStore = new InMemoryAccountStore();
    tokenManager = new TokenManager("test-secret-must-be-at-least-32-bytes!".getBytes(StandardCharsets.UTF_8),
        "test-issuer", 3600, new InMemorySessionStore());
    totpManager = new TotpManager(new RandomProvider(), clock, "Lockbox");
    AttemptLimiter limiter = new AttemptLimiter(5, Duration.ofSeconds(60), Duration.ofSeconds(60), clock);
    mfaManager = new MfaManager(accountStore, totpManager, limiter, new RandomProvider());
    accountManager = new AccountManager(accountStore, tokenManager, mfaManager, limiter,
        new AttemptLimiter(5, Duration.ofSeconds(60), Duration.ofSeconds(60), clock));
  }

  private static byte[] filled(final int length, final byte value) {
    byte[] out = new byte[length];
    Arrays.fill(out, value);
    return out;
  }

  private void register(final String username) {
    accountManager.register(new RegisterRequest(username, SALT, VERIFIER), ADDRESS);
  }

  // ── Registration ──────────────────────────────────────────────────────────

  @Test
  void register_storesSalt() {
    register("alice");

    assertThat(accountManager.authSalt("alice")).hasValueSatisfying(salt -> assertThat(salt).isEqualTo(SALT));
    assertThat(accountManager.authSalt("bob")).isEmpty();
  }

  @Test
  void register_duplicateUsername_throws() {
    register("alice");

    assertThatThrownBy(() -> register("alice")).isInstanceOf(UsernameTakenException.class);
  }

  @Test
  void register_repeatedConflictsFromOneAddressAreThrottled() {
    register("alice");
    for (int i = 0; i < 5; i++) {
      assertThatThrownBy(() -> register("alice")).isInstanceOf(UsernameTakenException.class);
    }

    assertThatThrownBy(() -> register("carol")).isInstanceOf(RateLimitExceededException.class);
  }

  @Test
  void register_malformedFields_areRejected() {
    assertThatThrownBy(() -> accountManager.register(new RegisterRequest("alice", "zz", "00"), ADDRESS))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid hex in field: salt");
    assertThatThrownBy(() -> accountManager.register(new RegisterRequest("alice", new byte[8], VERIFIER), ADDRESS))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> accountManager.register(new RegisterRequest(" ", SALT, VERIFIER), ADDRESS))
        .isInstanceOf(IllegalArgumentException.class);
  }

  // ── Login ─────────────────────────────────────────────────────────────────

  @Test
  void login_correctVerifier_issuesFullToken() {
    register("alice");

    String token = accountManager.login(new LoginRequest("alice", VERIFIER));

    assertThat(tokenManager.verify(token)).hasValueSatisfying(r -> {
      assertThat(r.username()).isEqualTo("alice");
      assertThat(r.stage()).isEqualTo(TokenStage.FULL);
    });
  }

  @Test
  void login_wrongVerifierAndUnknownUser_failTheSameWay() {
    register("alice");

    assertThatThrownBy(() -> accountManager.login(new LoginRequest("alice", WRONG_VERIFIER)))
        .isInstanceOf(SecurityException.class)
        .hasMessage("Invalid credentials");
    assertThatThrownBy(() -> accountManager.login(new LoginRequest("ghost", VERIFIER)))
        .isInstanceOf(SecurityException.class)
        .hasMessage("Invalid credentials");
  }

  @Test
  void login_sixthAttemptAfterFiveFailures_isRateLimitedEvenWithTheRightVerifier() {
    register("alice");
    for (int i = 0; i < 5; i++) {
      assertThatThrownBy(() -> accountManager.login(new LoginRequest("alice", WRONG_VERIFIER)))
          .isInstanceOf(SecurityException.class);
    }

    assertThatThrownBy(() -> accountManager.login(new LoginRequest("alice", VERIFIER)))
        .isInstanceOfSatisfying(RateLimitExceededException.class,
            e -> assertThat(e.retryAfterSeconds()).isPositive());

    clock.advance(Duration.ofSeconds(61));
    assertThatCode(() -> accountManager.login(new LoginRequest("alice", VERIFIER))).doesNotThrowAnyException();
  }

  @Test
  void logout_revokesToken() {
    register("alice");
    String token = accountManager.login(new LoginRequest("alice", VERIFIER));

    accountManager.logout(principal(token));

    assertThat(tokenManager.verify(token)).isEmpty();
  }

  private LockboxPrincipal principal(final String token) {
    return LockboxPrincipal.from(tokenManager.verify(token).orElseThrow());
  }

  // ── Second factor ─────────────────────────────────────────────────────────

  private MfaSetupResponse enroll(final String username) {
    String token = accountManager.login(new LoginRequest(username, VERIFIER));
    MfaSetupResponse setup = mfaManager.setup(principal(token));
    mfaManager.verify(username, totpManager.currentCode(setup.secret()));
    return setup;
  }

  @Test
  void login_withSecondFactor_onlyIssuesPasswordStageToken() {
    register("alice");
    enroll("alice");

    String token = accountManager.login(new LoginRequest("alice", VERIFIER));

    assertThat(tokenManager.verify(token).orElseThrow().stage()).isEqualTo(TokenStage.PASSWORD);
  }

  @Test
  void loginWithSecondFactor_totpCode() {
    register("alice");
    MfaSetupResponse setup = enroll("alice");

    String token = accountManager.loginWithSecondFactor(
        new MfaLoginRequest("alice", VERIFIER, totpManager.currentCode(setup.secret())));

    assertThat(tokenManager.verify(token).orElseThrow().stage()).isEqualTo(TokenStage.FULL);
  }

  @Test
  void loginWithSecondFactor_backupCodeWorksOnce() {
    register("alice");
    MfaSetupResponse setup = enroll("alice");
    String backup = setup.backupCodes().get(0);

    assertThat(accountManager.loginWithSecondFactor(new MfaLoginRequest("alice", VERIFIER, backup))).isNotBlank();
    assertThatThrownBy(() -> accountManager.loginWithSecondFactor(new MfaLoginRequest("alice", VERIFIER, backup)))
        .isInstanceOf(SecurityException.class);
  }

  @Test
  void loginWithSecondFactor_wrongVerifierIsCheckedBeforeCode() {
    register("alice");
    MfaSetupResponse setup = enroll("alice");
    String backup = setup.backupCodes().get(0);

    assertThatThrownBy(() -> accountManager.loginWithSecondFactor(
        new MfaLoginRequest("alice", WRONG_VERIFIER, backup))).isInstanceOf(SecurityException.class);
    assertThat(accountManager.loginWithSecondFactor(new MfaLoginRequest("alice", VERIFIER, backup))).isNotBlank();
  }

  @Test
  void loginWithSecondFactor_wrongCodesCountTowardsLimit() {
    register("alice");
    enroll("alice");
    for (int i = 0; i < 5; i++) {
      assertThatThrownBy(() -> accountManager.loginWithSecondFactor(
          new MfaLoginRequest("alice", VERIFIER, "XXXX-XXXX"))).isInstanceOf(SecurityException.class);
    }

    assertThatThrownBy(() -> accountManager.login(new LoginRequest("alice", VERIFIER)))
        .isInstanceOf(RateLimitExceededException.class);
  }

  @Test
  void verifier_isStoredNotTheSecret() {
    register("alice");

    assertThat(ByteUtils.toHex(accountManager.authSalt("alice").orElseThrow())).isEqualTo(ByteUtils.toHex(SALT));
  }
}
