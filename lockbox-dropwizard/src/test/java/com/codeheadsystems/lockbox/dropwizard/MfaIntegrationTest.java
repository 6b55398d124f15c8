package com.codeheadsystems.lockbox.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.lockbox.client.accessor.LockboxAccessor;
import com.codeheadsystems.lockbox.client.config.LockboxClientConfig;
import com.codeheadsystems.lockbox.client.manager.CredentialManager;
import com.codeheadsystems.lockbox.client.model.LoginOutcome;
import com.codeheadsystems.lockbox.client.model.MfaEnrollment;
import com.codeheadsystems.lockbox.client.model.SessionToken;
import com.codeheadsystems.lockbox.crypto.common.ByteUtils;
import com.codeheadsystems.lockbox.crypto.common.RandomProvider;
import com.codeheadsystems.lockbox.crypto.secret.Secret;
import com.codeheadsystems.lockbox.model.LoginRequest;
import com.codeheadsystems.lockbox.model.TokenResponse;
import com.codeheadsystems.lockbox.server.mfa.TotpManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Second-factor enrollment and login against a running authority.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class MfaIntegrationTest {

  static final DropwizardAppExtension<LockboxConfiguration> APP =
      new DropwizardAppExtension<>(
          LockboxApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private static final String PASSWORD = "correct-horse-battery-staple";

  private final TotpManager totp = new TotpManager(new RandomProvider(), Clock.systemUTC(), "test");

  private HttpClient httpClient;
  private LockboxAccessor accessor;
  private CredentialManager credentialManager;
  private String username;

  @BeforeEach
  void setUp() {
    httpClient = HttpClient.newHttpClient();
    LockboxClientConfig config = LockboxClientConfig.forTesting(URI.create(baseUrl()));
    accessor = new LockboxAccessor(httpClient, new ObjectMapper(), config);
    credentialManager = new CredentialManager(config, accessor);
    username = "mfa-" + UUID.randomUUID();
    credentialManager.register(username, Secret.of(PASSWORD));
  }

  // ─── enrollment ───────────────────────────────────────────────────────────

  @Test
  void enrollment_isPendingUntilVerified() {
    MfaEnrollment enrollment = credentialManager.enrollSecondFactor(fullToken());

    assertThat(enrollment.recoveryCodes()).hasSize(8);
    assertThat(enrollment.provisioningUri()).startsWith("otpauth://totp/");
    assertThat(credentialManager.mfaStatus(username)).isFalse();

    assertThat(credentialManager.verifySecondFactor(username, wrongCode(code(enrollment)))).isFalse();
    assertThat(credentialManager.verifySecondFactor(username, code(enrollment))).isTrue();
    assertThat(credentialManager.mfaStatus(username)).isTrue();
  }

  @Test
  void login_withSecondFactor_requiresCode() {
    MfaEnrollment enrollment = enroll();

    assertThat(credentialManager.login(username, Secret.of(PASSWORD)))
        .isInstanceOf(LoginOutcome.MfaRequired.class);
    assertThat(credentialManager.loginWithSecondFactor(username, Secret.of(PASSWORD), code(enrollment)))
        .isInstanceOf(LoginOutcome.Authenticated.class);
  }

  @Test
  void backupCode_worksOnce() {
    MfaEnrollment enrollment = enroll();
    String backupCode = enrollment.recoveryCodes().get(0);

    assertThat(credentialManager.loginWithSecondFactor(username, Secret.of(PASSWORD), backupCode))
        .isInstanceOf(LoginOutcome.Authenticated.class);
    assertThat(credentialManager.loginWithSecondFactor(username, Secret.of(PASSWORD), backupCode))
        .isInstanceOf(LoginOutcome.InvalidCredentials.class);
  }

  @Test
  void secondFactorLogin_wrongSecret_isInvalidCredentials() {
    MfaEnrollment enrollment = enroll();

    assertThat(credentialManager.loginWithSecondFactor(username, Secret.of("wrong-password"), code(enrollment)))
        .isInstanceOf(LoginOutcome.InvalidCredentials.class);
  }

  @Test
  void disable_removesSecondFactor() {
    MfaEnrollment enrollment = enroll();
    LoginOutcome.Authenticated authenticated = (LoginOutcome.Authenticated)
        credentialManager.loginWithSecondFactor(username, Secret.of(PASSWORD), code(enrollment));

    assertThat(credentialManager.disableSecondFactor(authenticated.token())).isTrue();

    assertThat(credentialManager.mfaStatus(username)).isFalse();
    assertThat(credentialManager.login(username, Secret.of(PASSWORD)))
        .isInstanceOf(LoginOutcome.Authenticated.class);
  }

  // ─── password-stage tokens ───────────────────────────────────────────────

  @Test
  void passwordStageToken_isRefusedByVault() throws Exception {
    enroll();
    byte[] salt = credentialManager.lookupSalt(username).orElseThrow();
    byte[] verifier = credentialManager.keyDerivation().derive(Secret.of(PASSWORD), salt);
    TokenResponse partial = accessor.login(new LoginRequest(username, verifier));
    ByteUtils.wipe(verifier);

    HttpResponse<String> response = httpClient.send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/vault"))
        .header("Authorization", "Bearer " + partial.token())
        .GET()
        .build(), HttpResponse.BodyHandlers.ofString());

    assertThat(response.statusCode()).isEqualTo(401);
  }

  private MfaEnrollment enroll() {
    MfaEnrollment enrollment = credentialManager.enrollSecondFactor(fullToken());
    assertThat(credentialManager.verifySecondFactor(username, code(enrollment))).isTrue();
    return enrollment;
  }

  private SessionToken fullToken() {
    return ((LoginOutcome.Authenticated) credentialManager.login(username, Secret.of(PASSWORD))).token();
  }

  private String code(final MfaEnrollment enrollment) {
    return totp.currentCode(enrollment.sharedSecret());
  }

  private static String wrongCode(final String code) {
    char first = (char) ('0' + (code.charAt(0) - '0' + 5) % 10);
    return first + code.substring(1);
  }

  private String baseUrl() {
    return String.format("http://localhost:%d", APP.getLocalPort());
  }
}
