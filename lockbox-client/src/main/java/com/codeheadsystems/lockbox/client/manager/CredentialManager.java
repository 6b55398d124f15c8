package com.codeheadsystems.lockbox.client.manager;

import com.codeheadsystems.lockbox.client.accessor.LockboxAccessor;
import com.codeheadsystems.lockbox.client.config.LockboxClientConfig;
import com.codeheadsystems.lockbox.client.exceptions.LockboxAccessorException;
import com.codeheadsystems.lockbox.client.exceptions.RateLimitedException;
import com.codeheadsystems.lockbox.client.model.LoginOutcome;
import com.codeheadsystems.lockbox.client.model.MfaEnrollment;
import com.codeheadsystems.lockbox.client.model.RegisterOutcome;
import com.codeheadsystems.lockbox.client.model.SessionToken;
import com.codeheadsystems.lockbox.crypto.common.ByteUtils;
import com.codeheadsystems.lockbox.crypto.common.RandomProvider;
import com.codeheadsystems.lockbox.crypto.kdf.KeyDerivation;
import com.codeheadsystems.lockbox.crypto.secret.PasswordPolicy;
import com.codeheadsystems.lockbox.crypto.secret.Secret;
import com.codeheadsystems.lockbox.model.AuthSaltResponse;
import com.codeheadsystems.lockbox.model.LoginRequest;
import com.codeheadsystems.lockbox.model.MfaLoginRequest;
import com.codeheadsystems.lockbox.model.MfaSetupResponse;
import com.codeheadsystems.lockbox.model.MfaVerifyRequest;
import com.codeheadsystems.lockbox.model.RegisterRequest;
import com.codeheadsystems.lockbox.model.TokenResponse;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registration, login and second-factor operations against the remote authority.
 * <p>
 * The secret never leaves this class: it is stretched with the account's auth salt into a
 * 32-byte verifier, and only the verifier is sent. Every call blocks on Argon2id and on the
 * network, so callers run it on a worker thread.
 * <p>
 * <strong>Login:</strong>
 * <ol>
 *   <li>Fetch the auth salt. A missing salt means the account does not exist.</li>
 *   <li>Derive the verifier and submit it. A 401 means invalid credentials.</li>
 *   <li>Ask whether a second factor is enrolled. If so the password-stage token is revoked and
 *       the caller must follow up with {@link #loginWithSecondFactor}.</li>
 * </ol>
 * The secret is therefore always verified before a second factor is requested.
 */
@Singleton
public class CredentialManager {

  private static final Logger log = LoggerFactory.getLogger(CredentialManager.class);

  private final LockboxAccessor accessor;
  private final KeyDerivation keyDerivation;
  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Credential manager.
   *
   * @param config   the config
   * @param accessor the accessor
   */
  @Inject
  public CredentialManager(final LockboxClientConfig config, final LockboxAccessor accessor) {
    this(accessor, new KeyDerivation(config.kdfParameters()), new RandomProvider());
  }

  /**
   * Instantiates a new Credential manager.
   *
   * @param accessor       the accessor
   * @param keyDerivation  the key derivation
   * @param randomProvider the random provider
   */
  public CredentialManager(final LockboxAccessor accessor,
                           final KeyDerivation keyDerivation,
                           final RandomProvider randomProvider) {
    log.info("CredentialManager({})", keyDerivation.parameters());
    this.accessor = accessor;
    this.keyDerivation = keyDerivation;
    this.randomProvider = randomProvider;
  }

  /**
   * Looks up the public auth salt.
   *
   * @param username the username
   * @return the salt, empty if the account does not exist
   * @throws RateLimitedException     if the authority throttles the lookup
   * @throws LockboxAccessorException on transport failure
   */
  public Optional<byte[]> lookupSalt(final String username) {
    log.debug("lookupSalt(username={})", username);
    return accessor.authSalt(username).map(AuthSaltResponse::salt);
  }

  /**
   * Registers a new account. Secrets shorter than {@link PasswordPolicy#MINIMUM_LENGTH} are
   * rejected before anything is sent.
   *
   * @param username the username
   * @param secret   the secret
   * @return the register outcome
   */
  public RegisterOutcome register(final String username, final Secret secret) {
    log.debug("register(username={})", username);
    if (!PasswordPolicy.meetsMinimumLength(secret)) {
      return new RegisterOutcome.WeakSecret(PasswordPolicy.MINIMUM_LENGTH);
    }
    byte[] salt = randomProvider.randomBytes(KeyDerivation.SALT_LENGTH);
    byte[] verifier = keyDerivation.derive(secret, salt);
    try {
      accessor.register(new RegisterRequest(username, salt, verifier));
      return new RegisterOutcome.Registered();
    } catch (RateLimitedException e) {
      return e.rateLimited();
    } catch (LockboxAccessorException e) {
      if (e.statusCode() == 409) {
        return new RegisterOutcome.UsernameTaken();
      }
      throw e;
    } finally {
      ByteUtils.wipe(verifier);
    }
  }

  /**
   * Password login. Returns {@link LoginOutcome.MfaRequired} for accounts with a second factor.
   *
   * @param username the username
   * @param secret   the secret
   * @return the login outcome
   */
  public LoginOutcome login(final String username, final Secret secret) {
    log.debug("login(username={})", username);
    try {
      Optional<byte[]> salt = lookupSalt(username);
      if (salt.isEmpty()) {
        return new LoginOutcome.NoSuchAccount();
      }
      byte[] verifier = keyDerivation.derive(secret, salt.get());
      TokenResponse response;
      try {
        response = accessor.login(new LoginRequest(username, verifier));
      } finally {
        ByteUtils.wipe(verifier);
      }
      if (accessor.mfaStatus(username).mfaEnabled()) {
        revokePasswordStageToken(new SessionToken(response.token()));
        return new LoginOutcome.MfaRequired();
      }
      return new LoginOutcome.Authenticated(new SessionToken(response.token()));
    } catch (SecurityException e) {
      return new LoginOutcome.InvalidCredentials();
    } catch (RateLimitedException e) {
      return e.rateLimited();
    }
  }

  /**
   * Login with a second-factor code. The authority checks the verifier before the code.
   *
   * @param username the username
   * @param secret   the secret
   * @param code     a TOTP code or a backup code
   * @return the login outcome
   */
  public LoginOutcome loginWithSecondFactor(final String username, final Secret secret, final String code) {
    log.debug("loginWithSecondFactor(username={})", username);
    try {
      Optional<byte[]> salt = lookupSalt(username);
      if (salt.isEmpty()) {
        return new LoginOutcome.NoSuchAccount();
      }
      byte[] verifier = keyDerivation.derive(secret, salt.get());
      try {
        TokenResponse response = accessor.loginMfa(new MfaLoginRequest(username, verifier, code));
        return new LoginOutcome.Authenticated(new SessionToken(response.token()));
      } finally {
        ByteUtils.wipe(verifier);
      }
    } catch (SecurityException e) {
      return new LoginOutcome.InvalidCredentials();
    } catch (RateLimitedException e) {
      return e.rateLimited();
    }
  }

  /**
   * Whether the account has an active second factor.
   *
   * @param username the username
   * @return true if enrolled
   */
  public boolean mfaStatus(final String username) {
    log.debug("mfaStatus(username={})", username);
    return accessor.mfaStatus(username).mfaEnabled();
  }

  /**
   * Starts enrollment. Nothing changes for the account until {@link #verifySecondFactor}
   * accepts a code generated from the new secret.
   *
   * @param token the token
   * @return the mfa enrollment
   */
  public MfaEnrollment enrollSecondFactor(final SessionToken token) {
    log.debug("enrollSecondFactor()");
    MfaSetupResponse response = accessor.mfaSetup(token);
    return new MfaEnrollment(response.secret(), response.provisioningUri(), response.qrCode(),
        response.backupCodes());
  }

  /**
   * Checks a code. Completes a pending enrollment when accepted.
   *
   * @param username the username
   * @param code     the code
   * @return true if accepted
   */
  public boolean verifySecondFactor(final String username, final String code) {
    log.debug("verifySecondFactor(username={})", username);
    try {
      accessor.mfaVerify(new MfaVerifyRequest(username, code));
      return true;
    } catch (SecurityException e) {
      return false;
    } catch (LockboxAccessorException e) {
      if (e.statusCode() == 400) {
        return false;
      }
      throw e;
    }
  }

  /**
   * Removes the second factor.
   *
   * @param token the token
   * @return true if removed, false if the token was refused
   */
  public boolean disableSecondFactor(final SessionToken token) {
    log.debug("disableSecondFactor()");
    try {
      accessor.mfaDisable(token);
      return true;
    } catch (SecurityException e) {
      return false;
    }
  }

  /**
   * Revokes the token on the server.
   *
   * @param token the token
   */
  public void logout(final SessionToken token) {
    log.debug("logout()");
    accessor.logout(token);
  }

  private void revokePasswordStageToken(final SessionToken token) {
    try {
      accessor.logout(token);
    } catch (RuntimeException e) {
      log.warn("Password-stage token could not be revoked: {}", e.getMessage());
    }
  }

  /**
   * The key derivation used for verifiers.
   *
   * @return the key derivation
   */
  public KeyDerivation keyDerivation() {
    return keyDerivation;
  }
}
