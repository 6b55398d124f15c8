package com.codeheadsystems.lockbox.server.manager;

import com.codeheadsystems.lockbox.crypto.common.ByteUtils;
import com.codeheadsystems.lockbox.crypto.kdf.KeyDerivation;
import com.codeheadsystems.lockbox.model.LoginRequest;
import com.codeheadsystems.lockbox.model.MfaLoginRequest;
import com.codeheadsystems.lockbox.model.RegisterRequest;
import com.codeheadsystems.lockbox.server.auth.LockboxPrincipal;
import com.codeheadsystems.lockbox.server.auth.TokenManager;
import com.codeheadsystems.lockbox.server.auth.TokenStage;
import com.codeheadsystems.lockbox.server.exceptions.RateLimitExceededException;
import com.codeheadsystems.lockbox.server.exceptions.UsernameTakenException;
import com.codeheadsystems.lockbox.server.limiter.AttemptLimiter;
import com.codeheadsystems.lockbox.server.store.Account;
import com.codeheadsystems.lockbox.server.store.AccountStore;
import java.security.MessageDigest;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registration and login on the authority side.
 * <p>
 * Login failures are counted per username by the {@link AttemptLimiter}, shared between
 * {@code /login} and {@code /login/mfa}. Unknown usernames and wrong verifiers fail the same way.
 * Accounts with an active second factor only get a {@link TokenStage#PASSWORD} token from
 * {@link #login}.
 */
public class AccountManager {

  /**
   * Longest accepted username.
   */
  public static final int MAX_USERNAME_LENGTH = 64;

  private static final Logger log = LoggerFactory.getLogger(AccountManager.class);

  private final AccountStore accountStore;
  private final TokenManager tokenManager;
  private final MfaManager mfaManager;
  private final AttemptLimiter loginLimiter;
  private final AttemptLimiter registrationLimiter;

  /**
   * Instantiates a new Account manager.
   *
   * @param accountStore        the account store
   * @param tokenManager        the token manager
   * @param mfaManager          the mfa manager
   * @param loginLimiter        limiter keyed by username
   * @param registrationLimiter limiter keyed by client address, counts rejected registrations
   */
  public AccountManager(final AccountStore accountStore,
                        final TokenManager tokenManager,
                        final MfaManager mfaManager,
                        final AttemptLimiter loginLimiter,
                        final AttemptLimiter registrationLimiter) {
    log.info("AccountManager()");
    this.accountStore = accountStore;
    this.tokenManager = tokenManager;
    this.mfaManager = mfaManager;
    this.loginLimiter = loginLimiter;
    this.registrationLimiter = registrationLimiter;
  }

  /**
   * The public auth salt of an account.
   *
   * @param username the username
   * @return the salt, empty if not registered
   */
  public Optional<byte[]> authSalt(final String username) {
    log.debug("authSalt(username={})", username);
    return accountStore.load(username).map(Account::salt);
  }

  /**
   * Creates an account.
   *
   * @param request       the request
   * @param clientAddress the caller's address, for rate limiting
   * @throws IllegalArgumentException   for a malformed request
   * @throws UsernameTakenException     if the username exists
   * @throws RateLimitExceededException after too many rejected registrations from the address
   */
  public void register(final RegisterRequest request, final String clientAddress) {
    String username = requireUsername(request.username());
    log.debug("register(username={})", username);
    registrationLimiter.check(clientAddress);
    byte[] salt = ByteUtils.requireHex(request.saltHex(), "salt");
    byte[] verifier = ByteUtils.requireHex(request.verifierHex(), "verifier");
    requireLength(salt, KeyDerivation.SALT_LENGTH, "salt");
    requireLength(verifier, KeyDerivation.KEY_LENGTH, "verifier");
    if (!accountStore.create(Account.registered(username, salt, verifier))) {
      registrationLimiter.recordFailure(clientAddress);
      throw new UsernameTakenException(username);
    }
  }

  /**
   * Password login.
   *
   * @param request the request
   * @return a {@link TokenStage#FULL} token, or {@link TokenStage#PASSWORD} when a second factor
   *     is enrolled
   * @throws SecurityException          for an unknown user or wrong verifier
   * @throws RateLimitExceededException while the username is locked out
   */
  public String login(final LoginRequest request) {
    String username = requireUsername(request.username());
    log.debug("login(username={})", username);
    loginLimiter.check(username);
    Account account = verifyAccount(username, request.verifierHex());
    loginLimiter.recordSuccess(username);
    TokenStage stage = account.mfaEnabled() ? TokenStage.PASSWORD : TokenStage.FULL;
    return tokenManager.issueToken(username, stage);
  }

  /**
   * Login with a second factor. The verifier is checked before the code.
   *
   * @param request the request
   * @return a {@link TokenStage#FULL} token
   * @throws SecurityException          for an unknown user, wrong verifier or wrong code
   * @throws RateLimitExceededException while the username is locked out
   */
  public String loginWithSecondFactor(final MfaLoginRequest request) {
    String username = requireUsername(request.username());
    log.debug("loginWithSecondFactor(username={})", username);
    loginLimiter.check(username);
    Account account = verifyAccount(username, request.verifierHex());
    if (account.mfaEnabled() && !mfaManager.acceptLoginCode(username, request.mfaCode())) {
      loginLimiter.recordFailure(username);
      throw new SecurityException("Invalid second factor");
    }
    loginLimiter.recordSuccess(username);
    return tokenManager.issueToken(username, TokenStage.FULL);
  }

  /**
   * Revokes the principal's token. Password-stage tokens may be revoked too.
   *
   * @param principal the authenticated caller
   */
  public void logout(final LockboxPrincipal principal) {
    log.debug("logout(username={})", principal.username());
    tokenManager.revoke(principal.jti());
  }

  private Account verifyAccount(final String username, final String verifierHex) {
    byte[] presented = ByteUtils.requireHex(verifierHex, "verifier");
    Optional<Account> account = accountStore.load(username);
    if (account.isEmpty() || !MessageDigest.isEqual(account.get().verifier(), presented)) {
      loginLimiter.recordFailure(username);
      throw new SecurityException("Invalid credentials");
    }
    return account.get();
  }

  static String requireUsername(final String username) {
    if (username == null || username.isBlank()) {
      throw new IllegalArgumentException("Missing required field: username");
    }
    if (username.length() > MAX_USERNAME_LENGTH) {
      throw new IllegalArgumentException("Username longer than " + MAX_USERNAME_LENGTH + " characters");
    }
    return username;
  }

  private static void requireLength(final byte[] value, final int length, final String fieldName) {
    if (value.length != length) {
      throw new IllegalArgumentException("Field " + fieldName + " must be " + length + " bytes");
    }
  }
}
