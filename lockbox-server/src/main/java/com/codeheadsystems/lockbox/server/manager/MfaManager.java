package com.codeheadsystems.lockbox.server.manager;

import com.codeheadsystems.lockbox.crypto.common.ByteUtils;
import com.codeheadsystems.lockbox.crypto.common.RandomProvider;
import com.codeheadsystems.lockbox.model.MfaSetupResponse;
import com.codeheadsystems.lockbox.server.auth.LockboxPrincipal;
import com.codeheadsystems.lockbox.server.exceptions.RateLimitExceededException;
import com.codeheadsystems.lockbox.server.limiter.AttemptLimiter;
import com.codeheadsystems.lockbox.server.mfa.TotpManager;
import com.codeheadsystems.lockbox.server.store.Account;
import com.codeheadsystems.lockbox.server.store.AccountStore;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Second-factor enrollment, verification and removal.
 * <p>
 * <strong>Enrollment:</strong>
 * <ol>
 *   <li>{@link #setup} (full token) generates a TOTP secret and backup codes and keeps them
 *       pending. The account's current factor, if any, stays active.</li>
 *   <li>{@link #verify} with a code from the new secret activates it.</li>
 * </ol>
 * Backup codes are stored as SHA-256 hashes and each one is accepted once.
 */
public class MfaManager {

  /**
   * Backup codes issued per enrollment.
   */
  public static final int BACKUP_CODE_COUNT = 8;

  private static final Logger log = LoggerFactory.getLogger(MfaManager.class);
  private static final String BACKUP_ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";

  private final AccountStore accountStore;
  private final TotpManager totpManager;
  private final AttemptLimiter verifyLimiter;
  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Mfa manager.
   *
   * @param accountStore   the account store
   * @param totpManager    the totp manager
   * @param verifyLimiter  limiter for {@link #verify}, keyed by username
   * @param randomProvider source for backup codes
   */
  public MfaManager(final AccountStore accountStore,
                    final TotpManager totpManager,
                    final AttemptLimiter verifyLimiter,
                    final RandomProvider randomProvider) {
    log.info("MfaManager()");
    this.accountStore = accountStore;
    this.totpManager = totpManager;
    this.verifyLimiter = verifyLimiter;
    this.randomProvider = randomProvider;
  }

  /**
   * Whether the account has an active second factor. Unknown accounts report false.
   *
   * @param username the username
   * @return true if enabled
   */
  public boolean status(final String username) {
    log.debug("status(username={})", username);
    return accountStore.load(username).map(Account::mfaEnabled).orElse(false);
  }

  /**
   * Starts an enrollment for the principal's account.
   *
   * @param principal the authenticated caller
   * @return the secret, provisioning URI and backup codes, shown once
   * @throws SecurityException unless the token is a full token
   */
  public MfaSetupResponse setup(final LockboxPrincipal principal) {
    String username = principal.requireFull().username();
    log.debug("setup(username={})", username);
    String secret = totpManager.generateSecret();
    List<String> codes = new ArrayList<>();
    Set<String> hashes = new HashSet<>();
    while (codes.size() < BACKUP_CODE_COUNT) {
      String code = backupCode();
      if (hashes.add(hash(code))) {
        codes.add(code);
      }
    }
    accountStore.update(username, account -> account.withPendingMfa(secret, hashes))
        .orElseThrow(() -> new SecurityException("Account no longer exists"));
    String uri = totpManager.provisioningUri(username, secret);
    return new MfaSetupResponse(secret, uri, uri, codes);
  }

  /**
   * Checks a TOTP code. A valid code for a pending enrollment activates it.
   *
   * @param username the username
   * @param code     the code
   * @throws IllegalArgumentException   for an unknown account, no factor, or a wrong code
   * @throws RateLimitExceededException after too many wrong codes
   */
  public void verify(final String username, final String code) {
    AccountManager.requireUsername(username);
    log.debug("verify(username={})", username);
    String key = "verify:" + username;
    verifyLimiter.check(key);
    Optional<Account> account = accountStore.load(username);
    if (account.isPresent() && totpManager.verify(account.get().pendingTotpSecret(), code)) {
      accountStore.update(username, Account::withPendingMfaActivated);
      verifyLimiter.recordSuccess(key);
      log.info("Second factor enabled for {}", username);
      return;
    }
    if (account.isPresent() && totpManager.verify(account.get().totpSecret(), code)) {
      verifyLimiter.recordSuccess(key);
      return;
    }
    verifyLimiter.recordFailure(key);
    throw new IllegalArgumentException("Invalid code");
  }

  /**
   * Removes the second factor of the principal's account.
   *
   * @param principal the authenticated caller
   * @throws SecurityException unless the token is a full token
   */
  public void disable(final LockboxPrincipal principal) {
    String username = principal.requireFull().username();
    log.debug("disable(username={})", username);
    accountStore.update(username, Account::withoutMfa);
  }

  /**
   * Checks a login code: a TOTP code of the active secret, or an unused backup code which is
   * consumed.
   *
   * @param username the username
   * @param code     the code
   * @return true if accepted
   */
  boolean acceptLoginCode(final String username, final String code) {
    if (code == null || code.isBlank()) {
      return false;
    }
    Optional<Account> account = accountStore.load(username);
    if (account.isEmpty()) {
      return false;
    }
    if (totpManager.verify(account.get().totpSecret(), code)) {
      return true;
    }
    String codeHash = hash(code);
    AtomicBoolean consumed = new AtomicBoolean();
    accountStore.update(username, current -> {
      if (current.backupCodeHashes().contains(codeHash)) {
        consumed.set(true);
        return current.withoutBackupCode(codeHash);
      }
      return current;
    });
    if (consumed.get()) {
      log.info("Backup code used for {}", username);
    }
    return consumed.get();
  }

  private String backupCode() {
    StringBuilder sb = new StringBuilder(9);
    for (int i = 0; i < 8; i++) {
      if (i == 4) {
        sb.append('-');
      }
      sb.append(BACKUP_ALPHABET.charAt(randomProvider.nextInt(BACKUP_ALPHABET.length())));
    }
    return sb.toString();
  }

  static String hash(final String code) {
    byte[] input = code.trim().toUpperCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8);
    SHA256Digest digest = new SHA256Digest();
    digest.update(input, 0, input.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return ByteUtils.toHex(out);
  }
}
