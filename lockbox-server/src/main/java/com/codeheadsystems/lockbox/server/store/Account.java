package com.codeheadsystems.lockbox.server.store;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A registered account. The authority only ever sees the auth salt and the verifier derived
 * from the secret, never the secret itself.
 *
 * @param username               the username
 * @param salt                   the 16-byte auth salt chosen by the client
 * @param verifier               the 32-byte verifier
 * @param totpSecret             active Base32 TOTP secret, null without a second factor
 * @param pendingTotpSecret      TOTP secret awaiting its first code, null if none
 * @param backupCodeHashes       SHA-256 hex of the unused backup codes of the active factor
 * @param pendingBackupCodeHashes backup code hashes that become active with the pending secret
 */
public record Account(String username,
                      byte[] salt,
                      byte[] verifier,
                      String totpSecret,
                      String pendingTotpSecret,
                      Set<String> backupCodeHashes,
                      Set<String> pendingBackupCodeHashes) {

  /**
   * Copies the arrays and sets.
   */
  public Account {
    Objects.requireNonNull(username, "username");
    salt = salt.clone();
    verifier = verifier.clone();
    backupCodeHashes = backupCodeHashes == null ? Set.of() : Set.copyOf(backupCodeHashes);
    pendingBackupCodeHashes = pendingBackupCodeHashes == null ? Set.of() : Set.copyOf(pendingBackupCodeHashes);
  }

  /**
   * A freshly registered account without a second factor.
   *
   * @param username the username
   * @param salt     the salt
   * @param verifier the verifier
   * @return the account
   */
  public static Account registered(final String username, final byte[] salt, final byte[] verifier) {
    return new Account(username, salt, verifier, null, null, Set.of(), Set.of());
  }

  @Override
  public byte[] salt() {
    return salt.clone();
  }

  @Override
  public byte[] verifier() {
    return verifier.clone();
  }

  public boolean mfaEnabled() {
    return totpSecret != null;
  }

  /**
   * Starts an enrollment, replacing any earlier pending one.
   *
   * @param secret      the new TOTP secret
   * @param codeHashes  hashes of the new backup codes
   * @return the account
   */
  public Account withPendingMfa(final String secret, final Set<String> codeHashes) {
    return new Account(username, salt, verifier, totpSecret, secret, backupCodeHashes, codeHashes);
  }

  /**
   * Promotes the pending secret and backup codes to active.
   *
   * @return the account
   */
  public Account withPendingMfaActivated() {
    return new Account(username, salt, verifier, pendingTotpSecret, null, pendingBackupCodeHashes, Set.of());
  }

  public Account withoutMfa() {
    return new Account(username, salt, verifier, null, null, Set.of(), Set.of());
  }

  /**
   * Consumes one backup code.
   *
   * @param codeHash the code hash
   * @return the account
   */
  public Account withoutBackupCode(final String codeHash) {
    Set<String> remaining = new HashSet<>(backupCodeHashes);
    remaining.remove(codeHash);
    return new Account(username, salt, verifier, totpSecret, pendingTotpSecret, remaining, pendingBackupCodeHashes);
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof Account other
        && username.equals(other.username)
        && Arrays.equals(salt, other.salt)
        && Arrays.equals(verifier, other.verifier)
        && Objects.equals(totpSecret, other.totpSecret)
        && Objects.equals(pendingTotpSecret, other.pendingTotpSecret)
        && backupCodeHashes.equals(other.backupCodeHashes)
        && pendingBackupCodeHashes.equals(other.pendingBackupCodeHashes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(username, Arrays.hashCode(salt), Arrays.hashCode(verifier), totpSecret);
  }

  @Override
  public String toString() {
    return "Account[username=" + username + ", mfaEnabled=" + mfaEnabled() + "]";
  }
}
