package com.codeheadsystems.lockbox.client.session;

import com.codeheadsystems.lockbox.client.model.SessionToken;
import com.codeheadsystems.lockbox.crypto.model.CredentialCollection;
import com.codeheadsystems.lockbox.crypto.secret.Secret;
import com.codeheadsystems.lockbox.crypto.vault.SealedVault;
import java.util.Optional;

/**
 * Everything one signed-in user's session holds.
 * <p>
 * Only the {@link SessionLockController} that owns it mutates it, always while holding the
 * controller's monitor. What survives a lock is the username, the second-factor flag and the
 * sealed vault; the token, the collection and the secret do not.
 */
public final class SessionContext {

  private LockState state = LockState.SIGNED_OUT;
  private String username;
  private boolean mfaEnabled;
  private SealedVault sealedVault;
  private SessionToken token;
  private CredentialCollection collection;
  private Secret secret;

  // Held only while AWAITING_SECOND_FACTOR.
  private Secret pendingSecret;
  private CredentialCollection pendingCollection;
  private boolean pendingFromLock;

  SessionContext() {
  }

  public LockState state() {
    return state;
  }

  public Optional<String> username() {
    return Optional.ofNullable(username);
  }

  public boolean mfaEnabled() {
    return mfaEnabled;
  }

  /**
   * The last sealed vault fetched or stored. Empty when the account never stored one.
   *
   * @return the sealed vault
   */
  public Optional<SealedVault> sealedVault() {
    return Optional.ofNullable(sealedVault);
  }

  // ── Controller-only access ────────────────────────────────────────────────

  SessionToken token() {
    return token;
  }

  CredentialCollection collection() {
    return collection;
  }

  Secret secret() {
    return secret;
  }

  Secret pendingSecret() {
    return pendingSecret;
  }

  CredentialCollection pendingCollection() {
    return pendingCollection;
  }

  boolean pendingFromLock() {
    return pendingFromLock;
  }

  void state(final LockState state) {
    this.state = state;
  }

  void mfaEnabled(final boolean mfaEnabled) {
    this.mfaEnabled = mfaEnabled;
  }

  void sealedVault(final SealedVault sealedVault) {
    this.sealedVault = sealedVault;
  }

  void unlocked(final String username, final SessionToken token, final SealedVault sealedVault,
                final CredentialCollection collection, final Secret secret) {
    clearPending();
    clearUnlocked();
    this.username = username;
    this.token = token;
    this.sealedVault = sealedVault;
    this.collection = collection;
    this.secret = secret;
    this.state = LockState.UNLOCKED;
  }

  void awaiting(final String username, final Secret pendingSecret,
                final CredentialCollection pendingCollection, final boolean fromLock) {
    clearPending();
    clearUnlocked();
    this.username = username;
    this.pendingSecret = pendingSecret;
    this.pendingCollection = pendingCollection;
    this.pendingFromLock = fromLock;
    this.mfaEnabled = true;
    this.state = LockState.AWAITING_SECOND_FACTOR;
  }

  void locked() {
    clearPending();
    clearUnlocked();
    this.state = LockState.LOCKED;
  }

  void signedOut() {
    clearPending();
    clearUnlocked();
    this.username = null;
    this.sealedVault = null;
    this.mfaEnabled = false;
    this.state = LockState.SIGNED_OUT;
  }

  /**
   * Drops the pending second-factor material and returns whether it came from a lock.
   */
  boolean cancelPending() {
    boolean fromLock = pendingFromLock;
    clearPending();
    return fromLock;
  }

  private void clearUnlocked() {
    token = null;
    if (collection != null) {
      collection.clear();
      collection = null;
    }
    if (secret != null) {
      secret.destroy();
      secret = null;
    }
  }

  private void clearPending() {
    if (pendingSecret != null) {
      pendingSecret.destroy();
      pendingSecret = null;
    }
    if (pendingCollection != null) {
      pendingCollection.clear();
      pendingCollection = null;
    }
    pendingFromLock = false;
  }
}
