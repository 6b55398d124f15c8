package com.codeheadsystems.lockbox.client.session;

import com.codeheadsystems.lockbox.client.config.LockboxClientConfig;
import com.codeheadsystems.lockbox.client.manager.CredentialManager;
import com.codeheadsystems.lockbox.client.manager.VaultManager;
import com.codeheadsystems.lockbox.client.model.LoginOutcome;
import com.codeheadsystems.lockbox.client.model.MfaEnrollment;
import com.codeheadsystems.lockbox.client.model.RateLimited;
import com.codeheadsystems.lockbox.client.model.RegisterOutcome;
import com.codeheadsystems.lockbox.client.model.SessionOutcome;
import com.codeheadsystems.lockbox.client.model.SessionToken;
import com.codeheadsystems.lockbox.crypto.common.RandomProvider;
import com.codeheadsystems.lockbox.crypto.exceptions.DecryptionFailureException;
import com.codeheadsystems.lockbox.crypto.kdf.KeyDerivation;
import com.codeheadsystems.lockbox.crypto.model.CredentialCollection;
import com.codeheadsystems.lockbox.crypto.model.CredentialRecord;
import com.codeheadsystems.lockbox.crypto.secret.Secret;
import com.codeheadsystems.lockbox.crypto.vault.SealedVault;
import com.codeheadsystems.lockbox.crypto.vault.VaultCipher;
import com.codeheadsystems.lockbox.crypto.vault.VaultCodec;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import javax.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gates access to the decrypted credential collection.
 * <p>
 * States and transitions:
 * <ul>
 *   <li>{@code SIGNED_OUT -> UNLOCKED} on {@link #signIn} for accounts without a second factor,
 *       {@code SIGNED_OUT -> AWAITING_SECOND_FACTOR} for accounts with one.</li>
 *   <li>{@code UNLOCKED -> LOCKED} when the idle countdown expires or on {@link #lockNow()}.
 *       Activity restarts the countdown, except while the host is backgrounded. The countdown
 *       keeps running in the background; returning to the foreground restarts it at full
 *       length.</li>
 *   <li>{@code LOCKED -> UNLOCKED} or {@code LOCKED -> AWAITING_SECOND_FACTOR} on
 *       {@link #unlock} once the secret opens the retained sealed vault and the authority
 *       accepts it again. A failing secret keeps the session locked.</li>
 *   <li>{@code AWAITING_SECOND_FACTOR -> UNLOCKED} on {@link #submitSecondFactor} with a valid
 *       code; {@link #cancelSecondFactor()} returns to {@code LOCKED} (or {@code SIGNED_OUT}
 *       when the attempt began at sign-in) and discards the tentative secret.</li>
 *   <li>Any state {@code -> SIGNED_OUT} on {@link #logout()}.</li>
 * </ul>
 * Key derivation and network calls run on the worker executor. Every sign-in, unlock and
 * second-factor submission draws a sequence number; its result is applied only if no newer
 * attempt has been applied and no lock or logout happened after it started. Stale results are
 * reported as {@link SessionOutcome.Superseded}.
 * <p>
 * A lock drops the token, the collection and the secret. Only the sealed vault, the username
 * and the second-factor flag survive it.
 */
public class SessionLockController implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(SessionLockController.class);

  private final CredentialManager credentialManager;
  private final VaultManager vaultManager;
  private final VaultCipher vaultCipher;
  private final ActivityLog activityLog;
  private final ExecutorService worker;
  private final ScheduledExecutorService scheduler;
  private final boolean ownsExecutors;
  private final Duration idleTimeout;

  private final SessionContext context = new SessionContext();
  private final List<LockStateListener> listeners = new CopyOnWriteArrayList<>();
  private final AtomicLong attempts = new AtomicLong();

  // Guarded by this.
  private long appliedSeq;
  private long fenceSeq;
  private long timerGeneration;
  private ScheduledFuture<?> idleTimer;
  private boolean backgrounded;

  /**
   * Instantiates a controller that owns its worker and timer threads.
   *
   * @param config            the config
   * @param credentialManager the credential manager
   * @param vaultManager      the vault manager
   * @param activityLog       the activity log
   */
  @Inject
  public SessionLockController(final LockboxClientConfig config,
                               final CredentialManager credentialManager,
                               final VaultManager vaultManager,
                               final ActivityLog activityLog) {
    this(config.idleTimeout(), credentialManager, vaultManager,
        new VaultCipher(new KeyDerivation(config.kdfParameters()), new RandomProvider(), new VaultCodec(),
            Clock.systemUTC()),
        activityLog,
        Executors.newCachedThreadPool(daemon("lockbox-worker")),
        Executors.newSingleThreadScheduledExecutor(daemon("lockbox-idle-timer")),
        true);
  }

  /**
   * Instantiates a controller on caller-supplied executors, which the caller shuts down.
   *
   * @param idleTimeout       the idle timeout
   * @param credentialManager the credential manager
   * @param vaultManager      the vault manager
   * @param vaultCipher       the vault cipher
   * @param activityLog       the activity log
   * @param worker            executor for key derivation and network calls
   * @param scheduler         executor for the idle timer
   */
  public SessionLockController(final Duration idleTimeout,
                               final CredentialManager credentialManager,
                               final VaultManager vaultManager,
                               final VaultCipher vaultCipher,
                               final ActivityLog activityLog,
                               final ExecutorService worker,
                               final ScheduledExecutorService scheduler) {
    this(idleTimeout, credentialManager, vaultManager, vaultCipher, activityLog, worker, scheduler, false);
  }

  private SessionLockController(final Duration idleTimeout,
                                final CredentialManager credentialManager,
                                final VaultManager vaultManager,
                                final VaultCipher vaultCipher,
                                final ActivityLog activityLog,
                                final ExecutorService worker,
                                final ScheduledExecutorService scheduler,
                                final boolean ownsExecutors) {
    log.info("SessionLockController(idleTimeout={})", idleTimeout);
    this.idleTimeout = idleTimeout;
    this.credentialManager = credentialManager;
    this.vaultManager = vaultManager;
    this.vaultCipher = vaultCipher;
    this.activityLog = activityLog;
    this.worker = worker;
    this.scheduler = scheduler;
    this.ownsExecutors = ownsExecutors;
  }

  private static ThreadFactory daemon(final String name) {
    return r -> {
      Thread t = new Thread(r, name);
      t.setDaemon(true);
      return t;
    };
  }

  // ── Listeners and queries ─────────────────────────────────────────────────

  /**
   * Adds a state listener.
   *
   * @param listener the listener
   */
  public void addListener(final LockStateListener listener) {
    listeners.add(listener);
  }

  public synchronized LockState state() {
    return context.state();
  }

  public synchronized Optional<String> username() {
    return context.username();
  }

  public synchronized boolean mfaEnabled() {
    return context.mfaEnabled();
  }

  /**
   * The sealed vault retained for offline unlock.
   *
   * @return the sealed vault
   */
  public synchronized Optional<SealedVault> sealedVault() {
    return context.sealedVault();
  }

  /**
   * A copy of the decrypted collection.
   *
   * @return the credential collection
   * @throws IllegalStateException unless unlocked
   */
  public synchronized CredentialCollection collection() {
    requireUnlocked();
    return new CredentialCollection(context.collection().entries());
  }

  /**
   * Adds or replaces an entry in the unlocked collection. Call {@link #save()} to persist.
   *
   * @param title  the title
   * @param record the record
   * @throws IllegalStateException unless unlocked
   */
  public synchronized void putEntry(final String title, final CredentialRecord record) {
    requireUnlocked();
    context.collection().put(title, record);
  }

  /**
   * Removes an entry from the unlocked collection. Call {@link #save()} to persist.
   *
   * @param title the title
   * @return true if removed
   * @throws IllegalStateException unless unlocked
   */
  public synchronized boolean removeEntry(final String title) {
    requireUnlocked();
    return context.collection().remove(title);
  }

  // ── Sign in, unlock, second factor ────────────────────────────────────────

  /**
   * Registers a new account. Does not sign in.
   *
   * @param username the username
   * @param secret   the secret, copied; the caller keeps ownership of its instance
   * @return the register outcome
   */
  public CompletableFuture<RegisterOutcome> register(final String username, final Secret secret) {
    log.debug("register(username={})", username);
    final Secret attemptSecret = secret.copy();
    return async(() -> {
      try {
        RegisterOutcome outcome = credentialManager.register(username, attemptSecret);
        if (outcome instanceof RegisterOutcome.Registered) {
          activityLog.record(username, ActivityEvent.REGISTERED);
        }
        return outcome;
      } finally {
        attemptSecret.destroy();
      }
    });
  }

  /**
   * Signs in: verifies the secret with the authority, fetches and opens the vault.
   *
   * @param username the username
   * @param secret   the secret, copied; the caller keeps ownership of its instance
   * @return the session outcome
   */
  public CompletableFuture<SessionOutcome> signIn(final String username, final Secret secret) {
    log.debug("signIn(username={})", username);
    final long seq = attempts.incrementAndGet();
    final Secret attemptSecret = secret.copy();
    return async(() -> {
      try {
        return runSignIn(seq, username, attemptSecret);
      } finally {
        attemptSecret.destroy();
      }
    });
  }

  private SessionOutcome runSignIn(final long seq, final String username, final Secret secret) {
    LoginOutcome outcome = credentialManager.login(username, secret);
    if (outcome instanceof LoginOutcome.Authenticated authenticated) {
      return openAndApply(seq, username, authenticated.token(), secret, false, ActivityEvent.LOGGED_IN);
    }
    if (outcome instanceof LoginOutcome.MfaRequired) {
      LockState previous;
      synchronized (this) {
        if (!isCurrent(seq)) {
          return new SessionOutcome.Superseded();
        }
        appliedSeq = seq;
        previous = context.state();
        cancelIdleTimer();
        context.sealedVault(null);
        context.awaiting(username, secret.copy(), null, false);
      }
      fire(previous, LockState.AWAITING_SECOND_FACTOR);
      return new SessionOutcome.SecondFactorRequired();
    }
    return staleOr(seq, failure(outcome));
  }

  /**
   * Unlocks a locked session. The secret must first open the retained sealed vault; only then is
   * it sent (as a verifier) to the authority to obtain a new token.
   *
   * @param secret the secret, copied; the caller keeps ownership of its instance
   * @return the session outcome; fails with {@link IllegalStateException} unless locked
   */
  public CompletableFuture<SessionOutcome> unlock(final Secret secret) {
    final String username;
    final SealedVault sealed;
    synchronized (this) {
      if (context.state() != LockState.LOCKED) {
        return CompletableFuture.failedFuture(new IllegalStateException("Session is not locked"));
      }
      username = context.username().orElseThrow();
      sealed = context.sealedVault().orElse(null);
    }
    log.debug("unlock(username={})", username);
    final long seq = attempts.incrementAndGet();
    final Secret attemptSecret = secret.copy();
    return async(() -> {
      try {
        return runUnlock(seq, username, sealed, attemptSecret);
      } finally {
        attemptSecret.destroy();
      }
    });
  }

  private SessionOutcome runUnlock(final long seq, final String username, final SealedVault sealed,
                                   final Secret secret) {
    CredentialCollection collection;
    if (sealed == null) {
      collection = new CredentialCollection();
    } else {
      try {
        collection = vaultCipher.unseal(sealed, secret);
      } catch (DecryptionFailureException e) {
        return unlockFailed(seq, username);
      }
    }
    try {
      LoginOutcome outcome = credentialManager.login(username, secret);
      if (outcome instanceof LoginOutcome.Authenticated authenticated) {
        LockState previous;
        synchronized (this) {
          if (!isCurrent(seq)) {
            return new SessionOutcome.Superseded();
          }
          appliedSeq = seq;
          previous = context.state();
          context.unlocked(username, authenticated.token(), sealed, collection, secret.copy());
          collection = null;
          armIdleTimer();
        }
        fire(previous, LockState.UNLOCKED);
        activityLog.record(username, ActivityEvent.UNLOCKED);
        return new SessionOutcome.Unlocked();
      }
      if (outcome instanceof LoginOutcome.MfaRequired) {
        LockState previous;
        synchronized (this) {
          if (!isCurrent(seq)) {
            return new SessionOutcome.Superseded();
          }
          appliedSeq = seq;
          previous = context.state();
          context.awaiting(username, secret.copy(), collection, true);
          collection = null;
        }
        fire(previous, LockState.AWAITING_SECOND_FACTOR);
        return new SessionOutcome.SecondFactorRequired();
      }
      if (outcome instanceof LoginOutcome.InvalidCredentials) {
        return unlockFailed(seq, username);
      }
      return staleOr(seq, failure(outcome));
    } finally {
      if (collection != null) {
        collection.clear();
      }
    }
  }

  /**
   * Submits a second-factor code for the pending sign-in or unlock.
   *
   * @param code a TOTP code or backup code
   * @return the session outcome; an invalid code leaves the session awaiting a code. Fails with
   *     {@link IllegalStateException} unless a code is awaited.
   */
  public CompletableFuture<SessionOutcome> submitSecondFactor(final String code) {
    final String username;
    final Secret attemptSecret;
    final CredentialCollection pendingCollection;
    final SealedVault sealed;
    final boolean fromLock;
    final long seq;
    synchronized (this) {
      if (context.state() != LockState.AWAITING_SECOND_FACTOR) {
        return CompletableFuture.failedFuture(new IllegalStateException("No second factor is pending"));
      }
      username = context.username().orElseThrow();
      attemptSecret = context.pendingSecret().copy();
      pendingCollection = context.pendingCollection() == null
          ? null
          : new CredentialCollection(context.pendingCollection().entries());
      sealed = context.sealedVault().orElse(null);
      fromLock = context.pendingFromLock();
      seq = attempts.incrementAndGet();
    }
    log.debug("submitSecondFactor(username={})", username);
    return async(() -> {
      try {
        LoginOutcome outcome = credentialManager.loginWithSecondFactor(username, attemptSecret, code);
        if (!(outcome instanceof LoginOutcome.Authenticated authenticated)) {
          if (pendingCollection != null) {
            pendingCollection.clear();
          }
          return staleOr(seq, failure(outcome));
        }
        if (pendingCollection == null) {
          return openAndApply(seq, username, authenticated.token(), attemptSecret, true, ActivityEvent.LOGGED_IN);
        }
        return apply(seq, username, authenticated.token(), sealed, pendingCollection, attemptSecret, true,
            fromLock ? ActivityEvent.UNLOCKED : ActivityEvent.LOGGED_IN);
      } finally {
        attemptSecret.destroy();
      }
    });
  }

  /**
   * Abandons the pending second factor. Returns to {@code LOCKED} when the attempt began from a
   * lock, otherwise to {@code SIGNED_OUT}. Nothing is sent to the authority.
   *
   * @return the resulting state
   */
  public LockState cancelSecondFactor() {
    LockState previous;
    LockState current;
    synchronized (this) {
      previous = context.state();
      if (previous != LockState.AWAITING_SECOND_FACTOR) {
        return previous;
      }
      fence();
      if (context.cancelPending()) {
        context.locked();
      } else {
        context.signedOut();
      }
      current = context.state();
    }
    log.debug("cancelSecondFactor() -> {}", current);
    fire(previous, current);
    return current;
  }

  // ── Second-factor management ──────────────────────────────────────────────

  /**
   * Starts second-factor enrollment for the signed-in account.
   *
   * @return the enrollment; fails with {@link IllegalStateException} unless unlocked
   */
  public CompletableFuture<MfaEnrollment> enrollSecondFactor() {
    final SessionToken token;
    synchronized (this) {
      if (context.state() != LockState.UNLOCKED) {
        return CompletableFuture.failedFuture(new IllegalStateException("Session is not unlocked"));
      }
      token = context.token();
    }
    return async(() -> credentialManager.enrollSecondFactor(token));
  }

  /**
   * Confirms a pending enrollment with a code from the new secret.
   *
   * @param code the code
   * @return true if the second factor is now active
   */
  public CompletableFuture<Boolean> confirmSecondFactor(final String code) {
    final String username;
    synchronized (this) {
      if (context.state() != LockState.UNLOCKED) {
        return CompletableFuture.failedFuture(new IllegalStateException("Session is not unlocked"));
      }
      username = context.username().orElseThrow();
    }
    return async(() -> {
      boolean accepted = credentialManager.verifySecondFactor(username, code);
      if (accepted) {
        synchronized (this) {
          if (username.equals(context.username().orElse(null))) {
            context.mfaEnabled(true);
          }
        }
        activityLog.record(username, ActivityEvent.MFA_ENABLED);
      }
      return accepted;
    });
  }

  /**
   * Removes the second factor of the signed-in account.
   *
   * @return true if removed
   */
  public CompletableFuture<Boolean> disableSecondFactor() {
    final String username;
    final SessionToken token;
    synchronized (this) {
      if (context.state() != LockState.UNLOCKED) {
        return CompletableFuture.failedFuture(new IllegalStateException("Session is not unlocked"));
      }
      username = context.username().orElseThrow();
      token = context.token();
    }
    return async(() -> {
      boolean disabled = credentialManager.disableSecondFactor(token);
      if (disabled) {
        synchronized (this) {
          if (username.equals(context.username().orElse(null))) {
            context.mfaEnabled(false);
          }
        }
        activityLog.record(username, ActivityEvent.MFA_DISABLED);
      }
      return disabled;
    });
  }

  // ── Save, lock, logout ────────────────────────────────────────────────────

  /**
   * Seals the current collection under a fresh salt and nonce and replaces the remote copy.
   *
   * @return the new sealed vault; fails with {@link IllegalStateException} unless unlocked
   */
  public CompletableFuture<SealedVault> save() {
    final String username;
    final SessionToken token;
    final CredentialCollection snapshot;
    final Secret secret;
    synchronized (this) {
      if (context.state() != LockState.UNLOCKED) {
        return CompletableFuture.failedFuture(new IllegalStateException("Session is not unlocked"));
      }
      username = context.username().orElseThrow();
      token = context.token();
      snapshot = new CredentialCollection(context.collection().entries());
      secret = context.secret().copy();
    }
    log.debug("save(username={}, entries={})", username, snapshot.size());
    return async(() -> {
      try {
        SealedVault sealed = vaultCipher.seal(snapshot, secret);
        vaultManager.storeVault(token, sealed);
        synchronized (this) {
          if (username.equals(context.username().orElse(null)) && context.state() != LockState.SIGNED_OUT) {
            context.sealedVault(sealed);
          }
        }
        activityLog.record(username, ActivityEvent.VAULT_SAVED);
        return sealed;
      } finally {
        secret.destroy();
        snapshot.clear();
      }
    });
  }

  /**
   * Locks immediately. No effect unless unlocked or awaiting a code during an unlock.
   *
   * @return true if the session locked
   */
  public boolean lockNow() {
    return lock(ActivityEvent.LOCKED, -1);
  }

  /**
   * Delivers a host lifecycle event.
   *
   * @param event the event
   */
  public synchronized void onHostEvent(final HostEvent event) {
    switch (event) {
      case ACTIVITY -> {
        if (!backgrounded && context.state() == LockState.UNLOCKED) {
          armIdleTimer();
        }
      }
      case BACKGROUNDED -> backgrounded = true;
      case FOREGROUNDED -> {
        backgrounded = false;
        if (context.state() == LockState.UNLOCKED) {
          armIdleTimer();
        }
      }
      default -> throw new IllegalArgumentException("Unknown event: " + event);
    }
  }

  /**
   * Signs out: clears the token, collection, secret and sealed vault locally, then revokes the
   * token with the authority. Local state is cleared even if the revocation fails.
   *
   * @return completes when the authority has revoked the token
   */
  public CompletableFuture<Void> logout() {
    final SessionToken token;
    final String username;
    final LockState previous;
    synchronized (this) {
      previous = context.state();
      token = context.token();
      username = context.username().orElse(null);
      fence();
      cancelIdleTimer();
      context.signedOut();
    }
    log.debug("logout(username={})", username);
    fire(previous, LockState.SIGNED_OUT);
    if (username != null) {
      activityLog.record(username, ActivityEvent.LOGGED_OUT);
    }
    if (token == null) {
      return CompletableFuture.completedFuture(null);
    }
    return CompletableFuture.runAsync(() -> credentialManager.logout(token), worker);
  }

  @Override
  public void close() {
    synchronized (this) {
      cancelIdleTimer();
    }
    if (ownsExecutors) {
      scheduler.shutdownNow();
      worker.shutdownNow();
    }
  }

  // ── Internals ─────────────────────────────────────────────────────────────

  private <T> CompletableFuture<T> async(final Supplier<T> task) {
    return CompletableFuture.supplyAsync(task, worker);
  }

  private SessionOutcome openAndApply(final long seq, final String username, final SessionToken token,
                                      final Secret secret, final boolean mfaEnabled, final ActivityEvent event) {
    Optional<SealedVault> sealed;
    CredentialCollection collection;
    try {
      sealed = vaultManager.fetchVault(token);
      collection = sealed.isPresent() ? vaultCipher.unseal(sealed.get(), secret) : new CredentialCollection();
    } catch (DecryptionFailureException e) {
      log.warn("Stored vault for {} could not be opened", username);
      revoke(token);
      return unlockFailed(seq, username);
    }
    return apply(seq, username, token, sealed.orElse(null), collection, secret, mfaEnabled, event);
  }

  private SessionOutcome apply(final long seq, final String username, final SessionToken token,
                               final SealedVault sealed, final CredentialCollection collection,
                               final Secret secret, final boolean mfaEnabled, final ActivityEvent event) {
    LockState previous;
    synchronized (this) {
      if (!isCurrent(seq)) {
        collection.clear();
        revoke(token);
        return new SessionOutcome.Superseded();
      }
      appliedSeq = seq;
      previous = context.state();
      context.unlocked(username, token, sealed, collection, secret.copy());
      context.mfaEnabled(mfaEnabled);
      armIdleTimer();
    }
    fire(previous, LockState.UNLOCKED);
    activityLog.record(username, event);
    return new SessionOutcome.Unlocked();
  }

  private SessionOutcome unlockFailed(final long seq, final String username) {
    synchronized (this) {
      if (!isCurrent(seq)) {
        return new SessionOutcome.Superseded();
      }
    }
    activityLog.record(username, ActivityEvent.UNLOCK_FAILED);
    return new SessionOutcome.InvalidCredentials();
  }

  private SessionOutcome staleOr(final long seq, final SessionOutcome outcome) {
    synchronized (this) {
      return isCurrent(seq) ? outcome : new SessionOutcome.Superseded();
    }
  }

  private static SessionOutcome failure(final LoginOutcome outcome) {
    if (outcome instanceof RateLimited rateLimited) {
      return rateLimited;
    }
    if (outcome instanceof LoginOutcome.NoSuchAccount) {
      return new SessionOutcome.NoSuchAccount();
    }
    return new SessionOutcome.InvalidCredentials();
  }

  private boolean lock(final ActivityEvent event, final long generation) {
    final LockState previous;
    final String username;
    final SessionToken token;
    synchronized (this) {
      previous = context.state();
      if (generation >= 0 && generation != timerGeneration) {
        return false;
      }
      boolean lockable = previous == LockState.UNLOCKED
          || (previous == LockState.AWAITING_SECOND_FACTOR && context.pendingFromLock());
      if (!lockable) {
        return false;
      }
      fence();
      cancelIdleTimer();
      username = context.username().orElse(null);
      token = context.token();
      context.locked();
    }
    log.info("Session locked ({})", event);
    fire(previous, LockState.LOCKED);
    activityLog.record(username, event);
    if (token != null) {
      revoke(token);
    }
    return true;
  }

  private void revoke(final SessionToken token) {
    CompletableFuture.runAsync(() -> credentialManager.logout(token), worker)
        .exceptionally(e -> {
          log.warn("Token revocation failed: {}", e.getMessage());
          return null;
        });
  }

  private void onIdleTimeout(final long generation) {
    lock(ActivityEvent.LOCKED_BY_INACTIVITY, generation);
  }

  // Callers hold the monitor.
  private boolean isCurrent(final long seq) {
    return seq > Math.max(appliedSeq, fenceSeq);
  }

  private void fence() {
    fenceSeq = attempts.get();
  }

  private void armIdleTimer() {
    cancelIdleTimer();
    final long generation = timerGeneration;
    idleTimer = scheduler.schedule(() -> onIdleTimeout(generation), idleTimeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  private void cancelIdleTimer() {
    timerGeneration++;
    if (idleTimer != null) {
      idleTimer.cancel(false);
      idleTimer = null;
    }
  }

  private void requireUnlocked() {
    if (context.state() != LockState.UNLOCKED) {
      throw new IllegalStateException("Session is not unlocked");
    }
  }

  private void fire(final LockState previous, final LockState current) {
    if (previous == current) {
      return;
    }
    for (LockStateListener listener : listeners) {
      try {
        listener.stateChanged(previous, current);
      } catch (RuntimeException e) {
        log.warn("Lock state listener failed", e);
      }
    }
  }
}
