package com.codeheadsystems.lockbox.server.manager;

import com.codeheadsystems.lockbox.crypto.kdf.KeyDerivation;
import com.codeheadsystems.lockbox.crypto.vault.SealedVault;
import com.codeheadsystems.lockbox.crypto.vault.XChaCha20Poly1305;
import com.codeheadsystems.lockbox.model.VaultBlob;
import com.codeheadsystems.lockbox.model.VaultEnvelope;
import com.codeheadsystems.lockbox.server.auth.LockboxPrincipal;
import com.codeheadsystems.lockbox.server.store.VaultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores and returns each account's sealed vault. Only checks that the blob is well formed; the
 * authority holds no key that could open it.
 */
public class VaultStorageManager {

  private static final Logger log = LoggerFactory.getLogger(VaultStorageManager.class);

  private final VaultStore vaultStore;

  public VaultStorageManager(final VaultStore vaultStore) {
    log.info("VaultStorageManager()");
    this.vaultStore = vaultStore;
  }

  /**
   * The stored vault of the principal's account.
   *
   * @param principal the authenticated caller
   * @return the envelope, with a null blob if nothing was stored yet
   * @throws SecurityException unless the token is a full token
   */
  public VaultEnvelope fetch(final LockboxPrincipal principal) {
    String username = principal.requireFull().username();
    log.debug("fetch(username={})", username);
    return new VaultEnvelope(vaultStore.load(username).orElse(null));
  }

  /**
   * Replaces the stored vault of the principal's account.
   *
   * @param principal the authenticated caller
   * @param envelope  the envelope
   * @throws SecurityException        unless the token is a full token
   * @throws IllegalArgumentException if the blob is missing or malformed
   */
  public void store(final LockboxPrincipal principal, final VaultEnvelope envelope) {
    String username = principal.requireFull().username();
    log.debug("store(username={})", username);
    if (envelope == null || envelope.blob() == null) {
      throw new IllegalArgumentException("Missing required field: blob");
    }
    VaultBlob blob = envelope.blob();
    SealedVault sealed = blob.sealedVault();
    if (sealed.vaultSalt().length != KeyDerivation.SALT_LENGTH
        || sealed.nonce().length != XChaCha20Poly1305.NONCE_LENGTH
        || sealed.ciphertext().length < XChaCha20Poly1305.TAG_LENGTH) {
      throw new IllegalArgumentException("Malformed vault blob");
    }
    vaultStore.store(username, blob);
  }
}
