package com.codeheadsystems.lockbox.client.manager;

import com.codeheadsystems.lockbox.client.accessor.LockboxAccessor;
import com.codeheadsystems.lockbox.client.model.SessionToken;
import com.codeheadsystems.lockbox.crypto.exceptions.DecryptionFailureException;
import com.codeheadsystems.lockbox.crypto.vault.SealedVault;
import com.codeheadsystems.lockbox.model.VaultBlob;
import com.codeheadsystems.lockbox.model.VaultEnvelope;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves sealed vaults to and from the remote authority. Only ciphertext passes through here.
 */
@Singleton
public class VaultManager {

  private static final Logger log = LoggerFactory.getLogger(VaultManager.class);

  private final LockboxAccessor accessor;

  @Inject
  public VaultManager(final LockboxAccessor accessor) {
    log.info("VaultManager()");
    this.accessor = accessor;
  }

  /**
   * Fetches the stored vault.
   *
   * @param token the token
   * @return the sealed vault, empty if none was stored yet
   * @throws DecryptionFailureException if the stored blob is malformed
   */
  public Optional<SealedVault> fetchVault(final SessionToken token) {
    log.debug("fetchVault()");
    VaultEnvelope envelope = accessor.getVault(token);
    if (envelope == null || envelope.blob() == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(envelope.blob().sealedVault());
    } catch (IllegalArgumentException e) {
      throw new DecryptionFailureException(e);
    }
  }

  /**
   * Replaces the stored vault.
   *
   * @param token  the token
   * @param sealed the sealed
   */
  public void storeVault(final SessionToken token, final SealedVault sealed) {
    log.debug("storeVault()");
    accessor.putVault(token, new VaultEnvelope(new VaultBlob(sealed)));
  }
}
