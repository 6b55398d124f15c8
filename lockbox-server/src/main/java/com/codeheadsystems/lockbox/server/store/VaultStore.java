package com.codeheadsystems.lockbox.server.store;

import com.codeheadsystems.lockbox.model.VaultBlob;
import java.util.Optional;

/**
 * Storage abstraction for each account's sealed vault. The authority stores the blob as
 * received and cannot read it.
 */
public interface VaultStore {

  /**
   * Loads the stored blob.
   *
   * @param username the username
   * @return the blob, or empty if nothing was stored yet
   */
  Optional<VaultBlob> load(String username);

  /**
   * Replaces the stored blob.
   *
   * @param username the username
   * @param blob     the blob
   */
  void store(String username, VaultBlob blob);
}
