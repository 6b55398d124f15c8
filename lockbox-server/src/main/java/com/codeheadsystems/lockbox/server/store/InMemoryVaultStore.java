package com.codeheadsystems.lockbox.server.store;

import com.codeheadsystems.lockbox.model.VaultBlob;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link VaultStore}. Suitable for development and integration testing
 * only.
 */
public class InMemoryVaultStore implements VaultStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryVaultStore.class);

  private final ConcurrentHashMap<String, VaultBlob> store = new ConcurrentHashMap<>();

  public InMemoryVaultStore() {
    log.warn("Using InMemoryVaultStore. Vaults will NOT survive restarts. "
        + "Replace with a persistent VaultStore for production.");
  }

  @Override
  public Optional<VaultBlob> load(final String username) {
    return Optional.ofNullable(store.get(username));
  }

  @Override
  public void store(final String username, final VaultBlob blob) {
    store.put(username, blob);
    log.debug("Stored vault for {} ({} hex chars)", username, blob.ciphertextHex().length());
  }
}
