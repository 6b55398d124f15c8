package com.codeheadsystems.lockbox.server.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link AccountStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All accounts are lost on server restart. Suitable for development and integration testing
 * only. Replace with a database-backed implementation for production.
 */
public class InMemoryAccountStore implements AccountStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryAccountStore.class);

  private final ConcurrentHashMap<String, Account> store = new ConcurrentHashMap<>();

  public InMemoryAccountStore() {
    log.warn("Using InMemoryAccountStore. Accounts will NOT survive restarts. "
        + "Replace with a persistent AccountStore for production.");
  }

  @Override
  public boolean create(final Account account) {
    boolean created = store.putIfAbsent(account.username(), account) == null;
    log.debug("create(username={}) -> {}", account.username(), created);
    return created;
  }

  @Override
  public Optional<Account> load(final String username) {
    return Optional.ofNullable(store.get(username));
  }

  @Override
  public Optional<Account> update(final String username, final UnaryOperator<Account> mutation) {
    return Optional.ofNullable(store.computeIfPresent(username, (k, account) -> mutation.apply(account)));
  }
}
