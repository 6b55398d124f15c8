package com.codeheadsystems.lockbox.server.store;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Storage abstraction for accounts, keyed by username.
 * <p>
 * Implementations must be thread-safe, and {@link #update} must apply its mutation atomically
 * so that a backup code can only be consumed once.
 */
public interface AccountStore {

  /**
   * Stores a new account.
   *
   * @param account the account
   * @return false if the username is already registered
   */
  boolean create(Account account);

  /**
   * Loads an account.
   *
   * @param username the username
   * @return the account, or empty if not registered
   */
  Optional<Account> load(String username);

  /**
   * Atomically replaces an account with the result of the mutation.
   *
   * @param username the username
   * @param mutation the mutation
   * @return the updated account, or empty if not registered
   */
  Optional<Account> update(String username, UnaryOperator<Account> mutation);
}
