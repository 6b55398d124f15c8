package com.codeheadsystems.lockbox.server.store;

import java.util.Optional;

/**
 * Storage abstraction for issued tokens, keyed by JWT ID.
 * <p>
 * Implementations must be thread-safe. A token whose JTI is not in the store is treated as
 * revoked, even when its signature and expiry are valid.
 */
public interface SessionStore {

  /**
   * Stores session data keyed by the JWT ID (jti).
   *
   * @param jti         unique token identifier
   * @param sessionData session data to store
   */
  void store(String jti, SessionData sessionData);

  /**
   * Loads session data by JWT ID, returning empty if not found or expired.
   *
   * @param jti unique token identifier
   * @return the session data, or empty if not found or expired
   */
  Optional<SessionData> load(String jti);

  /**
   * Revokes a single session by JWT ID. Unknown IDs are ignored.
   *
   * @param jti unique token identifier
   */
  void revoke(String jti);
}
