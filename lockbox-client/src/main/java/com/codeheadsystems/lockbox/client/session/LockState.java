package com.codeheadsystems.lockbox.client.session;

/**
 * Whether the decrypted collection may be shown.
 */
public enum LockState {
  /**
   * The collection is in memory and may be rendered.
   */
  UNLOCKED,
  /**
   * Only the sealed vault is held. The secret must be entered again.
   */
  LOCKED,
  /**
   * The secret was verified; a second-factor code is outstanding.
   */
  AWAITING_SECOND_FACTOR,
  /**
   * No session.
   */
  SIGNED_OUT
}
