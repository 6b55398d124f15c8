package com.codeheadsystems.lockbox.client.session;

/**
 * Notified after every lock state transition, on the thread that caused it.
 */
@FunctionalInterface
public interface LockStateListener {

  /**
   * State changed.
   *
   * @param previous the previous state
   * @param current  the current state
   */
  void stateChanged(LockState previous, LockState current);
}
