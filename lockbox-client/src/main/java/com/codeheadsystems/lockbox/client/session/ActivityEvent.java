package com.codeheadsystems.lockbox.client.session;

/**
 * Security events recorded in the activity log.
 */
public enum ActivityEvent {
  REGISTERED,
  LOGGED_IN,
  LOCKED,
  LOCKED_BY_INACTIVITY,
  UNLOCKED,
  UNLOCK_FAILED,
  MFA_ENABLED,
  MFA_DISABLED,
  VAULT_SAVED,
  LOGGED_OUT
}
