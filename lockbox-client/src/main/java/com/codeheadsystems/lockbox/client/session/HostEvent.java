package com.codeheadsystems.lockbox.client.session;

/**
 * Lifecycle signals delivered by the host application.
 */
public enum HostEvent {
  /**
   * The user interacted with the application.
   */
  ACTIVITY,
  /**
   * The application came back to the foreground.
   */
  FOREGROUNDED,
  /**
   * The application moved to the background. The idle countdown keeps running.
   */
  BACKGROUNDED
}
