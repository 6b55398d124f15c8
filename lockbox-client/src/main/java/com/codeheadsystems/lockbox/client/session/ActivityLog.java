package com.codeheadsystems.lockbox.client.session;

import java.util.List;

/**
 * Per-user audit trail of security events. Implementations must be thread-safe and must never
 * record secrets.
 */
public interface ActivityLog {

  /**
   * Records an event.
   *
   * @param username the username
   * @param event    the event
   */
  void record(String username, ActivityEvent event);

  /**
   * Entries for a user, newest first.
   *
   * @param username the username
   * @return the entries
   */
  List<ActivityEntry> entries(String username);

  /**
   * Drops every entry of a user.
   *
   * @param username the username
   */
  void clear(String username);
}
