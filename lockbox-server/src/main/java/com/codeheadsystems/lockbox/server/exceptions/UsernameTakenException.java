package com.codeheadsystems.lockbox.server.exceptions;

/**
 * Thrown when registering a username that already has an account.
 */
public class UsernameTakenException extends RuntimeException {

  public UsernameTakenException(final String username) {
    super("Username already registered: " + username);
  }
}
