package com.codeheadsystems.lockbox.client.model;

/**
 * Result of a login attempt.
 */
public sealed interface LoginOutcome permits LoginOutcome.Authenticated, LoginOutcome.NoSuchAccount,
    LoginOutcome.InvalidCredentials, LoginOutcome.MfaRequired, RateLimited {

  /**
   * The secret (and code, if one was sent) was accepted.
   *
   * @param token the session token
   */
  record Authenticated(SessionToken token) implements LoginOutcome {
  }

  /**
   * No salt is published for the username.
   */
  record NoSuchAccount() implements LoginOutcome {
  }

  /**
   * The authority rejected the verifier or the code. Which one is not disclosed.
   */
  record InvalidCredentials() implements LoginOutcome {
  }

  /**
   * The secret was accepted but the account requires a second factor.
   */
  record MfaRequired() implements LoginOutcome {
  }
}
