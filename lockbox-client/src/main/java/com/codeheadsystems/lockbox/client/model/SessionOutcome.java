package com.codeheadsystems.lockbox.client.model;

/**
 * Result of a sign-in, unlock or second-factor step of the session lock controller.
 */
public sealed interface SessionOutcome permits SessionOutcome.Unlocked, SessionOutcome.SecondFactorRequired,
    SessionOutcome.InvalidCredentials, SessionOutcome.NoSuchAccount, SessionOutcome.Superseded, RateLimited {

  /**
   * The collection is available.
   */
  record Unlocked() implements SessionOutcome {
  }

  /**
   * The secret was verified; a second-factor code must be submitted next.
   */
  record SecondFactorRequired() implements SessionOutcome {
  }

  /**
   * Wrong secret or code. Also returned when the retained vault does not open.
   */
  record InvalidCredentials() implements SessionOutcome {
  }

  /**
   * The username has no account.
   */
  record NoSuchAccount() implements SessionOutcome {
  }

  /**
   * A newer attempt, a lock or a logout happened while this attempt was running. Its result was
   * discarded.
   */
  record Superseded() implements SessionOutcome {
  }
}
