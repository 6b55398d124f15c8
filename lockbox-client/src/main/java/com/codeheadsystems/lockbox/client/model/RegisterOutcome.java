package com.codeheadsystems.lockbox.client.model;

/**
 * Result of a registration attempt.
 */
public sealed interface RegisterOutcome permits RegisterOutcome.Registered, RegisterOutcome.UsernameTaken,
    RegisterOutcome.WeakSecret, RateLimited {

  /**
   * Account created.
   */
  record Registered() implements RegisterOutcome {
  }

  /**
   * Another account already uses the name.
   */
  record UsernameTaken() implements RegisterOutcome {
  }

  /**
   * Rejected locally before anything was sent.
   *
   * @param minimumLength the required minimum length
   */
  record WeakSecret(int minimumLength) implements RegisterOutcome {
  }
}
