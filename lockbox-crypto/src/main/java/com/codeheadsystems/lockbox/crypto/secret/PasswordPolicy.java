package com.codeheadsystems.lockbox.crypto.secret;

/**
 * Password rules applied on the client before anything is sent.
 */
public final class PasswordPolicy {

  /**
   * Minimum length accepted at registration.
   */
  public static final int MINIMUM_LENGTH = 8;

  /**
   * Characters counted as symbols.
   */
  public static final String SYMBOLS = "!@#$%^&*(),.?\":{}|<>";

  private PasswordPolicy() {
  }

  /**
   * Whether the secret is long enough to register with.
   *
   * @param secret the secret
   * @return true if acceptable
   */
  public static boolean meetsMinimumLength(final Secret secret) {
    return secret.length() >= MINIMUM_LENGTH;
  }

  /**
   * A strong password has at least eight characters and contains an uppercase letter, a
   * lowercase letter, a digit and a symbol.
   *
   * @param secret the secret
   * @return true if strong
   */
  public static boolean isStrong(final Secret secret) {
    return secret.test(PasswordPolicy::isStrong);
  }

  static boolean isStrong(final char[] chars) {
    if (chars.length < MINIMUM_LENGTH) {
      return false;
    }
    boolean upper = false;
    boolean lower = false;
    boolean digit = false;
    boolean symbol = false;
    for (char c : chars) {
      if (c >= 'A' && c <= 'Z') {
        upper = true;
      } else if (c >= 'a' && c <= 'z') {
        lower = true;
      } else if (c >= '0' && c <= '9') {
        digit = true;
      } else if (SYMBOLS.indexOf(c) >= 0) {
        symbol = true;
      }
    }
    return upper && lower && digit && symbol;
  }
}
