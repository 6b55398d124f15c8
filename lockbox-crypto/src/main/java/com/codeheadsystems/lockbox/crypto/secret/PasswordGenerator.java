package com.codeheadsystems.lockbox.crypto.secret;

import com.codeheadsystems.lockbox.crypto.common.RandomProvider;
import java.util.Arrays;

/**
 * Generates random passwords from the enabled character classes. Every enabled class
 * contributes at least one character whenever the length allows it.
 */
public class PasswordGenerator {

  static final String LOWER = "abcdefghijklmnopqrstuvwxyz";
  static final String UPPER = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
  static final String DIGITS = "0123456789";
  static final String SYMBOLS = PasswordPolicy.SYMBOLS;

  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Password generator.
   */
  public PasswordGenerator() {
    this(new RandomProvider());
  }

  /**
   * Instantiates a new Password generator.
   *
   * @param randomProvider the random provider
   */
  public PasswordGenerator(final RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  /**
   * Generates a password with the default options.
   *
   * @return the secret
   */
  public Secret generate() {
    return generate(Options.DEFAULT);
  }

  /**
   * Generates a password. A length below 1 is treated as 1. With no class enabled the result is
   * empty. When the length is shorter than the number of enabled classes, a random subset of the
   * classes is represented.
   *
   * @param options the options
   * @return the secret
   */
  public Secret generate(final Options options) {
    int length = Math.max(1, options.length());
    StringBuilder pool = new StringBuilder();
    StringBuilder required = new StringBuilder();
    addClass(options.lower(), LOWER, pool, required);
    addClass(options.upper(), UPPER, pool, required);
    addClass(options.digits(), DIGITS, pool, required);
    addClass(options.symbols(), SYMBOLS, pool, required);
    if (pool.length() == 0) {
      return Secret.of(new char[0]);
    }
    char[] out = new char[Math.max(length, required.length())];
    int n = 0;
    for (; n < required.length(); n++) {
      out[n] = required.charAt(n);
    }
    for (; n < out.length; n++) {
      out[n] = pool.charAt(randomProvider.nextInt(pool.length()));
    }
    shuffle(out);
    char[] result = out;
    if (length < out.length) {
      result = new char[length];
      System.arraycopy(out, 0, result, 0, length);
      Arrays.fill(out, '\0');
    }
    try {
      return Secret.of(result);
    } finally {
      Arrays.fill(result, '\0');
      required.setLength(0);
    }
  }

  private void addClass(final boolean enabled, final String chars,
                        final StringBuilder pool, final StringBuilder required) {
    if (enabled) {
      pool.append(chars);
      required.append(chars.charAt(randomProvider.nextInt(chars.length())));
    }
  }

  private void shuffle(final char[] chars) {
    for (int i = chars.length - 1; i > 0; i--) {
      int j = randomProvider.nextInt(i + 1);
      char tmp = chars[i];
      chars[i] = chars[j];
      chars[j] = tmp;
    }
  }

  /**
   * Generator options.
   *
   * @param length  the length
   * @param lower   include lowercase letters
   * @param upper   include uppercase letters
   * @param digits  include digits
   * @param symbols include symbols
   */
  public record Options(int length, boolean lower, boolean upper, boolean digits, boolean symbols) {

    /**
     * Sixteen characters from every class.
     */
    public static final Options DEFAULT = new Options(16, true, true, true, true);
  }
}
