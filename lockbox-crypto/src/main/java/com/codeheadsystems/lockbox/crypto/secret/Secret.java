package com.codeheadsystems.lockbox.crypto.secret;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.function.Predicate;
import javax.security.auth.Destroyable;

/**
 * A human-chosen secret held as a private {@code char[]} copy.
 * <p>
 * The characters never leave this object except as a short-lived UTF-8 byte array through
 * {@link #utf8()}, which the caller wipes after use. {@link #destroy()} scrubs the characters;
 * every later access fails. {@link #toString()} never reveals the content.
 */
public final class Secret implements Destroyable, AutoCloseable {

  private final char[] chars;
  private volatile boolean destroyed = false;

  private Secret(final char[] chars) {
    this.chars = chars;
  }

  /**
   * Copies the given characters into a new secret. The caller remains responsible for wiping
   * its own array.
   *
   * @param chars the chars
   * @return the secret
   */
  public static Secret of(final char[] chars) {
    if (chars == null) {
      throw new IllegalArgumentException("Secret must not be null");
    }
    return new Secret(chars.clone());
  }

  /**
   * Creates a secret from a string. Strings cannot be wiped, so prefer {@link #of(char[])}
   * outside of tests and command line tools.
   *
   * @param value the value
   * @return the secret
   */
  public static Secret of(final String value) {
    if (value == null) {
      throw new IllegalArgumentException("Secret must not be null");
    }
    return new Secret(value.toCharArray());
  }

  /**
   * Returns an independent copy, so another owner can destroy its instance on its own schedule.
   *
   * @return the secret
   */
  public Secret copy() {
    checkDestroyed();
    return new Secret(chars.clone());
  }

  /**
   * Returns a fresh UTF-8 encoding of the secret. The caller must wipe the returned array.
   *
   * @return the byte [ ]
   */
  public byte[] utf8() {
    checkDestroyed();
    ByteBuffer buffer = StandardCharsets.UTF_8.encode(CharBuffer.wrap(chars));
    byte[] out = new byte[buffer.remaining()];
    buffer.get(out);
    if (buffer.hasArray()) {
      Arrays.fill(buffer.array(), (byte) 0);
    }
    return out;
  }

  /**
   * Number of characters in the secret.
   *
   * @return the length
   */
  public int length() {
    checkDestroyed();
    return chars.length;
  }

  /**
   * Whether the secret is empty.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return length() == 0;
  }

  /**
   * Applies a predicate to the raw characters without copying them out.
   *
   * @param test the test
   * @return the result of the test
   */
  public boolean test(final Predicate<char[]> test) {
    checkDestroyed();
    return test.test(chars);
  }

  @Override
  public void destroy() {
    destroyed = true;
    Arrays.fill(chars, '\0');
  }

  @Override
  public boolean isDestroyed() {
    return destroyed;
  }

  @Override
  public void close() {
    destroy();
  }

  @Override
  public String toString() {
    return "Secret[REDACTED]";
  }

  private void checkDestroyed() {
    if (destroyed) {
      throw new IllegalStateException("Secret has been destroyed");
    }
  }
}
