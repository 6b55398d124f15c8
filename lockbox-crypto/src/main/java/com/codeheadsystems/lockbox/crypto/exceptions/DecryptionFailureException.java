package com.codeheadsystems.lockbox.crypto.exceptions;

/**
 * The single failure raised when a sealed vault cannot be opened.
 * <p>
 * A wrong secret, a corrupted blob, a truncated ciphertext and a tampered tag all produce this
 * same exception with the same message. Callers present it exactly like a wrong password.
 */
public class DecryptionFailureException extends SecurityException {

  /**
   * The message shared by every decryption failure.
   */
  public static final String MESSAGE = "Vault could not be decrypted";

  /**
   * Instantiates a new Decryption failure exception.
   */
  public DecryptionFailureException() {
    super(MESSAGE);
  }

  /**
   * Instantiates a new Decryption failure exception.
   *
   * @param cause the cause
   */
  public DecryptionFailureException(final Throwable cause) {
    super(MESSAGE, cause);
  }
}
