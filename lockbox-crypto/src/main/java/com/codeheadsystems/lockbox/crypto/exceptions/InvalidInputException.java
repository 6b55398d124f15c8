package com.codeheadsystems.lockbox.crypto.exceptions;

/**
 * Raised when key derivation is handed malformed input, such as an empty or wrongly sized salt.
 */
public class InvalidInputException extends IllegalArgumentException {

  /**
   * Instantiates a new Invalid input exception.
   *
   * @param message the message
   */
  public InvalidInputException(final String message) {
    super(message);
  }
}
