package com.codeheadsystems.lockbox.client.exceptions;

/**
 * Transport failure talking to the remote authority: I/O errors, interruptions and unexpected
 * HTTP statuses.
 */
public class LockboxAccessorException extends RuntimeException {

  private final int statusCode;

  /**
   * Instantiates a new Lockbox accessor exception for a failure without an HTTP status.
   *
   * @param message the message
   * @param cause   the cause
   */
  public LockboxAccessorException(final String message, final Throwable cause) {
    this(message, 0, cause);
  }

  /**
   * Instantiates a new Lockbox accessor exception.
   *
   * @param message    the message
   * @param statusCode the HTTP status, 0 when no response was received
   * @param cause      the cause
   */
  public LockboxAccessorException(final String message, final int statusCode, final Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /**
   * HTTP status of the failed call, or 0 when no response was received.
   *
   * @return the status code
   */
  public int statusCode() {
    return statusCode;
  }
}
