package com.codeheadsystems.lockbox.client.model;

/**
 * Opaque bearer token issued by the remote authority. It has no relation to any key and is
 * sent back verbatim in the {@code Authorization} header.
 *
 * @param value the token
 */
public record SessionToken(String value) {

  /**
   * Validates the token.
   */
  public SessionToken {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Token must not be blank");
    }
  }

  @Override
  public String toString() {
    return "SessionToken[REDACTED]";
  }
}
