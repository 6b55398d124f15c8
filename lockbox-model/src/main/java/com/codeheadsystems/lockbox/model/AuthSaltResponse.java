package com.codeheadsystems.lockbox.model;

import com.codeheadsystems.lockbox.crypto.common.ByteUtils;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for the public auth salt of an account.
 * <p>
 * Used by: {@code GET /auth_salt/{username}} response
 *
 * @param saltHex the 16-byte auth salt, lowercase hex
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthSaltResponse(@JsonProperty("salt") String saltHex) {

  public AuthSaltResponse(byte[] salt) {
    this(ByteUtils.toHex(salt));
  }

  /**
   * Decoded salt.
   *
   * @return the byte [ ]
   */
  public byte[] salt() {
    return ByteUtils.requireHex(saltHex, "salt");
  }
}
