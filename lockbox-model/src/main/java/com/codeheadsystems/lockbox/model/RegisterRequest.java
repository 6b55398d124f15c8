package com.codeheadsystems.lockbox.model;

import com.codeheadsystems.lockbox.crypto.common.ByteUtils;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for account registration.
 * <p>
 * The verifier is Argon2id(secret, salt). The secret itself is never part of the request.
 * <p>
 * Used by: {@code POST /register}
 *
 * @param username    the username
 * @param saltHex     the freshly generated auth salt, lowercase hex
 * @param verifierHex the 32-byte verifier, lowercase hex
 */
public record RegisterRequest(
    @JsonProperty("username") String username,
    @JsonProperty("salt") String saltHex,
    @JsonProperty("verifier") String verifierHex) {

  public RegisterRequest(String username, byte[] salt, byte[] verifier) {
    this(username, ByteUtils.toHex(salt), ByteUtils.toHex(verifier));
  }

  public byte[] salt() {
    return ByteUtils.requireHex(saltHex, "salt");
  }

  public byte[] verifier() {
    return ByteUtils.requireHex(verifierHex, "verifier");
  }

  @Override
  public String toString() {
    return "RegisterRequest[username=" + username + "]";
  }
}
