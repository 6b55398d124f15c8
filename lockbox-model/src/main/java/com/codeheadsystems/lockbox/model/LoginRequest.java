package com.codeheadsystems.lockbox.model;

import com.codeheadsystems.lockbox.crypto.common.ByteUtils;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a password login.
 * <p>
 * Used by: {@code POST /login}
 *
 * @param username    the username
 * @param verifierHex the verifier recomputed from the secret and the account's auth salt
 */
public record LoginRequest(
    @JsonProperty("username") String username,
    @JsonProperty("verifier") String verifierHex) {

  public LoginRequest(String username, byte[] verifier) {
    this(username, ByteUtils.toHex(verifier));
  }

  public byte[] verifier() {
    return ByteUtils.requireHex(verifierHex, "verifier");
  }

  @Override
  public String toString() {
    return "LoginRequest[username=" + username + "]";
  }
}
