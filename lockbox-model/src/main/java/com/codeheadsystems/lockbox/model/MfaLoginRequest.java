package com.codeheadsystems.lockbox.model;

import com.codeheadsystems.lockbox.crypto.common.ByteUtils;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a login that carries a second-factor code. The verifier is checked before the
 * code.
 * <p>
 * Used by: {@code POST /login/mfa}
 *
 * @param username    the username
 * @param verifierHex the verifier, lowercase hex
 * @param mfaCode     a TOTP code or an unused backup code
 */
public record MfaLoginRequest(
    @JsonProperty("username") String username,
    @JsonProperty("verifier") String verifierHex,
    @JsonProperty("mfa_code") String mfaCode) {

  public MfaLoginRequest(String username, byte[] verifier, String mfaCode) {
    this(username, ByteUtils.toHex(verifier), mfaCode);
  }

  public byte[] verifier() {
    return ByteUtils.requireHex(verifierHex, "verifier");
  }

  @Override
  public String toString() {
    return "MfaLoginRequest[username=" + username + "]";
  }
}
