package com.codeheadsystems.lockbox.model;

import com.codeheadsystems.lockbox.crypto.common.ByteUtils;
import com.codeheadsystems.lockbox.crypto.vault.SealedVault;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a sealed vault. The authority stores it verbatim and cannot read it.
 *
 * @param vaultSaltHex  16-byte vault salt, lowercase hex
 * @param nonceHex      24-byte nonce, lowercase hex
 * @param ciphertextHex ciphertext with the 16-byte tag last, lowercase hex
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VaultBlob(
    @JsonProperty("vault_salt") String vaultSaltHex,
    @JsonProperty("nonce") String nonceHex,
    @JsonProperty("ciphertext") String ciphertextHex) {

  public VaultBlob(SealedVault sealedVault) {
    this(ByteUtils.toHex(sealedVault.vaultSalt()),
        ByteUtils.toHex(sealedVault.nonce()),
        ByteUtils.toHex(sealedVault.ciphertext()));
  }

  /**
   * Decodes the blob.
   *
   * @return the sealed vault
   * @throws IllegalArgumentException if a field is missing or not hex
   */
  public SealedVault sealedVault() {
    return new SealedVault(
        ByteUtils.requireHex(vaultSaltHex, "vault_salt"),
        ByteUtils.requireHex(nonceHex, "nonce"),
        ByteUtils.requireHex(ciphertextHex, "ciphertext"));
  }
}
