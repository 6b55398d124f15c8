package com.codeheadsystems.lockbox.crypto.vault;

import java.util.Arrays;

/**
 * The encrypted form of a credential collection. This is the only vault artifact that is sent
 * to the remote authority or written anywhere.
 *
 * @param vaultSalt  the 16-byte salt the vault key was derived with
 * @param nonce      the 24-byte nonce
 * @param ciphertext the ciphertext with the 16-byte tag appended
 */
public record SealedVault(byte[] vaultSalt, byte[] nonce, byte[] ciphertext) {

  /**
   * Copies the arrays so the record cannot be changed from outside.
   */
  public SealedVault {
    if (vaultSalt == null || nonce == null || ciphertext == null) {
      throw new IllegalArgumentException("Sealed vault fields must not be null");
    }
    vaultSalt = vaultSalt.clone();
    nonce = nonce.clone();
    ciphertext = ciphertext.clone();
  }

  @Override
  public byte[] vaultSalt() {
    return vaultSalt.clone();
  }

  @Override
  public byte[] nonce() {
    return nonce.clone();
  }

  @Override
  public byte[] ciphertext() {
    return ciphertext.clone();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SealedVault that)) {
      return false;
    }
    return Arrays.equals(vaultSalt, that.vaultSalt)
        && Arrays.equals(nonce, that.nonce)
        && Arrays.equals(ciphertext, that.ciphertext);
  }

  @Override
  public int hashCode() {
    int result = Arrays.hashCode(vaultSalt);
    result = 31 * result + Arrays.hashCode(nonce);
    result = 31 * result + Arrays.hashCode(ciphertext);
    return result;
  }

  @Override
  public String toString() {
    return "SealedVault[ciphertextLength=" + ciphertext.length + "]";
  }
}
