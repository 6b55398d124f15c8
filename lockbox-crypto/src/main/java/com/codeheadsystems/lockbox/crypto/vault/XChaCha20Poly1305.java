package com.codeheadsystems.lockbox.crypto.vault;

import com.codeheadsystems.lockbox.crypto.common.ByteUtils;
import com.codeheadsystems.lockbox.crypto.exceptions.DecryptionFailureException;
import java.util.Arrays;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.RuntimeCryptoException;
import org.bouncycastle.crypto.modes.ChaCha20Poly1305;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.Pack;

/**
 * XChaCha20-Poly1305 AEAD with a 24-byte nonce and a 16-byte tag.
 * <p>
 * HChaCha20 turns the key and the first 16 nonce bytes into a subkey; the IETF ChaCha20-Poly1305
 * construction then runs under that subkey with a 12-byte nonce of four zero bytes followed by
 * the last 8 nonce bytes. No associated data is used.
 */
public final class XChaCha20Poly1305 {

  /**
   * Key length in bytes.
   */
  public static final int KEY_LENGTH = 32;

  /**
   * Nonce length in bytes.
   */
  public static final int NONCE_LENGTH = 24;

  /**
   * Tag length in bytes.
   */
  public static final int TAG_LENGTH = 16;

  private static final int[] SIGMA = {0x61707865, 0x3320646e, 0x79622d32, 0x6b206574};

  private XChaCha20Poly1305() {
  }

  /**
   * Encrypts the plaintext.
   *
   * @param key       32-byte key
   * @param nonce     24-byte nonce, never reused with the same key
   * @param plaintext the plaintext
   * @return ciphertext followed by the 16-byte tag
   */
  public static byte[] encrypt(final byte[] key, final byte[] nonce, final byte[] plaintext) {
    ChaCha20Poly1305 cipher = init(true, key, nonce);
    byte[] out = new byte[cipher.getOutputSize(plaintext.length)];
    int len = cipher.processBytes(plaintext, 0, plaintext.length, out, 0);
    try {
      cipher.doFinal(out, len);
    } catch (InvalidCipherTextException e) {
      throw new IllegalStateException("Encryption failed", e);
    }
    return out;
  }

  /**
   * Decrypts and authenticates a ciphertext.
   *
   * @param key        32-byte key
   * @param nonce      24-byte nonce
   * @param ciphertext ciphertext followed by the 16-byte tag
   * @return the plaintext
   * @throws DecryptionFailureException on any authentication failure or truncated input
   */
  public static byte[] decrypt(final byte[] key, final byte[] nonce, final byte[] ciphertext) {
    if (ciphertext == null || ciphertext.length < TAG_LENGTH) {
      throw new DecryptionFailureException();
    }
    ChaCha20Poly1305 cipher = init(false, key, nonce);
    byte[] out = new byte[cipher.getOutputSize(ciphertext.length)];
    try {
      int len = cipher.processBytes(ciphertext, 0, ciphertext.length, out, 0);
      cipher.doFinal(out, len);
    } catch (InvalidCipherTextException | RuntimeCryptoException e) {
      ByteUtils.wipe(out);
      throw new DecryptionFailureException(e);
    }
    return out;
  }

  /**
   * HChaCha20 subkey derivation.
   *
   * @param key    32-byte key
   * @param nonce16 16-byte input
   * @return 32-byte subkey
   */
  public static byte[] hChaCha20(final byte[] key, final byte[] nonce16) {
    if (key == null || key.length != KEY_LENGTH) {
      throw new IllegalArgumentException("Key must be " + KEY_LENGTH + " bytes");
    }
    if (nonce16 == null || nonce16.length != 16) {
      throw new IllegalArgumentException("HChaCha20 input must be 16 bytes");
    }
    int[] x = new int[16];
    System.arraycopy(SIGMA, 0, x, 0, 4);
    Pack.littleEndianToInt(key, 0, x, 4, 8);
    Pack.littleEndianToInt(nonce16, 0, x, 12, 4);
    for (int i = 0; i < 10; i++) {
      quarterRound(x, 0, 4, 8, 12);
      quarterRound(x, 1, 5, 9, 13);
      quarterRound(x, 2, 6, 10, 14);
      quarterRound(x, 3, 7, 11, 15);
      quarterRound(x, 0, 5, 10, 15);
      quarterRound(x, 1, 6, 11, 12);
      quarterRound(x, 2, 7, 8, 13);
      quarterRound(x, 3, 4, 9, 14);
    }
    byte[] subkey = new byte[KEY_LENGTH];
    Pack.intToLittleEndian(new int[] {x[0], x[1], x[2], x[3]}, subkey, 0);
    Pack.intToLittleEndian(new int[] {x[12], x[13], x[14], x[15]}, subkey, 16);
    Arrays.fill(x, 0);
    return subkey;
  }

  private static ChaCha20Poly1305 init(final boolean encrypt, final byte[] key, final byte[] nonce) {
    if (nonce == null || nonce.length != NONCE_LENGTH) {
      throw new IllegalArgumentException("Nonce must be " + NONCE_LENGTH + " bytes");
    }
    byte[] prefix = new byte[16];
    System.arraycopy(nonce, 0, prefix, 0, 16);
    byte[] subkey = hChaCha20(key, prefix);
    byte[] ietfNonce = new byte[12];
    System.arraycopy(nonce, 16, ietfNonce, 4, 8);
    ChaCha20Poly1305 cipher = new ChaCha20Poly1305();
    try {
      cipher.init(encrypt, new AEADParameters(new KeyParameter(subkey), TAG_LENGTH * 8, ietfNonce));
    } finally {
      ByteUtils.wipe(subkey);
    }
    return cipher;
  }

  private static void quarterRound(final int[] x, final int a, final int b, final int c, final int d) {
    x[a] += x[b];
    x[d] = Integer.rotateLeft(x[d] ^ x[a], 16);
    x[c] += x[d];
    x[b] = Integer.rotateLeft(x[b] ^ x[c], 12);
    x[a] += x[b];
    x[d] = Integer.rotateLeft(x[d] ^ x[a], 8);
    x[c] += x[d];
    x[b] = Integer.rotateLeft(x[b] ^ x[c], 7);
  }
}
