package com.codeheadsystems.lockbox.crypto.vault;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.lockbox.crypto.common.ByteUtils;
import com.codeheadsystems.lockbox.crypto.exceptions.DecryptionFailureException;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class XChaCha20Poly1305Test {

  private static final byte[] KEY = ByteUtils.fromHex(
      "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f");
  private static final byte[] NONCE = ByteUtils.fromHex(
      "404142434445464748494a4b4c4d4e4f5051525354555657");

  @Test
  void hChaCha20_matchesPublishedVector() {
    byte[] input = ByteUtils.fromHex("000000090000004a0000000031415927");
    assertThat(ByteUtils.toHex(XChaCha20Poly1305.hChaCha20(KEY, input)))
        .isEqualTo("82413b4227b27bfed30e42508a877d73a0f9e4d58a74a853c12ec41326d3ecdc");
  }

  @Test
  void encrypt_appendsTag() {
    byte[] plaintext = "hello vault".getBytes(UTF_8);
    byte[] ciphertext = XChaCha20Poly1305.encrypt(KEY, NONCE, plaintext);
    assertThat(ciphertext).hasSize(plaintext.length + XChaCha20Poly1305.TAG_LENGTH);
    assertThat(XChaCha20Poly1305.decrypt(KEY, NONCE, ciphertext)).isEqualTo(plaintext);
  }

  @Test
  void encrypt_emptyPlaintext() {
    byte[] ciphertext = XChaCha20Poly1305.encrypt(KEY, NONCE, new byte[0]);
    assertThat(ciphertext).hasSize(XChaCha20Poly1305.TAG_LENGTH);
    assertThat(XChaCha20Poly1305.decrypt(KEY, NONCE, ciphertext)).isEmpty();
  }

  @Test
  void decrypt_everyBitFlipFails() {
    byte[] ciphertext = XChaCha20Poly1305.encrypt(KEY, NONCE, "abc".getBytes(UTF_8));
    for (int i = 0; i < ciphertext.length * 8; i++) {
      byte[] tampered = ciphertext.clone();
      tampered[i / 8] ^= (byte) (1 << (i % 8));
      assertThatThrownBy(() -> XChaCha20Poly1305.decrypt(KEY, NONCE, tampered))
          .isInstanceOf(DecryptionFailureException.class);
    }
  }

  @Test
  void decrypt_truncatedFails() {
    byte[] ciphertext = XChaCha20Poly1305.encrypt(KEY, NONCE, "abcdef".getBytes(UTF_8));
    assertThatThrownBy(() -> XChaCha20Poly1305.decrypt(KEY, NONCE, Arrays.copyOf(ciphertext, ciphertext.length - 1)))
        .isInstanceOf(DecryptionFailureException.class);
    assertThatThrownBy(() -> XChaCha20Poly1305.decrypt(KEY, NONCE, new byte[5]))
        .isInstanceOf(DecryptionFailureException.class);
  }

  @Test
  void decrypt_wrongNonceTailFails() {
    byte[] ciphertext = XChaCha20Poly1305.encrypt(KEY, NONCE, "abc".getBytes(UTF_8));
    byte[] otherNonce = NONCE.clone();
    otherNonce[23] ^= 1;
    assertThatThrownBy(() -> XChaCha20Poly1305.decrypt(KEY, otherNonce, ciphertext))
        .isInstanceOf(DecryptionFailureException.class);
  }

  @Test
  void decrypt_wrongKeyFails() {
    byte[] ciphertext = XChaCha20Poly1305.encrypt(KEY, NONCE, "abc".getBytes(UTF_8));
    byte[] otherKey = KEY.clone();
    otherKey[0] ^= 1;
    assertThatThrownBy(() -> XChaCha20Poly1305.decrypt(otherKey, NONCE, ciphertext))
        .isInstanceOf(DecryptionFailureException.class)
        .hasMessage(DecryptionFailureException.MESSAGE);
  }

  @Test
  void encrypt_rejectsShortNonce() {
    assertThatThrownBy(() -> XChaCha20Poly1305.encrypt(KEY, new byte[12], new byte[1]))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
