package com.codeheadsystems.lockbox.crypto.vault;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.lockbox.crypto.common.RandomProvider;
import com.codeheadsystems.lockbox.crypto.exceptions.DecryptionFailureException;
import com.codeheadsystems.lockbox.crypto.kdf.KdfParameters;
import com.codeheadsystems.lockbox.crypto.kdf.KeyDerivation;
import com.codeheadsystems.lockbox.crypto.model.CredentialCollection;
import com.codeheadsystems.lockbox.crypto.model.CredentialRecord;
import com.codeheadsystems.lockbox.crypto.secret.Secret;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VaultCipherTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private KeyDerivation keyDerivation;
  private VaultCipher vaultCipher;
  private Secret secret;

  @BeforeEach
  void setUp() {
    keyDerivation = new KeyDerivation(KdfParameters.forTesting());
    vaultCipher = new VaultCipher(keyDerivation, new RandomProvider(),
        new VaultCodec(new ObjectMapper(), ZoneOffset.UTC),
        Clock.fixed(NOW, ZoneOffset.UTC));
    secret = Secret.of("Tr0ub4dor&3");
  }

  private CredentialCollection sample() {
    CredentialCollection collection = new CredentialCollection();
    collection.put("email", new CredentialRecord("hunter2", Instant.parse("2024-01-02T03:04:05Z"),
        "Personal", Map.of("username", "alice@example.com")));
    collection.put("bank", new CredentialRecord("s3cr3t!", Instant.parse("2023-12-31T23:59:00Z")));
    return collection;
  }

  @Test
  void sealThenUnseal_returnsEqualCollection() {
    CredentialCollection original = sample();
    SealedVault sealed = vaultCipher.seal(original, secret);
    assertThat(vaultCipher.unseal(sealed, secret)).isEqualTo(original);
  }

  @Test
  void seal_emptyCollection() {
    SealedVault sealed = vaultCipher.seal(new CredentialCollection(), secret);
    assertThat(vaultCipher.unseal(sealed, secret).isEmpty()).isTrue();
  }

  @Test
  void seal_shapeOfBlob() {
    SealedVault sealed = vaultCipher.seal(sample(), secret);
    assertThat(sealed.vaultSalt()).hasSize(16);
    assertThat(sealed.nonce()).hasSize(24);
    assertThat(sealed.ciphertext().length).isGreaterThan(16);
  }

  @Test
  void seal_isFreshEveryTime() {
    CredentialCollection collection = sample();
    SealedVault first = vaultCipher.seal(collection, secret);
    SealedVault second = vaultCipher.seal(collection, secret);
    assertThat(first.vaultSalt()).isNotEqualTo(second.vaultSalt());
    assertThat(first.nonce()).isNotEqualTo(second.nonce());
    assertThat(first.ciphertext()).isNotEqualTo(second.ciphertext());
  }

  @Test
  void unseal_wrongSecretFails() {
    SealedVault sealed = vaultCipher.seal(sample(), secret);
    assertThatThrownBy(() -> vaultCipher.unseal(sealed, Secret.of("Tr0ub4dor&4")))
        .isInstanceOf(DecryptionFailureException.class)
        .hasMessage(DecryptionFailureException.MESSAGE);
  }

  @Test
  void unseal_tamperedCiphertextFails() {
    SealedVault sealed = vaultCipher.seal(sample(), secret);
    byte[] ciphertext = sealed.ciphertext();
    ciphertext[0] ^= 0x01;
    SealedVault tampered = new SealedVault(sealed.vaultSalt(), sealed.nonce(), ciphertext);
    assertThatThrownBy(() -> vaultCipher.unseal(tampered, secret))
        .isInstanceOf(DecryptionFailureException.class);
  }

  @Test
  void unseal_tamperedTagFails() {
    SealedVault sealed = vaultCipher.seal(sample(), secret);
    byte[] ciphertext = sealed.ciphertext();
    ciphertext[ciphertext.length - 1] ^= (byte) 0x80;
    SealedVault tampered = new SealedVault(sealed.vaultSalt(), sealed.nonce(), ciphertext);
    assertThatThrownBy(() -> vaultCipher.unseal(tampered, secret))
        .isInstanceOf(DecryptionFailureException.class);
  }

  @Test
  void unseal_tamperedSaltFails() {
    SealedVault sealed = vaultCipher.seal(sample(), secret);
    byte[] salt = sealed.vaultSalt();
    salt[3] ^= 0x10;
    SealedVault tampered = new SealedVault(salt, sealed.nonce(), sealed.ciphertext());
    assertThatThrownBy(() -> vaultCipher.unseal(tampered, secret))
        .isInstanceOf(DecryptionFailureException.class);
  }

  @Test
  void unseal_truncatedFails() {
    SealedVault sealed = vaultCipher.seal(sample(), secret);
    byte[] ciphertext = sealed.ciphertext();
    SealedVault truncated = new SealedVault(sealed.vaultSalt(), sealed.nonce(),
        Arrays.copyOf(ciphertext, ciphertext.length - 4));
    assertThatThrownBy(() -> vaultCipher.unseal(truncated, secret))
        .isInstanceOf(DecryptionFailureException.class);
  }

  @Test
  void unseal_wrongLengthSaltOrNonceFails() {
    SealedVault sealed = vaultCipher.seal(sample(), secret);
    assertThatThrownBy(() -> vaultCipher.unseal(
        new SealedVault(new byte[8], sealed.nonce(), sealed.ciphertext()), secret))
        .isInstanceOf(DecryptionFailureException.class);
    assertThatThrownBy(() -> vaultCipher.unseal(
        new SealedVault(sealed.vaultSalt(), new byte[12], sealed.ciphertext()), secret))
        .isInstanceOf(DecryptionFailureException.class);
  }

  @Test
  void unseal_migratesLegacyEntries() {
    String json = "{\"old\":\"legacy-pass\","
        + "\"new\":{\"password\":\"p\",\"updatedAt\":\"2024-02-03 04:05\",\"category\":\"Work\"},"
        + "\"broken\":{\"updatedAt\":\"yesterday\"}}";
    SealedVault sealed = sealRaw(json.getBytes(UTF_8));

    CredentialCollection collection = vaultCipher.unseal(sealed, secret);

    assertThat(collection.get("old")).contains(new CredentialRecord("legacy-pass", NOW));
    CredentialRecord structured = collection.get("new").orElseThrow();
    assertThat(structured.secretValue()).isEqualTo("p");
    assertThat(structured.lastModified()).isEqualTo(Instant.parse("2024-02-03T04:05:00Z"));
    assertThat(structured.category()).isEqualTo("Work");
    CredentialRecord broken = collection.get("broken").orElseThrow();
    assertThat(broken.secretValue()).isEmpty();
    assertThat(broken.lastModified()).isEqualTo(NOW);
  }

  @Test
  void unseal_nonJsonPlaintextFails() {
    SealedVault sealed = sealRaw("not json at all".getBytes(UTF_8));
    assertThatThrownBy(() -> vaultCipher.unseal(sealed, secret))
        .isInstanceOf(DecryptionFailureException.class);
  }

  @Test
  void unseal_jsonArrayPlaintextFails() {
    SealedVault sealed = sealRaw("[1,2,3]".getBytes(UTF_8));
    assertThatThrownBy(() -> vaultCipher.unseal(sealed, secret))
        .isInstanceOf(DecryptionFailureException.class);
  }

  @Test
  void defaultCodecReadsLocalTimestampsInSystemZone() {
    VaultCodec codec = new VaultCodec();
    CredentialCollection collection = codec.decode(
        "{\"a\":{\"password\":\"x\",\"updatedAt\":\"2024-02-03T04:05:06.000\"}}".getBytes(UTF_8), NOW);
    assertThat(collection.get("a").orElseThrow().lastModified())
        .isEqualTo(LocalDateTime.parse("2024-02-03T04:05:06").atZone(ZoneId.systemDefault()).toInstant());
  }

  private SealedVault sealRaw(byte[] plaintext) {
    byte[] salt = new RandomProvider().randomBytes(16);
    byte[] nonce = new RandomProvider().randomBytes(24);
    byte[] key = keyDerivation.derive(secret, salt);
    return new SealedVault(salt, nonce, XChaCha20Poly1305.encrypt(key, nonce, plaintext));
  }
}
