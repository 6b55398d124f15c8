package com.codeheadsystems.lockbox.crypto.vault;

import com.codeheadsystems.lockbox.crypto.common.ByteUtils;
import com.codeheadsystems.lockbox.crypto.common.RandomProvider;
import com.codeheadsystems.lockbox.crypto.exceptions.DecryptionFailureException;
import com.codeheadsystems.lockbox.crypto.kdf.KeyDerivation;
import com.codeheadsystems.lockbox.crypto.model.CredentialCollection;
import com.codeheadsystems.lockbox.crypto.secret.Secret;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Seals and unseals credential collections.
 * <p>
 * Every seal draws a fresh vault salt and nonce, so sealing the same collection twice yields
 * unrelated blobs. Unsealing fails with a single {@link DecryptionFailureException} for every
 * kind of failure and never returns partial plaintext.
 */
public class VaultCipher {

  private static final Logger log = LoggerFactory.getLogger(VaultCipher.class);

  private final KeyDerivation keyDerivation;
  private final RandomProvider randomProvider;
  private final VaultCodec codec;
  private final Clock clock;

  /**
   * Instantiates a vault cipher with the production key derivation.
   */
  public VaultCipher() {
    this(new KeyDerivation(), new RandomProvider(), new VaultCodec(), Clock.systemUTC());
  }

  /**
   * Instantiates a new Vault cipher.
   *
   * @param keyDerivation  the key derivation
   * @param randomProvider the random provider
   * @param codec          the codec
   * @param clock          clock used to timestamp migrated legacy entries
   */
  public VaultCipher(final KeyDerivation keyDerivation,
                     final RandomProvider randomProvider,
                     final VaultCodec codec,
                     final Clock clock) {
    log.info("VaultCipher({})", keyDerivation.parameters());
    this.keyDerivation = keyDerivation;
    this.randomProvider = randomProvider;
    this.codec = codec;
    this.clock = clock;
  }

  /**
   * Seals the collection under a key derived from the secret and a fresh salt.
   *
   * @param collection the collection
   * @param secret     the secret
   * @return the sealed vault
   */
  public SealedVault seal(final CredentialCollection collection, final Secret secret) {
    log.debug("seal(entries={})", collection.size());
    byte[] vaultSalt = randomProvider.randomBytes(KeyDerivation.SALT_LENGTH);
    byte[] nonce = randomProvider.randomBytes(XChaCha20Poly1305.NONCE_LENGTH);
    byte[] key = keyDerivation.derive(secret, vaultSalt);
    byte[] plaintext = codec.encode(collection);
    try {
      byte[] ciphertext = XChaCha20Poly1305.encrypt(key, nonce, plaintext);
      return new SealedVault(vaultSalt, nonce, ciphertext);
    } finally {
      ByteUtils.wipe(key, plaintext);
    }
  }

  /**
   * Opens a sealed vault. Legacy entries are migrated on the way out.
   *
   * @param sealed the sealed vault
   * @param secret the secret
   * @return the credential collection
   * @throws DecryptionFailureException if the secret is wrong or the blob was altered
   */
  public CredentialCollection unseal(final SealedVault sealed, final Secret secret) {
    log.debug("unseal()");
    byte[] vaultSalt = sealed.vaultSalt();
    byte[] nonce = sealed.nonce();
    if (vaultSalt.length != KeyDerivation.SALT_LENGTH || nonce.length != XChaCha20Poly1305.NONCE_LENGTH) {
      throw new DecryptionFailureException();
    }
    byte[] key = keyDerivation.derive(secret, vaultSalt);
    byte[] plaintext = null;
    try {
      plaintext = XChaCha20Poly1305.decrypt(key, nonce, sealed.ciphertext());
      return codec.decode(plaintext, clock.instant());
    } finally {
      ByteUtils.wipe(key, plaintext);
    }
  }
}
