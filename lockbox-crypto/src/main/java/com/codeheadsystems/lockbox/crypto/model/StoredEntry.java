package com.codeheadsystems.lockbox.crypto.model;

import java.time.Instant;

/**
 * An entry as it was found in a decrypted vault. Older vaults stored a bare string per title;
 * newer ones store an object. Both are normalized to a {@link CredentialRecord} once, when the
 * vault is unsealed.
 */
public sealed interface StoredEntry permits LegacyEntry, StructuredEntry {

  /**
   * Converts the stored form to a credential record.
   *
   * @param now timestamp to use where the stored form has none
   * @return the credential record
   */
  CredentialRecord migrate(Instant now);
}
