package com.codeheadsystems.lockbox.crypto.model;

import java.time.Instant;
import java.util.Map;

/**
 * A pre-structured entry holding only the password string.
 *
 * @param secretValue the secret value
 */
public record LegacyEntry(String secretValue) implements StoredEntry {

  @Override
  public CredentialRecord migrate(final Instant now) {
    return new CredentialRecord(secretValue == null ? "" : secretValue, now, null, Map.of());
  }

  @Override
  public String toString() {
    return "LegacyEntry[REDACTED]";
  }
}
