package com.codeheadsystems.lockbox.crypto.model;

import java.time.Instant;
import java.util.Map;

/**
 * A structured entry. The timestamp is null when the stored value was missing or unreadable.
 *
 * @param secretValue     the secret value
 * @param lastModified    the last modified, may be null
 * @param category        the category, may be null
 * @param auxiliaryFields the auxiliary fields
 */
public record StructuredEntry(String secretValue,
                              Instant lastModified,
                              String category,
                              Map<String, String> auxiliaryFields) implements StoredEntry {

  @Override
  public CredentialRecord migrate(final Instant now) {
    return new CredentialRecord(
        secretValue == null ? "" : secretValue,
        lastModified == null ? now : lastModified,
        category,
        auxiliaryFields);
  }

  @Override
  public String toString() {
    return "StructuredEntry[secretValue=REDACTED, lastModified=" + lastModified
        + ", category=" + category + "]";
  }
}
