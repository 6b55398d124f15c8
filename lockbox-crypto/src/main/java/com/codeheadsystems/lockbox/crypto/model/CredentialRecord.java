package com.codeheadsystems.lockbox.crypto.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One entry of a credential collection.
 *
 * @param secretValue     the stored password
 * @param lastModified    when the entry was last changed
 * @param category        optional category, null when absent
 * @param auxiliaryFields optional extra string fields such as username or url
 */
public record CredentialRecord(String secretValue,
                               Instant lastModified,
                               String category,
                               Map<String, String> auxiliaryFields) {

  /**
   * Category reported for entries without one.
   */
  public static final String DEFAULT_CATEGORY = "Other";

  /**
   * Validates and copies the auxiliary fields into an immutable sorted map.
   */
  public CredentialRecord {
    if (secretValue == null) {
      throw new IllegalArgumentException("secretValue must not be null");
    }
    if (lastModified == null) {
      throw new IllegalArgumentException("lastModified must not be null");
    }
    auxiliaryFields = auxiliaryFields == null
        ? Map.of()
        : Collections.unmodifiableMap(new TreeMap<>(auxiliaryFields));
  }

  /**
   * Convenience constructor for an entry with only a value.
   *
   * @param secretValue  the secret value
   * @param lastModified the last modified
   */
  public CredentialRecord(final String secretValue, final Instant lastModified) {
    this(secretValue, lastModified, null, Map.of());
  }

  /**
   * The category, or {@link #DEFAULT_CATEGORY} when none was set.
   *
   * @return the category
   */
  public String categoryOrDefault() {
    return Optional.ofNullable(category).filter(c -> !c.isBlank()).orElse(DEFAULT_CATEGORY);
  }

  /**
   * Returns a copy with a new value and timestamp, keeping category and extra fields.
   *
   * @param newValue the new value
   * @param now      the modification time
   * @return the credential record
   */
  public CredentialRecord withSecretValue(final String newValue, final Instant now) {
    return new CredentialRecord(newValue, now, category, auxiliaryFields);
  }

  @Override
  public String toString() {
    return "CredentialRecord[secretValue=REDACTED, lastModified=" + lastModified
        + ", category=" + category + ", auxiliaryFields=" + auxiliaryFields.keySet() + "]";
  }
}
